package com.phillippitts.podcastbuddy.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the persistent user memory file.
 */
@Validated
@ConfigurationProperties(prefix = "podcast.memory")
public class MemoryProperties {

    @NotBlank
    private final String file;

    /** Topics and opinions kept on disk; older entries are dropped. */
    @Min(1)
    private final int maxEntries;

    /** Most recent topics and opinions included in the prompt summary. */
    @Min(1)
    private final int summaryEntries;

    @ConstructorBinding
    public MemoryProperties(String file, Integer maxEntries, Integer summaryEntries) {
        this.file = file == null ? "data/memory.json" : file;
        this.maxEntries = maxEntries == null ? 100 : maxEntries;
        this.summaryEntries = summaryEntries == null ? 5 : summaryEntries;
    }

    public String getFile() {
        return file;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public int getSummaryEntries() {
        return summaryEntries;
    }
}
