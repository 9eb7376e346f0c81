package com.phillippitts.podcastbuddy;

import com.phillippitts.podcastbuddy.config.properties.ConversationProperties;
import com.phillippitts.podcastbuddy.config.properties.LlmProperties;
import com.phillippitts.podcastbuddy.config.properties.MemoryProperties;
import com.phillippitts.podcastbuddy.config.properties.PlaybackProperties;
import com.phillippitts.podcastbuddy.config.properties.SynthesisProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ConversationProperties.class,
        LlmProperties.class,
        SynthesisProperties.class,
        PlaybackProperties.class,
        MemoryProperties.class
})
@EnableScheduling
public class PodcastBuddyApplication {

    public static void main(String[] args) {
        SpringApplication.run(PodcastBuddyApplication.class, args);
    }

}
