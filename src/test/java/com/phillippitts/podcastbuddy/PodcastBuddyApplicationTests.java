package com.phillippitts.podcastbuddy;

import com.phillippitts.podcastbuddy.service.orchestration.ConversationSessionFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
    properties = {
        "podcast.warmup.enabled=false", // avoid requiring a model server or voice model in tests
        "podcast.memory.file=target/test-memory.json"
    }
)
class PodcastBuddyApplicationTests {

    @Autowired
    private ConversationSessionFactory sessionFactory;

    @Test
    void contextLoads() {
        assertThat(sessionFactory).isNotNull();
    }

}
