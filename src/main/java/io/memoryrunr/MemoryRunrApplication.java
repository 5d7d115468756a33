package io.memoryrunr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * MemoryRunr - biological memory consolidation pipeline driven by JobRunr.
 * Each stage (attention, episodes, consolidation, semantic network, homeostasis) runs as a recurring job.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MemoryRunrApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryRunrApplication.class, args);
    }
}
