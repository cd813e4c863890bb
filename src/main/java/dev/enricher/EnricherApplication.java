package dev.enricher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class EnricherApplication implements CommandLineRunner {

    private final QueueRunner queueRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(EnricherApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            queueRunner.start();
        } catch (Exception e) {
            log.error("Media Enricher failed to start: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
