package dev.beacon;

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
public class BeaconApplication implements CommandLineRunner {

    private final FeedRunner feedRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(BeaconApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            feedRunner.execute();
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Beacon matcher failed: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
