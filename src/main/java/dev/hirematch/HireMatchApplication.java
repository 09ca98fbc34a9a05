package dev.hirematch;

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
public class HireMatchApplication implements CommandLineRunner {

    private final AnalysisRunner analysisRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(HireMatchApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            analysisRunner.execute();
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Hire match analysis failed: {}", e.getMessage());
            exitManager.exit(1);
        }
    }
}
