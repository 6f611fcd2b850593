package dev.jobtracker;

import dev.jobtracker.config.TrackerProperties;
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
public class JobTrackerApplication implements CommandLineRunner {

    private final TrackerProperties properties;
    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(JobTrackerApplication.class, args);
    }

    @Override
    public void run(String... args) {
        if (!properties.isRunOnce()) {
            log.info("Job Pipeline Tracker started in service mode");
            return;
        }
        int status;
        try {
            status = pipelineRunner.execute();
        } catch (RuntimeException e) {
            log.error("Job Pipeline Tracker failed: {}", e.getMessage(), e);
            status = 1;
        }
        log.info("Job Pipeline Tracker exiting with status {}", status);
        exitManager.exit(status);
    }
}
