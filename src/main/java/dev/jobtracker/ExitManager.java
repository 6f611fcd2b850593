package dev.jobtracker;

import dev.jobtracker.config.TrackerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Ends the process after a run-once execution: closes the application context so the scheduler
 * and open sessions shut down, then exits the JVM with the run status.
 * The JVM exit is skipped when {@code tracker.exit-jvm} is false.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExitManager {

  private final ConfigurableApplicationContext context;
  private final TrackerProperties properties;

  public void exit(int status) {
    int code = SpringApplication.exit(context, () -> status);
    if (!properties.isExitJvm()) {
      log.info("Application context closed with status {}, JVM left running", code);
      return;
    }
    System.exit(code);
  }
}
