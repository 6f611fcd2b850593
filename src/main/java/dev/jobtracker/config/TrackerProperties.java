package dev.jobtracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Pipeline tunables. Loaded from application.yml under the 'tracker' prefix.
 * Only the scheduler settings are meant to be changed by operators; the rest are internal defaults.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    /** Execute a single manual run at startup and exit. */
    private boolean runOnce = false;

    /** Terminate the JVM once a run-once execution has closed the context. */
    private boolean exitJvm = true;

    /** Log the notification batch instead of sending it. */
    private boolean dryRun = false;

    private Fetch fetch = new Fetch();
    private Extraction extraction = new Extraction();
    private Pipeline pipeline = new Pipeline();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Fetch {
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRedirects = 5;
        private int maxInMemoryBytes = 10 * 1024 * 1024;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36";
        private boolean headless = true;
        private Duration browserTimeout = Duration.ofSeconds(90);
        private Duration browserPageLoadTimeout = Duration.ofSeconds(30);
        private Duration browserContentWait = Duration.ofSeconds(5);
        private Duration browserScrollWait = Duration.ofSeconds(2);
    }

    @Data
    public static class Extraction {
        private String provider = "gemini";
        private int maxContentBytes = 800_000;
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Pipeline {
        /** Extra fetch attempts for network and timeout failures. */
        private int fetchRetries = 1;
        private Duration retryBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private int intervalMinutes = 60;
    }
}
