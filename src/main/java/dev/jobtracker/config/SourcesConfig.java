package dev.jobtracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Career pages registered at startup when they are not tracked yet.
 * Loaded from application.yml under 'tracker.sources'.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "tracker.sources")
public class SourcesConfig {

    /** Fetch strategy for seed entries that do not set requires-browser. */
    private boolean defaultRequiresBrowser = false;

    private List<SeedSource> seed = new ArrayList<>();

    @Data
    public static class SeedSource {
        private String name;
        private String url;
        private Boolean requiresBrowser;
    }
}
