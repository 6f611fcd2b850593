package dev.jobtracker.service;

import dev.jobtracker.config.SourcesConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Registers the sources listed under {@code tracker.sources.seed} at startup.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class SourceSeeder implements ApplicationRunner {

    private final SourcesConfig sourcesConfig;
    private final JobStoreService store;

    @Override
    public void run(ApplicationArguments args) {
        int seeded = 0;
        for (SourcesConfig.SeedSource seed : sourcesConfig.getSeed()) {
            boolean requiresBrowser = seed.getRequiresBrowser() != null
                    ? seed.getRequiresBrowser()
                    : sourcesConfig.isDefaultRequiresBrowser();
            try {
                store.upsertSource(seed.getName(), seed.getUrl(), requiresBrowser);
                seeded++;
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring seed source '{}': {}", seed.getName(), e.getMessage());
            }
        }
        if (seeded > 0) {
            log.info("Seeded {} sources from configuration", seeded);
        }
    }
}
