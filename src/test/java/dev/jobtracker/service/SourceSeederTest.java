package dev.jobtracker.service;

import dev.jobtracker.config.SourcesConfig;
import dev.jobtracker.entity.TrackedSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SourceSeederTest {

    @Mock
    private JobStoreService store;

    private static SourcesConfig.SeedSource seed(String name, String url, Boolean requiresBrowser) {
        SourcesConfig.SeedSource seed = new SourcesConfig.SeedSource();
        seed.setName(name);
        seed.setUrl(url);
        seed.setRequiresBrowser(requiresBrowser);
        return seed;
    }

    @Test
    @DisplayName("Should upsert every seed, applying the default fetch strategy")
    void shouldUpsertSeeds() {
        SourcesConfig config = new SourcesConfig();
        config.setDefaultRequiresBrowser(true);
        config.setSeed(List.of(
                seed("Acme", "https://acme.example/careers", null),
                seed(null, "https://globex.example/jobs", false)));

        new SourceSeeder(config, store).run(new DefaultApplicationArguments());

        verify(store).upsertSource("Acme", "https://acme.example/careers", true);
        verify(store).upsertSource(null, "https://globex.example/jobs", false);
    }

    @Test
    @DisplayName("Should skip invalid seeds and keep going")
    void shouldSkipInvalidSeed() {
        SourcesConfig config = new SourcesConfig();
        config.setSeed(List.of(
                seed("Broken", "not a url", null),
                seed("Acme", "https://acme.example/careers", null)));
        when(store.upsertSource("Broken", "not a url", false))
                .thenThrow(new IllegalArgumentException("Source URL must be an absolute http(s) URL"));
        when(store.upsertSource("Acme", "https://acme.example/careers", false)).thenReturn(TrackedSource.builder()
                .id(1L).name("Acme").url("https://acme.example/careers").build());

        new SourceSeeder(config, store).run(new DefaultApplicationArguments());

        verify(store).upsertSource("Acme", "https://acme.example/careers", false);
    }
}
