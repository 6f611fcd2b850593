package dev.jobtracker.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Closes run records a previous process left RUNNING. The run guard lives in memory, so at
 * startup no such record can belong to a live run.
 */
@Slf4j
@Component
@Order(0)
@RequiredArgsConstructor
public class RunRecoveryRunner implements ApplicationRunner {

    private final JobStoreService store;

    @Override
    public void run(ApplicationArguments args) {
        int recovered = store.recoverInterruptedRuns();
        if (recovered > 0) {
            log.warn("Marked {} interrupted run(s) as FAILED", recovered);
        }
    }
}
