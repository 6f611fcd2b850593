package dev.jobtracker.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide single-run lock. Acquisition is a test-and-set; a second caller is rejected, never queued.
 */
@Component
public class RunGuard {

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @return a permit to release with try-with-resources
     * @throws PipelineAlreadyRunningException when another run holds the guard
     */
    public Permit acquire() {
        if (!running.compareAndSet(false, true)) {
            throw new PipelineAlreadyRunningException();
        }
        return new Permit();
    }

    public boolean isRunning() {
        return running.get();
    }

    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        /**
         * Release the guard. Only the first call has an effect.
         */
        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                running.set(false);
            }
        }
    }
}
