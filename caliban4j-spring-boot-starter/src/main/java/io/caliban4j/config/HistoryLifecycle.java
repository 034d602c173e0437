package io.caliban4j.config;

import io.caliban4j.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Ties the history store's lifetime to the Spring container: the store is opened when the
 * context starts and closed when it stops.
 */
public class HistoryLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(HistoryLifecycle.class);

    private final Storage storage;
    private volatile boolean running = false;

    public HistoryLifecycle(Storage storage) {
        this.storage = storage;
    }

    @Override
    public void start() {
        running = true;
        log.debug("history store ready storage={}", storage.getClass().getSimpleName());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        storage.close();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
