package io.caliban4j.core;

import java.time.Instant;

/**
 * Common shape of every persisted history entity.
 */
public interface HistoryObject {
    String id();

    Instant timestamp();
}
