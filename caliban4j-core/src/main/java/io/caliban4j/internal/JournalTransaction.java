package io.caliban4j.internal;

import io.caliban4j.Transaction;
import io.caliban4j.core.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Transaction backed by an undo journal. Each write registers its inverse; rollback replays
 * them newest first.
 */
public class JournalTransaction implements Transaction {
    private static final Logger log = LoggerFactory.getLogger(JournalTransaction.class);

    private final Deque<Runnable> undo = new ArrayDeque<>();
    private final Runnable onCommit;
    private final Runnable onFinish;
    private boolean active = true;

    public JournalTransaction(Runnable onCommit, Runnable onFinish) {
        this.onCommit = Objects.requireNonNull(onCommit, "onCommit must not be null");
        this.onFinish = Objects.requireNonNull(onFinish, "onFinish must not be null");
    }

    void record(Runnable inverse) {
        ensureActive();
        undo.push(inverse);
    }

    @Override
    public void commit() {
        ensureActive();
        int writes = undo.size();
        undo.clear();
        finish();
        onCommit.run();
        log.debug("transaction committed writes={}", writes);
    }

    @Override
    public void rollback() {
        ensureActive();
        int writes = undo.size();
        StorageException failure = null;
        while (!undo.isEmpty()) {
            try {
                undo.pop().run();
            } catch (RuntimeException e) {
                log.error("transaction rollback step failed msg={}", e.getMessage(), e);
                if (failure == null) {
                    failure = new StorageException("rollback incomplete", e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        finish();
        log.debug("transaction rolled back writes={}", writes);
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void close() {
        if (active) {
            rollback();
        }
    }

    private void finish() {
        active = false;
        onFinish.run();
    }

    private void ensureActive() {
        if (!active) {
            throw new IllegalStateException("transaction is no longer active");
        }
    }
}
