package io.caliban4j;

/**
 * Unit of work over a {@link Storage}. Closing without {@link #commit()} rolls back.
 */
public interface Transaction extends AutoCloseable {

    void commit();

    void rollback();

    boolean isActive();

    @Override
    void close();
}
