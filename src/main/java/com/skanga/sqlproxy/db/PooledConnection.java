package com.skanga.sqlproxy.db;

import java.sql.Connection;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A connection checked out from a {@link ConnectionPool}.
 * Closing it releases the underlying connection exactly once; later calls are no-ops.
 */
public final class PooledConnection implements AutoCloseable {
    private final Connection connection;
    private final ConnectionPool owningPool;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean broken;

    PooledConnection(Connection connection, ConnectionPool owningPool) {
        this.connection = connection;
        this.owningPool = owningPool;
    }

    public Connection connection() {
        return connection;
    }

    /**
     * Flags the connection as unusable so it is discarded instead of returned to the idle set.
     */
    public void markBroken() {
        broken = true;
    }

    public boolean isBroken() {
        return broken;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            owningPool.release(connection, broken);
        }
    }
}
