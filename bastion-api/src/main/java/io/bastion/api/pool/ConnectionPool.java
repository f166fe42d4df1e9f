package io.bastion.api.pool;

import io.bastion.api.transport.TransportSession;

import java.time.Duration;

/**
 * Bounded pool of reusable transport sessions.
 * <p>
 * The number of sessions issued at once never exceeds {@link #maxSize()}. Sessions are
 * created lazily; exhaustion is reported to the caller rather than retried here.
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * Take a session from the pool, creating one if none is ready and capacity remains.
     *
     * @param timeout how long to wait for a session to be released
     * @return a session for exclusive use until {@link #release(TransportSession)}
     * @throws io.bastion.api.error.ConnectionExhaustedException if none frees up in time
     */
    TransportSession acquire(Duration timeout);

    /**
     * Return a session previously obtained from {@link #acquire(Duration)}.
     */
    void release(TransportSession session);

    /**
     * @return number of sessions currently checked out
     */
    int activeCount();

    /**
     * @return number of idle sessions ready to be handed out
     */
    int availableCount();

    /**
     * @return maximum number of sessions that may be checked out at once
     */
    int maxSize();

    /**
     * Close all idle sessions. Sessions still checked out are closed when released.
     */
    @Override
    void close();
}
