package io.bastion.core.pool;

import io.bastion.api.error.ConnectionExhaustedException;
import io.bastion.api.pool.ConnectionPool;
import io.bastion.api.transport.Transport;
import io.bastion.api.transport.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session pool for one upstream transport.
 * <p>
 * Sessions are created lazily up to {@code maxSize}. Callers that find the pool empty and
 * at capacity wait for a release; if none arrives within the acquire timeout they get a
 * {@link ConnectionExhaustedException}. The ready set and counters share a single lock.
 */
public class DefaultConnectionPool implements ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(DefaultConnectionPool.class);

    private final String name;
    private final Transport transport;
    private final int maxSize;
    private final String userAgent;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();
    private final Deque<TransportSession> ready = new ArrayDeque<>();
    private int active;
    private int created;
    private int waiting;
    private boolean closed;

    private final AtomicLong acquiredCount = new AtomicLong(0);
    private final AtomicLong exhaustedCount = new AtomicLong(0);

    public DefaultConnectionPool(String name, Transport transport, int maxSize, String userAgent) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive");
        }
        this.name = name;
        this.transport = transport;
        this.maxSize = maxSize;
        this.userAgent = userAgent;
        log.info("Created connection pool '{}' with max {} sessions", name, maxSize);
    }

    @Override
    public TransportSession acquire(Duration timeout) {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                if (closed) {
                    throw new IllegalStateException("Connection pool '" + name + "' is closed");
                }
                TransportSession session = ready.pollFirst();
                if (session != null) {
                    active++;
                    acquiredCount.incrementAndGet();
                    return session;
                }
                if (created < maxSize) {
                    // reserve the slot, the session itself is opened outside the lock
                    created++;
                    active++;
                    break;
                }
                if (remaining <= 0) {
                    exhaustedCount.incrementAndGet();
                    throw new ConnectionExhaustedException("Connection pool '" + name + "' exhausted after waiting "
                            + TimeUnit.NANOSECONDS.toMillis(timeout.toNanos()) + "ms");
                }
                waiting++;
                try {
                    remaining = released.awaitNanos(remaining);
                } finally {
                    waiting--;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionExhaustedException("Interrupted while waiting for a session from pool '" + name + "'");
        } finally {
            lock.unlock();
        }

        try {
            TransportSession session = openSession();
            acquiredCount.incrementAndGet();
            return session;
        } catch (RuntimeException e) {
            lock.lock();
            try {
                created--;
                active--;
                released.signal();
            } finally {
                lock.unlock();
            }
            throw e;
        }
    }

    @Override
    public void release(TransportSession session) {
        if (session == null) {
            return;
        }
        boolean discard;
        lock.lock();
        try {
            active--;
            discard = closed || ready.size() >= maxSize;
            if (discard) {
                created--;
            } else {
                ready.addFirst(session);
            }
            released.signal();
        } finally {
            lock.unlock();
        }
        if (discard) {
            session.close();
            log.debug("Discarded session on release to pool '{}'", name);
        }
    }

    private TransportSession openSession() {
        TransportSession session = transport.openSession();
        session.header("Content-Type", "application/json");
        session.header("Accept", "application/json");
        session.header("User-Agent", userAgent);
        log.debug("Opened new session for pool '{}'", name);
        return session;
    }

    public String name() {
        return name;
    }

    @Override
    public int activeCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int availableCount() {
        lock.lock();
        try {
            return ready.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int maxSize() {
        return maxSize;
    }

    public int waitingCount() {
        lock.lock();
        try {
            return waiting;
        } finally {
            lock.unlock();
        }
    }

    public long acquiredCount() {
        return acquiredCount.get();
    }

    public long exhaustedCount() {
        return exhaustedCount.get();
    }

    @Override
    public void close() {
        Deque<TransportSession> idle;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            idle = new ArrayDeque<>(ready);
            created -= ready.size();
            ready.clear();
            released.signalAll();
        } finally {
            lock.unlock();
        }
        idle.forEach(TransportSession::close);
        log.info("Pool '{}' closed. Acquired: {}, Exhausted: {}", name, acquiredCount.get(), exhaustedCount.get());
    }
}
