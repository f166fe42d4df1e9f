package io.bastion.api.transport;

import java.io.IOException;
import java.util.Map;

/**
 * A reusable session against an upstream. Sessions are handed out by a connection pool
 * and are used by one caller at a time.
 */
public interface TransportSession extends AutoCloseable {

    /**
     * Set a header sent with every request on this session.
     */
    void header(String name, String value);

    /**
     * @return an immutable view of the session's default headers
     */
    Map<String, String> headers();

    /**
     * Perform one exchange.
     *
     * @throws java.net.http.HttpTimeoutException if the exchange exceeded its timeout
     * @throws IOException                        on connection-level failure
     * @throws InterruptedException               if the calling thread was interrupted
     */
    TransportResponse send(TransportRequest request) throws IOException, InterruptedException;

    @Override
    void close();
}
