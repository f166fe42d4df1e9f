package io.bastion.api.transport;

/**
 * Factory for transport sessions. Implementations own whatever underlying client
 * the sessions share and release it on {@link #close()}.
 */
public interface Transport extends AutoCloseable {

    TransportSession openSession();

    @Override
    void close();
}
