package io.bastion.core.health;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.time.Duration;

/**
 * A single liveness check against one service.
 * Returning false or throwing both mean unhealthy.
 */
@FunctionalInterface
public interface HealthProbe {

    boolean probe() throws Exception;

    /**
     * Probe that succeeds if a TCP connection to the URL's host and port can be opened.
     */
    static HealthProbe tcp(String url, Duration timeout) {
        URI uri = URI.create(url);
        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }
        int port = uri.getPort() != -1 ? uri.getPort() : ("https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80);
        return () -> {
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
                return true;
            } catch (IOException e) {
                throw new IOException("Cannot connect to " + host + ":" + port, e);
            }
        };
    }
}
