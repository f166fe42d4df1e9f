package io.bastion.api.error;

/**
 * Raised when no pooled session frees up within the acquire timeout.
 */
public final class ConnectionExhaustedException extends ApiException {

    public ConnectionExhaustedException(String message) {
        super(message, ErrorCode.NETWORK);
    }
}
