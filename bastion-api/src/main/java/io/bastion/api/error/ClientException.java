package io.bastion.api.error;

import com.fasterxml.jackson.databind.JsonNode;

public final class ClientException extends ApiException {

    public ClientException(String message, Integer statusCode, JsonNode response) {
        super(message, ErrorCode.CLIENT, statusCode, response);
    }

    public ClientException(String message, Integer statusCode, Throwable cause) {
        super(message, ErrorCode.CLIENT, statusCode, null, cause);
    }
}
