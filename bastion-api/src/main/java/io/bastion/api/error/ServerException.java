package io.bastion.api.error;

import com.fasterxml.jackson.databind.JsonNode;

public final class ServerException extends ApiException {

    public ServerException(String message, Integer statusCode, JsonNode response) {
        super(message, ErrorCode.SERVER, statusCode, response);
    }
}
