package io.bastion.api.error;

import com.fasterxml.jackson.databind.JsonNode;

public final class AuthenticationException extends ApiException {

    public AuthenticationException(String message, Integer statusCode, JsonNode response) {
        super(message, ErrorCode.AUTH, statusCode, response);
    }
}
