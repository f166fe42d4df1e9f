package io.bastion.api.status;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CircuitState {
    CLOSED("closed"),
    OPEN("open"),
    HALF_OPEN("half_open");

    private final String value;

    CircuitState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
