package io.bastion.api.status;

import java.time.Instant;

public record StateTransition(Instant timestamp, CircuitState from, CircuitState to) {}
