package io.bastion.core.breaker;

import io.bastion.api.config.ClientConfig;
import io.bastion.api.status.CircuitState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BreakerRegistryTest {

    private final ClientConfig config = ClientConfig.create("https://api.example.com").failureThreshold(2);

    @Test
    void shouldRegisterDefaultUpstreams() {
        var registry = new BreakerRegistry(config);

        assertThat(registry.allBreakers())
                .extracting(CircuitBreaker::name)
                .containsExactly("api", "cache-backend", "panel");
    }

    @Test
    void shouldThrowForUnknownUpstream() {
        var registry = new BreakerRegistry(config);

        assertThatThrownBy(() -> registry.breaker("billing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("billing");
    }

    @Test
    void shouldIsolateBreakersPerUpstream() {
        var registry = new BreakerRegistry(config);

        registry.breaker("panel").recordFailure();
        registry.breaker("panel").recordFailure();

        assertThat(registry.breaker("panel").state()).isEqualTo(CircuitState.OPEN);
        assertThat(registry.breaker("api").state()).isEqualTo(CircuitState.CLOSED);
        assertThat(registry.metrics()).containsOnlyKeys("api", "cache-backend", "panel");
        assertThat(registry.metrics().get("panel").state()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    void shouldAcceptCustomUpstreams() {
        var registry = new BreakerRegistry(config, "billing");

        assertThat(registry.breaker("billing").name()).isEqualTo("billing");
        assertThatThrownBy(() -> registry.breaker("api")).isInstanceOf(IllegalArgumentException.class);
    }
}
