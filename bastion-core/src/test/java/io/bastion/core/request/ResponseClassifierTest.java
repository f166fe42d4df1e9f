package io.bastion.core.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bastion.api.error.*;
import io.bastion.api.response.ApiResponse;
import io.bastion.api.transport.TransportResponse;
import io.bastion.core.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ResponseClassifierTest {

    private final MutableClock clock = new MutableClock();
    private final ResponseClassifier classifier = new ResponseClassifier(new ObjectMapper(), clock);

    private static TransportResponse response(int status, String body) {
        return new TransportResponse(status, Map.of(), body);
    }

    // --- success ---

    @Test
    void shouldDecodeJsonBody() {
        ApiResponse<JsonNode> result = classifier.classify(response(200, "{\"id\":42,\"plan\":\"monthly\"}"));

        assertThat(result.success()).isTrue();
        assertThat(result.cached()).isFalse();
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.data().get("id").asInt()).isEqualTo(42);
        assertThat(result.timestamp()).isEqualTo(clock.instant());
    }

    @Test
    void shouldTreatEmptyBodyAsSuccessWithoutData() {
        ApiResponse<JsonNode> result = classifier.classify(response(204, ""));

        assertThat(result.success()).isTrue();
        assertThat(result.data()).isNull();
        assertThat(result.statusCode()).isEqualTo(204);
    }

    @Test
    void shouldRejectInvalidJson() {
        assertThatThrownBy(() -> classifier.classify(response(200, "<html>oops</html>")))
                .isInstanceOf(ClientException.class)
                .hasMessage("Invalid JSON response");
    }

    // --- status table ---

    @Test
    void shouldMapUnauthorizedToAuthentication() {
        var e = catchThrowableOfType(() -> classifier.classify(response(401, "{\"message\":\"expired\"}")),
                AuthenticationException.class);

        assertThat(e.errorCode()).isEqualTo(ErrorCode.AUTH);
        assertThat(e.statusCode()).contains(401);
        assertThat(e.response()).isPresent();
        assertThat(e.isRetryable()).isFalse();
    }

    @Test
    void shouldReadRetryAfterHeaderOnTooManyRequests() {
        var limited = new TransportResponse(429, Map.of("retry-after", "7"), "");

        var e = catchThrowableOfType(() -> classifier.classify(limited), RateLimitException.class);

        assertThat(e.retryAfterSeconds()).isEqualTo(7);
        assertThat(e.isRetryable()).isTrue();
    }

    @Test
    void shouldDefaultRetryAfterToSixtySeconds() {
        var e = catchThrowableOfType(() -> classifier.classify(response(429, "")), RateLimitException.class);

        assertThat(e.retryAfterSeconds()).isEqualTo(60);
    }

    @Test
    void shouldMapServerErrors() {
        var e = catchThrowableOfType(() -> classifier.classify(response(503, "unavailable")),
                ServerException.class);

        assertThat(e.statusCode()).contains(503);
        assertThat(e.response().get().get("message").asText()).isEqualTo("unavailable");
        assertThat(e.isRetryable()).isTrue();
    }

    @Test
    void shouldCarryResourceOnNotFound() {
        String body = "{\"message\":\"Order missing\",\"resource\":{\"type\":\"order\",\"id\":\"42\"}}";

        var e = catchThrowableOfType(() -> classifier.classify(response(404, body)), NotFoundException.class);

        assertThat(e).hasMessage("Order missing");
        assertThat(e.resourceType()).isEqualTo("order");
        assertThat(e.resourceId()).isEqualTo("42");
    }

    @Test
    void shouldDefaultResourceOnBareNotFound() {
        var e = catchThrowableOfType(() -> classifier.classify(response(404, "")), NotFoundException.class);

        assertThat(e).hasMessage("Resource not found");
        assertThat(e.resourceType()).isEqualTo("unknown");
        assertThat(e.resourceId()).isNull();
    }

    @Test
    void shouldCarryFieldErrorsOnValidationFailure() {
        String body = "{\"message\":\"Invalid order\",\"errors\":{\"email\":[\"is invalid\"],\"plan\":\"required\"}}";

        var e = catchThrowableOfType(() -> classifier.classify(response(422, body)), ValidationException.class);

        assertThat(e).hasMessage("Invalid order");
        assertThat(e.fieldErrors())
                .containsEntry("email", List.of("is invalid"))
                .containsEntry("plan", List.of("required"));
        assertThat(e.statusCode()).contains(422);
    }

    @Test
    void shouldMapOtherClientErrorsWithPlainTextMessage() {
        var e = catchThrowableOfType(() -> classifier.classify(response(400, "bad request body")),
                ClientException.class);

        assertThat(e).hasMessage("bad request body");
        assertThat(e.statusCode()).contains(400);
    }

    // --- transport failures ---

    @Test
    void shouldClassifyTimeouts() {
        ApiException e = classifier.classifyTransportFailure(new HttpTimeoutException("request timed out"));

        assertThat(e.errorCode()).isEqualTo(ErrorCode.TIMEOUT);
        assertThat(e.isRetryable()).isFalse();
    }

    @Test
    void shouldClassifyConnectionFailuresAsNetwork() {
        ApiException e = classifier.classifyTransportFailure(new ConnectException("Connection refused"));

        assertThat(e.errorCode()).isEqualTo(ErrorCode.NETWORK);
        assertThat(e).hasCauseInstanceOf(ConnectException.class);
    }
}
