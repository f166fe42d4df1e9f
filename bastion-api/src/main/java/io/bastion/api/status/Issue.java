package io.bastion.api.status;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A recorded diagnostic finding.
 *
 * @param stackSnapshot frames of the recording thread at the time the issue was raised
 */
public record Issue(
        Instant timestamp,
        String category,
        Severity severity,
        String message,
        Map<String, Object> context,
        List<String> stackSnapshot
) {

    public Issue {
        context = context == null ? Map.of() : Map.copyOf(context);
        stackSnapshot = stackSnapshot == null ? List.of() : List.copyOf(stackSnapshot);
    }
}
