package org.caureq.opsanomaly.api.error;

import java.time.Instant;
import java.util.Map;

/** Error body of every failed API call; {@code details} carries code-specific fields. */
public record ApiError(
        Instant timestamp,
        String path,
        ErrorCode code,
        String message,
        String correlationId,
        Map<String, Object> details
) { }
