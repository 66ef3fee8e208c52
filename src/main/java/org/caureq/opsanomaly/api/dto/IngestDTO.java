package org.caureq.opsanomaly.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

import java.time.LocalDateTime;

/** Sample pushed by an external collector. A null metric is stored as absent; a null timestamp means "now". */
public record IngestDTO(
        LocalDateTime timestamp,
        @DecimalMin("0.0") @DecimalMax("100.0") Double cpuPercent,
        @DecimalMin("0.0") @DecimalMax("100.0") Double memoryPercent,
        @DecimalMin("0.0") @DecimalMax("100.0") Double diskPercent
) {}
