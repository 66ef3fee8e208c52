package org.caureq.opsanomaly.api.dto;

import org.caureq.opsanomaly.domain.Sample;

import java.time.LocalDateTime;

public record SamplePointDTO(
        Long id,
        LocalDateTime timestamp,
        Double cpuPercent,
        Double memoryPercent,
        Double diskPercent
) {
    public static SamplePointDTO of(Sample s) {
        return new SamplePointDTO(s.getId(), s.getTimestamp(), s.getCpuPercent(), s.getMemoryPercent(), s.getDiskPercent());
    }
}
