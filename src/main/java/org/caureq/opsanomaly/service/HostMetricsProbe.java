package org.caureq.opsanomaly.service;

/** A metric that cannot be read is null; the others are still returned. */
public interface HostMetricsProbe {

    Reading read();

    record Reading(Double cpuPercent, Double memoryPercent, Double diskPercent) {}
}
