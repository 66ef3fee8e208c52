package org.caureq.opsanomaly.service;

import lombok.extern.slf4j.Slf4j;
import org.caureq.opsanomaly.config.AppProps;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

@Slf4j
@Component
public class OsHostMetricsProbe implements HostMetricsProbe {
    private final Path diskPath;

    public OsHostMetricsProbe(AppProps props) {
        this.diskPath = Path.of(props.sampler().diskPath());
        log.info("[Sampler] probing cpu, memory and disk usage of {}", diskPath);
    }

    @Override
    public Reading read() {
        return new Reading(
                safely("cpu", this::cpuPercent),
                safely("memory", this::memoryPercent),
                safely("disk", this::diskPercent));
    }

    private Double cpuPercent() {
        var os = osBean();
        if (os == null) return null;
        double load = os.getCpuLoad();
        return load < 0 ? null : pct(load); // negative when the JVM has no reading yet
    }

    private Double memoryPercent() {
        var os = osBean();
        if (os == null) return null;
        long total = os.getTotalMemorySize();
        if (total <= 0) return null;
        return pct((double) (total - os.getFreeMemorySize()) / total);
    }

    private Double diskPercent() {
        try {
            var store = Files.getFileStore(diskPath);
            long total = store.getTotalSpace();
            if (total <= 0) return null;
            return pct((double) (total - store.getUnallocatedSpace()) / total);
        } catch (java.io.IOException e) {
            throw new IllegalStateException("cannot stat " + diskPath, e);
        }
    }

    private static com.sun.management.OperatingSystemMXBean osBean() {
        var bean = ManagementFactory.getOperatingSystemMXBean();
        return bean instanceof com.sun.management.OperatingSystemMXBean os ? os : null;
    }

    private static double pct(double fraction) {
        double p = Math.round(fraction * 1000.0) / 10.0;
        return Math.max(0.0, Math.min(100.0, p));
    }

    private static Double safely(String metric, Supplier<Double> reader) {
        try {
            return reader.get();
        } catch (RuntimeException e) {
            log.warn("[Sampler] {} reading failed: {}", metric, e.getMessage());
            return null;
        }
    }
}
