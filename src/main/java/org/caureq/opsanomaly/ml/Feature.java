package org.caureq.opsanomaly.ml;

import org.caureq.opsanomaly.domain.Sample;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Model input columns. The declaration order is the matrix column order and must be
 * identical between training and scoring.
 */
public enum Feature {
    CPU_PERCENT("cpu_percent", Sample::getCpuPercent),
    MEMORY_PERCENT("memory_percent", Sample::getMemoryPercent),
    DISK_PERCENT("disk_percent", Sample::getDiskPercent);

    public static final List<String> COLUMN_ORDER =
            Arrays.stream(values()).map(Feature::column).toList();

    private final String column;
    private final Function<Sample, Double> reader;

    Feature(String column, Function<Sample, Double> reader) {
        this.column = column;
        this.reader = reader;
    }

    public String column() { return column; }

    public Double read(Sample s) { return reader.apply(s); }

    public static int count() { return values().length; }
}
