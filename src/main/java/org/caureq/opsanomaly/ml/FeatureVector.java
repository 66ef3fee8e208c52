package org.caureq.opsanomaly.ml;

public record FeatureVector(double cpu, double memory, double disk) {

    public static FeatureVector of(double[] values) {
        CommonUtils.checkArgument(values.length == Feature.count(), "expected " + Feature.count() + " features");
        return new FeatureVector(values[0], values[1], values[2]);
    }

    public double[] toArray() {
        return new double[]{cpu, memory, disk};
    }
}
