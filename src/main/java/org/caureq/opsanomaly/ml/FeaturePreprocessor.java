package org.caureq.opsanomaly.ml;

import lombok.extern.slf4j.Slf4j;
import org.caureq.opsanomaly.domain.Sample;

import java.util.List;

/**
 * Turns samples into the detector's input matrix: absent metrics are filled with a
 * per-feature mean, then every column is standardized.
 */
@Slf4j
public final class FeaturePreprocessor {

    public record Prepared(double[][] matrix, StandardScaler scaler) {}

    private FeaturePreprocessor() {
    }

    /**
     * Mean of the present values of each feature in the batch.
     *
     * @throws DataQualityException if a feature has no present value at all
     */
    public static double[] imputationMeans(List<Sample> batch) {
        Feature[] features = Feature.values();
        double[] means = new double[features.length];
        for (int j = 0; j < features.length; j++) {
            double sum = 0.0;
            int n = 0;
            for (Sample s : batch) {
                Double v = features[j].read(s);
                if (v != null) { sum += v; n++; }
            }
            if (n == 0) throw new DataQualityException(features[j], batch.size());
            means[j] = sum / n;
            if (n < batch.size()) {
                log.debug("{}: {} absent values filled with {}", features[j].column(), batch.size() - n, means[j]);
            }
        }
        return means;
    }

    public static List<FeatureVector> impute(List<Sample> batch, double[] means) {
        CommonUtils.checkArgument(means.length == Feature.count(), "expected " + Feature.count() + " means");
        Feature[] features = Feature.values();
        return batch.stream().map(s -> {
            double[] row = new double[features.length];
            for (int j = 0; j < features.length; j++) {
                Double v = features[j].read(s);
                row[j] = v == null ? means[j] : v;
            }
            return FeatureVector.of(row);
        }).toList();
    }

    public static double[][] toMatrix(List<FeatureVector> vectors) {
        double[][] m = new double[vectors.size()][];
        for (int i = 0; i < m.length; i++) m[i] = vectors.get(i).toArray();
        return m;
    }

    /** Training path: fill with batch means, fit the scaler on the filled matrix, standardize. */
    public static Prepared fitTransform(List<Sample> batch) {
        CommonUtils.checkArgument(!batch.isEmpty(), "cannot preprocess an empty batch");
        double[] means = imputationMeans(batch);
        double[][] filled = toMatrix(impute(batch, means));
        StandardScaler scaler = StandardScaler.fit(filled, means);
        return new Prepared(scaler.transform(filled), scaler);
    }

    /**
     * Scoring path: never refits the scaler. Under {@link ImputationPolicy#BATCH} the fill
     * values come from this batch and a {@link DataQualityException} may be thrown.
     */
    public static double[][] transform(List<Sample> batch, StandardScaler scaler, ImputationPolicy policy) {
        if (batch.isEmpty()) return new double[0][];
        double[] means = policy == ImputationPolicy.BATCH ? imputationMeans(batch) : scaler.imputationMeans();
        return scaler.transform(toMatrix(impute(batch, means)));
    }
}
