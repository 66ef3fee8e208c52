package org.caureq.opsanomaly.ml;

import lombok.Builder;

/**
 * Training parameters of an {@link IsolationForest}.
 *
 * @param contamination            expected fraction of anomalies in the training batch, in (0, 0.5]
 * @param numberOfTrees            ensemble size
 * @param maxSamples               points drawn (without replacement) to grow each tree, capped at the batch size
 * @param randomSeed               seed of the pseudorandom source; same seed and data give the same trees
 * @param parallelExecutionEnabled grow trees on the common fork-join pool; does not change the result
 */
@Builder(toBuilder = true)
public record DetectorOptions(double contamination, int numberOfTrees, int maxSamples, long randomSeed,
                              boolean parallelExecutionEnabled) {

    public static final double DEFAULT_CONTAMINATION = 0.05;
    public static final int DEFAULT_NUMBER_OF_TREES = 100;
    public static final int DEFAULT_MAX_SAMPLES = 256;
    public static final long DEFAULT_RANDOM_SEED = 42L;

    public DetectorOptions {
        CommonUtils.checkArgument(contamination > 0.0 && contamination <= 0.5, "contamination must be in (0, 0.5]");
        CommonUtils.checkArgument(numberOfTrees > 0, "numberOfTrees must be positive");
        CommonUtils.checkArgument(maxSamples > 0, "maxSamples must be positive");
    }

    public static DetectorOptions defaults() {
        return new DetectorOptions(DEFAULT_CONTAMINATION, DEFAULT_NUMBER_OF_TREES, DEFAULT_MAX_SAMPLES,
                DEFAULT_RANDOM_SEED, false);
    }
}
