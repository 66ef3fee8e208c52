package org.caureq.opsanomaly.ml;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Ensemble of {@link IsolationTree}s. Points that are few and different end up in shallow
 * leaves, so a short average path length means a high anomaly score.
 *
 * <p>Scores are {@code 2^(-E[h(x)] / c(subSampleSize))} in (0, 1]: close to 1 for
 * anomalies, around 0.5 for ordinary points. {@code threshold} is the
 * {@code (1 - contamination)} quantile of the training scores; a point scoring strictly
 * above it is labelled {@link #ANOMALY}.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
@Slf4j
public record IsolationForest(List<IsolationTree> trees, int subSampleSize, double contamination, long randomSeed,
                              double threshold) {

    public static final int ANOMALY = -1;
    public static final int NORMAL = 1;

    public IsolationForest {
        CommonUtils.checkArgument(trees != null && !trees.isEmpty(), "a forest needs at least one tree");
        trees = List.copyOf(trees);
    }

    /**
     * @throws InsufficientDataException if {@code data} has no rows
     */
    public static IsolationForest fit(double[][] data, DetectorOptions options) {
        if (data.length == 0) {
            throw new InsufficientDataException("cannot train a detector on an empty matrix");
        }
        int subSampleSize = Math.min(options.maxSamples(), data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(subSampleSize, 2)) / Math.log(2));

        // one seed per tree, drawn up front so tree order does not depend on scheduling
        Random master = new Random(options.randomSeed());
        long[] treeSeeds = new long[options.numberOfTrees()];
        for (int i = 0; i < treeSeeds.length; i++) treeSeeds[i] = master.nextLong();

        IntStream range = IntStream.range(0, treeSeeds.length);
        if (options.parallelExecutionEnabled()) range = range.parallel();
        List<IsolationTree> trees = range.mapToObj(i -> {
            Random random = new Random(treeSeeds[i]);
            int[] sample = subsample(data.length, subSampleSize, random);
            return IsolationTree.grow(data, sample, maxDepth, random);
        }).toList();

        var unthresholded = new IsolationForest(trees, subSampleSize, options.contamination(),
                options.randomSeed(), Double.NaN);
        double threshold = CommonUtils.quantile(unthresholded.score(data), 1.0 - options.contamination());
        log.debug("grew {} trees on {} rows (sub-sample {}, max depth {}), threshold {}",
                trees.size(), data.length, subSampleSize, maxDepth, threshold);
        return new IsolationForest(trees, subSampleSize, options.contamination(), options.randomSeed(), threshold);
    }

    public double score(double[] point) {
        double total = 0.0;
        for (IsolationTree tree : trees) total += tree.pathLength(point);
        double normalizer = CommonUtils.averagePathLength(subSampleSize);
        if (normalizer <= 0.0) return 0.5;
        return Math.pow(2.0, -(total / trees.size()) / normalizer);
    }

    public double[] score(double[][] matrix) {
        double[] out = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) out[i] = score(matrix[i]);
        return out;
    }

    public int predict(double[] point) {
        return label(score(point));
    }

    public int[] predict(double[][] matrix) {
        int[] out = new int[matrix.length];
        for (int i = 0; i < matrix.length; i++) out[i] = predict(matrix[i]);
        return out;
    }

    public int label(double score) {
        return score > threshold ? ANOMALY : NORMAL;
    }

    /** Partial Fisher–Yates shuffle; the whole range when {@code size >= n}. */
    static int[] subsample(int n, int size, Random random) {
        int[] all = new int[n];
        for (int i = 0; i < n; i++) all[i] = i;
        if (size >= n) return all;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        int[] out = new int[size];
        System.arraycopy(all, 0, out, 0, size);
        return out;
    }
}
