package org.caureq.opsanomaly.ml;

import java.util.Arrays;

public final class CommonUtils {

    /** Euler–Mascheroni constant. */
    static final double EULER_GAMMA = 0.5772156649015329;

    private CommonUtils() {
    }

    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree built on
     * {@code n} points. Used both for leaves holding several points and as the score
     * normalizer.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    /** Quantile with linear interpolation between closest ranks; {@code values} is not modified. */
    public static double quantile(double[] values, double q) {
        checkArgument(values.length > 0, "quantile of an empty array");
        checkArgument(q >= 0.0 && q <= 1.0, "q must be in [0, 1]");
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (pos - lo) * (sorted[hi] - sorted[lo]);
    }
}
