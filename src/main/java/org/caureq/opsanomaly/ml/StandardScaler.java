package org.caureq.opsanomaly.ml;

import java.util.Arrays;

/**
 * Per-feature standardization fitted on a training matrix, in {@link Feature} order.
 * {@code imputationMeans} are the fill-in values used when the scaler was fitted, kept so
 * scoring can fill absent metrics the same way training did.
 */
public record StandardScaler(double[] mean, double[] std, double[] imputationMeans) {

    public StandardScaler {
        CommonUtils.checkArgument(mean.length == std.length && mean.length == imputationMeans.length,
                "mean, std and imputation means must have the same length");
    }

    public static StandardScaler fit(double[][] matrix, double[] imputationMeans) {
        CommonUtils.checkArgument(matrix.length > 0, "cannot fit a scaler on an empty matrix");
        int dims = matrix[0].length;
        double[] mean = new double[dims];
        double[] std = new double[dims];
        for (double[] row : matrix) {
            for (int j = 0; j < dims; j++) mean[j] += row[j];
        }
        for (int j = 0; j < dims; j++) mean[j] /= matrix.length;
        for (double[] row : matrix) {
            for (int j = 0; j < dims; j++) {
                double d = row[j] - mean[j];
                std[j] += d * d;
            }
        }
        for (int j = 0; j < dims; j++) {
            // rounding in the mean leaves a tiny non-zero std on a constant column
            std[j] = isConstant(matrix, j) ? 0.0 : Math.sqrt(std[j] / matrix.length);
        }
        return new StandardScaler(mean, std, Arrays.copyOf(imputationMeans, imputationMeans.length));
    }

    private static boolean isConstant(double[][] matrix, int column) {
        double first = matrix[0][column];
        for (double[] row : matrix) {
            if (Double.compare(row[column], first) != 0) return false;
        }
        return true;
    }

    /** {@code (x - mean) / std}; a feature that was constant in training maps to 0. */
    public double[] transform(double[] row) {
        CommonUtils.checkArgument(row.length == mean.length, "row has " + row.length + " features, scaler has " + mean.length);
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = std[j] == 0.0 ? 0.0 : (row[j] - mean[j]) / std[j];
        }
        return out;
    }

    public double[][] transform(double[][] matrix) {
        double[][] out = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) out[i] = transform(matrix[i]);
        return out;
    }
}
