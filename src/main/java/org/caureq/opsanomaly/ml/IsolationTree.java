package org.caureq.opsanomaly.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * A randomized binary partition tree stored as parallel arrays indexed by node, root at 0.
 * Leaves have {@code splitFeature == LEAF}; {@code mass} is the number of training points
 * that reached the node.
 */
public record IsolationTree(int[] splitFeature, double[] splitValue, int[] left, int[] right, int[] mass) {

    public static final int LEAF = -1;

    /**
     * Grows a tree on the rows of {@code data} selected by {@code indices}.
     * Points with {@code x[f] <= split} go left.
     */
    public static IsolationTree grow(double[][] data, int[] indices, int maxDepth, Random random) {
        var builder = new Builder(data, indices.clone(), maxDepth, random);
        builder.grow(0, indices.length, 0);
        return builder.build();
    }

    /** Depth of the leaf reached by {@code point}, plus the expected depth still needed to isolate it there. */
    public double pathLength(double[] point) {
        int node = 0;
        int depth = 0;
        while (splitFeature[node] != LEAF) {
            node = point[splitFeature[node]] <= splitValue[node] ? left[node] : right[node];
            depth++;
        }
        return depth + CommonUtils.averagePathLength(mass[node]);
    }

    public int nodeCount() { return mass.length; }

    private static final class Builder {
        private final double[][] data;
        private final int[] idx;
        private final int maxDepth;
        private final Random random;
        private final List<Integer> feature = new ArrayList<>();
        private final List<Double> value = new ArrayList<>();
        private final List<Integer> lefts = new ArrayList<>();
        private final List<Integer> rights = new ArrayList<>();
        private final List<Integer> masses = new ArrayList<>();

        Builder(double[][] data, int[] idx, int maxDepth, Random random) {
            this.data = data;
            this.idx = idx;
            this.maxDepth = maxDepth;
            this.random = random;
        }

        int grow(int from, int to, int depth) {
            int node = newLeaf(to - from);
            if (to - from <= 1 || depth >= maxDepth) return node;

            int dims = data[idx[from]].length;
            double[] min = new double[dims];
            double[] max = new double[dims];
            for (int j = 0; j < dims; j++) {
                min[j] = Double.POSITIVE_INFINITY;
                max[j] = Double.NEGATIVE_INFINITY;
            }
            for (int i = from; i < to; i++) {
                double[] row = data[idx[i]];
                for (int j = 0; j < dims; j++) {
                    if (row[j] < min[j]) min[j] = row[j];
                    if (row[j] > max[j]) max[j] = row[j];
                }
            }
            int[] varying = new int[dims];
            int nVarying = 0;
            for (int j = 0; j < dims; j++) {
                if (max[j] > min[j]) varying[nVarying++] = j;
            }
            if (nVarying == 0) return node; // all points identical

            int f = varying[random.nextInt(nVarying)];
            double split = min[f] + random.nextDouble() * (max[f] - min[f]);
            int mid = partition(from, to, f, split);
            if (mid == from || mid == to) return node; // rounding put the cut on an edge

            feature.set(node, f);
            value.set(node, split);
            int l = grow(from, mid, depth + 1);
            int r = grow(mid, to, depth + 1);
            lefts.set(node, l);
            rights.set(node, r);
            return node;
        }

        private int partition(int from, int to, int f, double split) {
            int i = from;
            int j = to - 1;
            while (i <= j) {
                if (data[idx[i]][f] <= split) {
                    i++;
                } else {
                    int tmp = idx[i];
                    idx[i] = idx[j];
                    idx[j] = tmp;
                    j--;
                }
            }
            return i;
        }

        private int newLeaf(int size) {
            feature.add(LEAF);
            value.add(0.0);
            lefts.add(LEAF);
            rights.add(LEAF);
            masses.add(size);
            return masses.size() - 1;
        }

        IsolationTree build() {
            int n = masses.size();
            int[] f = new int[n];
            double[] v = new double[n];
            int[] l = new int[n];
            int[] r = new int[n];
            int[] m = new int[n];
            for (int i = 0; i < n; i++) {
                f[i] = feature.get(i);
                v[i] = value.get(i);
                l[i] = lefts.get(i);
                r[i] = rights.get(i);
                m[i] = masses.get(i);
            }
            return new IsolationTree(f, v, l, r, m);
        }
    }
}
