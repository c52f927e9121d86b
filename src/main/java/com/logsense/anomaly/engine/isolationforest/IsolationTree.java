package com.logsense.anomaly.engine.isolationforest;

import java.util.Arrays;
import java.util.Random;

/**
 * A single isolation tree stored as an arena: node {@code i} is described by the i-th slot of
 * each array, children are referenced by index and the root is node 0. Trees are immutable
 * once built.
 */
public final class IsolationTree {

    static final int LEAF = -1;

    private static final double EULER_MASCHERONI = 0.5772156649;

    // LEAF for external nodes, otherwise the column the node splits on
    private final int[] splitFeature;
    private final double[] splitValue;
    private final int[] left;
    private final int[] right;
    // rows of the subsample that ended in this leaf, and c(size) for that count
    private final int[] size;
    private final double[] residual;
    private final int nodeCount;

    private IsolationTree(int[] splitFeature, double[] splitValue, int[] left, int[] right,
                          int[] size, double[] residual, int nodeCount) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
        this.residual = residual;
        this.nodeCount = nodeCount;
    }

    /**
     * Grow a tree over the given rows of {@code data}.
     *
     * @param data     the full feature matrix
     * @param rows     row indices of the subsample; not modified
     * @param maxDepth depth at which growth stops, normally ceil(log2(rows.length))
     * @param random   source of every feature and split choice
     */
    public static IsolationTree build(double[][] data, int[] rows, int maxDepth, Random random) {
        Grower grower = new Grower(data, Arrays.copyOf(rows, rows.length), maxDepth, random);
        grower.grow(0, rows.length, 0);
        return grower.toTree();
    }

    /**
     * Number of edges from the root to the leaf this row falls into, plus that leaf's
     * c(size) correction for the subsample rows it could not separate.
     */
    public double pathLength(double[] row) {
        int node = 0;
        int depth = 0;
        while (splitFeature[node] != LEAF) {
            node = row[splitFeature[node]] <= splitValue[node] ? left[node] : right[node];
            depth++;
        }
        return depth + residual[node];
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of m nodes:
     * c(m) = 2H(m-1) - 2(m-1)/m with H(i) ~ ln(i) + Euler-Mascheroni, and c(m) = 0 for m <= 1.
     */
    public static double averagePathLength(int m) {
        if (m <= 1) return 0.0;
        double harmonic = Math.log(m - 1.0) + EULER_MASCHERONI;
        return 2.0 * harmonic - (2.0 * (m - 1.0) / m);
    }

    public int nodeCount() {
        return nodeCount;
    }

    public boolean isLeaf(int node) {
        return splitFeature[node] == LEAF;
    }

    public int leafSize(int node) {
        return size[node];
    }

    /** Column an internal node splits on, {@code -1} for leaves. */
    public int splitFeature(int node) {
        return splitFeature[node];
    }

    /** Longest root-to-leaf edge count. */
    public int height() {
        return height(0);
    }

    private int height(int node) {
        if (isLeaf(node)) return 0;
        return 1 + Math.max(height(left[node]), height(right[node]));
    }

    private static final class Grower {

        private final double[][] data;
        private final int[] rows;
        private final int maxDepth;
        private final Random random;

        private final int[] splitFeature;
        private final double[] splitValue;
        private final int[] left;
        private final int[] right;
        private final int[] size;
        private final double[] residual;
        private int nodeCount;

        Grower(double[][] data, int[] rows, int maxDepth, Random random) {
            this.data = data;
            this.rows = rows;
            this.maxDepth = maxDepth;
            this.random = random;

            // a binary tree with at most rows.length leaves has at most 2n - 1 nodes
            int capacity = Math.max(1, 2 * rows.length - 1);
            this.splitFeature = new int[capacity];
            this.splitValue = new double[capacity];
            this.left = new int[capacity];
            this.right = new int[capacity];
            this.size = new int[capacity];
            this.residual = new double[capacity];
        }

        /** Grows the subtree over rows[from, to) and returns its node index. */
        int grow(int from, int to, int depth) {
            int node = nodeCount++;
            int n = to - from;

            if (n <= 1 || depth >= maxDepth) {
                return leaf(node, n);
            }

            int columns = data[rows[from]].length;
            int[] candidates = new int[columns];
            double[] mins = new double[columns];
            double[] maxs = new double[columns];
            int candidateCount = 0;
            for (int f = 0; f < columns; f++) {
                double min = Double.POSITIVE_INFINITY;
                double max = Double.NEGATIVE_INFINITY;
                for (int i = from; i < to; i++) {
                    double v = data[rows[i]][f];
                    if (v < min) min = v;
                    if (v > max) max = v;
                }
                mins[f] = min;
                maxs[f] = max;
                if (min < max) {
                    candidates[candidateCount++] = f;
                }
            }

            // every feature is constant over this subset: nothing left to separate
            if (candidateCount == 0) {
                return leaf(node, n);
            }

            int feature = candidates[random.nextInt(candidateCount)];
            double min = mins[feature];
            double max = maxs[feature];
            double split = min + random.nextDouble() * (max - min);
            if (split >= max) {
                split = min;
            }

            int mid = partition(from, to, feature, split);

            splitFeature[node] = feature;
            splitValue[node] = split;
            left[node] = grow(from, mid, depth + 1);
            right[node] = grow(mid, to, depth + 1);
            return node;
        }

        private int leaf(int node, int n) {
            splitFeature[node] = LEAF;
            size[node] = n;
            residual[node] = averagePathLength(n);
            return node;
        }

        /** Moves rows with value <= split to the front of [from, to); returns the first index of the rest. */
        private int partition(int from, int to, int feature, double split) {
            int i = from;
            int j = to - 1;
            while (i <= j) {
                if (data[rows[i]][feature] <= split) {
                    i++;
                } else {
                    int tmp = rows[i];
                    rows[i] = rows[j];
                    rows[j] = tmp;
                    j--;
                }
            }
            return i;
        }

        IsolationTree toTree() {
            return new IsolationTree(
                    Arrays.copyOf(splitFeature, nodeCount),
                    Arrays.copyOf(splitValue, nodeCount),
                    Arrays.copyOf(left, nodeCount),
                    Arrays.copyOf(right, nodeCount),
                    Arrays.copyOf(size, nodeCount),
                    Arrays.copyOf(residual, nodeCount),
                    nodeCount);
        }
    }
}
