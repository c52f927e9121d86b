package com.logsense.anomaly.engine.isolationforest;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * An ensemble of isolation trees built over one batch. The forest is immutable, holds no
 * reference to shared state and is meant to be dropped once the batch is scored.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final long seed;

    private IsolationForest(List<IsolationTree> trees, int sampleSize, long seed) {
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    /**
     * Train the isolation forest on the given data.
     *
     * Tree {@code i} is grown from its own {@link Random} seeded with the i-th long drawn from
     * {@code new Random(seed)}, so the forest does not depend on which worker builds which tree.
     *
     * @param data        feature matrix, one row per sample
     * @param numTrees    number of trees in the forest
     * @param sampleSize  sub-sampling size per tree, capped at the number of rows
     * @param seed        master seed for all sampling and split choices
     * @param parallelism worker threads used to grow trees; 1 grows them on the calling thread
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed, int parallelism) {
        if (data.length == 0) {
            throw new IllegalArgumentException("cannot train an isolation forest on zero rows");
        }
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1, got " + numTrees);
        }
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sampleSize must be >= 1, got " + sampleSize);
        }

        int psi = Math.min(sampleSize, data.length);
        int maxDepth = ceilLog2(psi);

        Random master = new Random(seed);
        long[] treeSeeds = new long[numTrees];
        for (int i = 0; i < numTrees; i++) {
            treeSeeds[i] = master.nextLong();
        }

        List<IsolationTree> trees = inPool(parallelism, () -> indices(numTrees, parallelism)
                .mapToObj(i -> growTree(data, psi, maxDepth, treeSeeds[i]))
                .collect(Collectors.toList()));

        return new IsolationForest(Collections.unmodifiableList(trees), psi, seed);
    }

    /**
     * Mean path length of the row across all trees, summed in tree order.
     */
    public double meanPathLength(double[] row) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(row);
        }
        return total / trees.size();
    }

    /**
     * IF scoring formula s(x, psi) = 2^(-E(h(x)) / c(psi)).
     *
     * @return close to 1 for points isolated in very few splits, around 0.5 for typical points
     *         and towards 0 for points deep inside dense regions. 0.5 when psi = 1.
     */
    public double isolationScore(double[] row) {
        double c = IsolationTree.averagePathLength(sampleSize);
        if (c <= 0) return 0.5;
        return Math.pow(2.0, -meanPathLength(row) / c);
    }

    /**
     * Isolation score of every row, in row order.
     */
    public double[] isolationScores(double[][] data, int parallelism) {
        return inPool(parallelism, () -> indices(data.length, parallelism)
                .mapToDouble(row -> isolationScore(data[row]))
                .toArray());
    }

    private static IsolationTree growTree(double[][] data, int psi, int maxDepth, long treeSeed) {
        Random random = new Random(treeSeed);
        return IsolationTree.build(data, subsample(data.length, psi, random), maxDepth, random);
    }

    /**
     * Row indices of a sample of {@code size} rows drawn without replacement. When the sample
     * would cover every row, all rows are used and no random draw is made.
     */
    static int[] subsample(int rows, int size, Random random) {
        int[] indices = new int[rows];
        for (int i = 0; i < rows; i++) indices[i] = i;
        if (size >= rows) {
            return indices;
        }
        // partial Fisher-Yates shuffle
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(rows - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(indices, 0, sample, 0, size);
        return sample;
    }

    static int ceilLog2(int n) {
        return n <= 1 ? 0 : 32 - Integer.numberOfLeadingZeros(n - 1);
    }

    private static IntStream indices(int count, int parallelism) {
        IntStream range = IntStream.range(0, count);
        return parallelism > 1 ? range.parallel() : range;
    }

    /**
     * Runs the task on a private pool of the given size so parallel streams inside it do not
     * borrow the common pool. Sequential tasks run on the calling thread.
     */
    private static <T> T inPool(int parallelism, Supplier<T> task) {
        if (parallelism <= 1) {
            return task.get();
        }
        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(task::get).join();
        } finally {
            pool.shutdown();
        }
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
    public long getSeed() { return seed; }
}
