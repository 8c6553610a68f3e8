package com.aiops.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of isolation trees (Liu, Ting and Zhou, 2008).
 *
 * Anomalous rows are isolated closer to the root, so their mean path length is short and
 * their anomaly score {@code s = 2^(-E(h) / c(n))} is close to 1. Normal rows score
 * well below 0.5.
 */
@Getter
public class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    @JsonProperty("trees")
    private final List<IsolationTree> trees;

    @JsonProperty("sampleSize")
    private final int sampleSize;

    @JsonProperty("featureCount")
    private final int featureCount;

    @JsonCreator
    public IsolationForest(@JsonProperty("trees") List<IsolationTree> trees,
                           @JsonProperty("sampleSize") int sampleSize,
                           @JsonProperty("featureCount") int featureCount) {
        this.trees = trees != null ? trees : Collections.emptyList();
        this.sampleSize = sampleSize;
        this.featureCount = featureCount;
    }

    /**
     * Grow a forest on the given rows.
     *
     * @param data       training rows, all of the same width
     * @param numTrees   number of trees
     * @param sampleSize rows drawn (without replacement) per tree; capped at the row count
     * @param seed       seed for subsampling and splits
     */
    public static IsolationForest fit(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on zero rows");
        }
        int psi = Math.min(sampleSize, data.length);
        int depthLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            trees.add(IsolationTree.grow(drawSample(data, psi, random), depthLimit, random));
        }
        return new IsolationForest(trees, psi, data[0].length);
    }

    /**
     * Anomaly score in (0, 1]. Higher means easier to isolate.
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        double normalizer = expectedPathLength(sampleSize);
        if (normalizer <= 0) {
            return 0.0;
        }
        return Math.pow(2.0, -(total / trees.size()) / normalizer);
    }

    /**
     * c(n): average path length of an unsuccessful binary-search-tree lookup over n keys.
     */
    static double expectedPathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    // Partial Fisher-Yates over row indices
    private static double[][] drawSample(double[][] data, int size, Random random) {
        int[] index = new int[data.length];
        for (int i = 0; i < index.length; i++) index[i] = i;

        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(index.length - i);
            int tmp = index[i];
            index[i] = index[j];
            index[j] = tmp;
            sample[i] = data[index[i]];
        }
        return sample;
    }
}
