package com.aiops.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.Random;

/**
 * A single random-partition tree. Rows are isolated by splitting a random feature at a
 * uniformly random point between its observed min and max, down to a depth limit.
 */
@Getter
public class IsolationTree {

    @JsonProperty("root")
    private final IsolationNode root;

    @JsonCreator
    public IsolationTree(@JsonProperty("root") IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] sample, int depthLimit, Random random) {
        int[] rows = new int[sample.length];
        for (int i = 0; i < rows.length; i++) rows[i] = i;
        return new IsolationTree(grow(sample, rows, 0, rows.length, 0, depthLimit, random));
    }

    // Partitions rows[from, to) in place and recurses on both halves
    private static IsolationNode grow(double[][] sample, int[] rows, int from, int to,
                                      int depth, int depthLimit, Random random) {
        int count = to - from;
        if (count <= 1 || depth >= depthLimit) {
            return IsolationNode.leaf(count);
        }

        int feature = random.nextInt(sample[rows[from]].length);
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (int i = from; i < to; i++) {
            double v = sample[rows[i]][feature];
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        if (!(hi > lo)) {
            return IsolationNode.leaf(count);
        }

        double threshold = lo + random.nextDouble() * (hi - lo);
        int mid = from;
        for (int i = from; i < to; i++) {
            if (sample[rows[i]][feature] < threshold) {
                int tmp = rows[mid];
                rows[mid] = rows[i];
                rows[i] = tmp;
                mid++;
            }
        }

        return IsolationNode.split(feature, threshold,
                grow(sample, rows, from, mid, depth + 1, depthLimit, random),
                grow(sample, rows, mid, to, depth + 1, depthLimit, random));
    }

    /**
     * Depth at which the point lands, plus the expected remaining depth for the
     * unresolved rows in its leaf.
     */
    public double pathLength(double[] point) {
        IsolationNode node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = node.childFor(point);
            depth++;
        }
        return depth + IsolationForest.expectedPathLength(node.getSize());
    }
}
