package com.aiops.anomaly.model;

import java.util.List;

/**
 * Output of one batched scorer call: one label and one score per input row, in row order.
 */
public record ScoreBatch(List<OutlierLabel> labels, double[] scores) {

    public int size() {
        return scores.length;
    }

    public boolean isOutlier(int row) {
        return labels.get(row) == OutlierLabel.OUTLIER;
    }

    public static ScoreBatch empty() {
        return new ScoreBatch(List.of(), new double[0]);
    }
}
