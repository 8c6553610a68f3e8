package com.aiops.anomaly.engine.isolationforest;

import com.aiops.anomaly.engine.OutlierScorer;
import com.aiops.anomaly.model.OutlierLabel;
import com.aiops.anomaly.model.ScoreBatch;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@link OutlierScorer} backed by an {@link IsolationForest}.
 *
 * The decision score of a row is {@code -s(x) - offset}, where {@code offset} is the
 * {@code contamination} quantile of {@code -s} over the training rows. Roughly a
 * {@code contamination} share of the training data therefore scores below zero, and
 * exactly those rows are labelled {@link OutlierLabel#OUTLIER}.
 */
@Getter
public class IsolationForestScorer implements OutlierScorer {

    @JsonProperty("forest")
    private final IsolationForest forest;

    @JsonProperty("offset")
    private final double offset;

    @JsonProperty("contamination")
    private final double contamination;

    @JsonCreator
    public IsolationForestScorer(@JsonProperty("forest") IsolationForest forest,
                                 @JsonProperty("offset") double offset,
                                 @JsonProperty("contamination") double contamination) {
        if (forest == null) {
            throw new IllegalArgumentException("forest is required");
        }
        this.forest = forest;
        this.offset = offset;
        this.contamination = contamination;
    }

    public static IsolationForestScorer fit(double[][] data, int numTrees, int sampleSize,
                                            double contamination, long seed) {
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        IsolationForest forest = IsolationForest.fit(data, numTrees, sampleSize, seed);

        double[] negated = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            negated[i] = -forest.anomalyScore(data[i]);
        }
        return new IsolationForestScorer(forest, quantile(negated, contamination), contamination);
    }

    @Override
    public ScoreBatch score(double[][] rows) {
        double[] scores = new double[rows.length];
        List<OutlierLabel> labels = new ArrayList<>(rows.length);
        for (int i = 0; i < rows.length; i++) {
            checkWidth(rows[i]);
            scores[i] = decision(rows[i]);
            labels.add(scores[i] < 0 ? OutlierLabel.OUTLIER : OutlierLabel.NORMAL);
        }
        return new ScoreBatch(labels, scores);
    }

    public double decision(double[] row) {
        return -forest.anomalyScore(row) - offset;
    }

    private void checkWidth(double[] row) {
        if (forest.getFeatureCount() > 0 && row.length != forest.getFeatureCount()) {
            throw new IllegalArgumentException("Expected " + forest.getFeatureCount()
                    + " features per row, got " + row.length);
        }
    }

    // Linear interpolation between closest ranks
    static double quantile(double[] values, double q) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double frac = pos - lower;
        return sorted[lower] + frac * (sorted[upper] - sorted[lower]);
    }
}
