package com.aiops.anomaly.engine;

import com.aiops.anomaly.model.ScoreBatch;

/**
 * Batch outlier scorer. Takes an N x F matrix (column order fixed by the configured
 * feature names) and returns N labels and N scores, row for row. Lower scores are
 * more anomalous.
 */
public interface OutlierScorer {

    ScoreBatch score(double[][] rows);
}
