package com.aiops.anomaly.parser;

import com.aiops.anomaly.model.CanonicalLogRecord;

import java.util.List;
import java.util.Map;

/**
 * Turns canonical records into the fixed-width matrix the outlier scorer consumes.
 * Missing features are filled with 0.0.
 */
public final class FeatureVectorizer {

    private FeatureVectorizer() {}

    public static double[][] toMatrix(List<CanonicalLogRecord> records, List<String> featureNames) {
        double[][] matrix = new double[records.size()][featureNames.size()];
        for (int i = 0; i < records.size(); i++) {
            matrix[i] = toVector(records.get(i).getFeatures(), featureNames);
        }
        return matrix;
    }

    public static double[] toVector(Map<String, Double> features, List<String> featureNames) {
        double[] row = new double[featureNames.size()];
        for (int j = 0; j < featureNames.size(); j++) {
            Double value = features.get(featureNames.get(j));
            row[j] = value != null ? value : 0.0;
        }
        return row;
    }
}
