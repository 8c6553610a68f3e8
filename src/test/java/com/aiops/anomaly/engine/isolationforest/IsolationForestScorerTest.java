package com.aiops.anomaly.engine.isolationforest;

import com.aiops.anomaly.model.OutlierLabel;
import com.aiops.anomaly.model.ScoreBatch;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsolationForestScorerTest {

    private static double[][] training;
    private static IsolationForestScorer scorer;

    @BeforeAll
    static void fit() {
        Random random = new Random(7);
        training = new double[300][2];
        for (double[] row : training) {
            row[0] = 100 + random.nextGaussian() * 5;
            row[1] = 50 + random.nextGaussian() * 2;
        }
        scorer = IsolationForestScorer.fit(training, 100, 256, 0.05, 42L);
    }

    @Test
    void score_farPointIsOutlierAndCentralPointIsNormal() {
        ScoreBatch batch = scorer.score(new double[][]{{100, 50}, {1000, 500}});

        assertThat(batch.labels()).containsExactly(OutlierLabel.NORMAL, OutlierLabel.OUTLIER);
        assertThat(batch.scores()[1]).isLessThan(0.0).isLessThan(batch.scores()[0]);
    }

    @Test
    void fit_contaminationShareOfTrainingDataIsFlagged() {
        ScoreBatch batch = scorer.score(training);

        long outliers = batch.labels().stream().filter(l -> l == OutlierLabel.OUTLIER).count();
        assertThat(outliers).isBetween(10L, 20L);
    }

    @Test
    void forestScores_stayInUnitInterval() {
        double s = scorer.getForest().anomalyScore(new double[]{1e6, -1e6});
        assertThat(s).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
    }

    @Test
    void fit_sameSeedIsDeterministic() {
        IsolationForestScorer again = IsolationForestScorer.fit(training, 100, 256, 0.05, 42L);

        assertThat(again.getOffset()).isEqualTo(scorer.getOffset());
        assertThat(again.decision(new double[]{120, 40})).isEqualTo(scorer.decision(new double[]{120, 40}));
    }

    @Test
    void json_roundTripPreservesScores() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        String json = mapper.writeValueAsString(scorer);

        IsolationForestScorer restored = mapper.readValue(json, IsolationForestScorer.class);

        double[][] rows = {{100, 50}, {130, 45}, {1000, 500}};
        assertThat(restored.score(rows).scores()).containsExactly(scorer.score(rows).scores());
        assertThat(restored.getForest().getTrees()).hasSize(100);
    }

    @Test
    void score_wrongRowWidth_rejected() {
        assertThatThrownBy(() -> scorer.score(new double[][]{{1, 2, 3}}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fit_invalidContamination_rejected() {
        assertThatThrownBy(() -> IsolationForestScorer.fit(training, 10, 64, 0.0, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void quantile_interpolatesLinearly() {
        assertThat(IsolationForestScorer.quantile(new double[]{4, 1, 3, 2}, 0.5)).isEqualTo(2.5);
        assertThat(IsolationForestScorer.quantile(new double[]{1, 2, 3, 4, 5}, 0.0)).isEqualTo(1.0);
    }
}
