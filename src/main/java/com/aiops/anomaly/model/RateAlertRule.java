package com.aiops.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fire an aggregate alert once {@code count} anomalies of one service fall inside a trailing
 * window of {@code windowSeconds}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RateAlertRule {
    private int count;
    private long windowSeconds;
}
