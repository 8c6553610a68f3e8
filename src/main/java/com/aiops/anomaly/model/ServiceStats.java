package com.aiops.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceStats {
    private String service;
    private int totalAnomalies;
    private double avgScore;
    private int recentAnomalies;   // last hour
    private double maxScore;       // least anomalous
    private double minScore;       // most anomalous
}
