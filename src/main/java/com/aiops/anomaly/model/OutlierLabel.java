package com.aiops.anomaly.model;

public enum OutlierLabel {
    OUTLIER,
    NORMAL
}
