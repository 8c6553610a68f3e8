package com.aiops.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection.model")
public class ModelConfig {

    private String path = "models/isolation_forest_model.json";

    // Column order of every vector handed to the scorer. Must match the order the model was fitted with.
    private List<String> featureNames = new ArrayList<>(List.of("resp_time", "bytes_out", "error_rate"));

    private int numTrees = 100;
    private int sampleSize = 256;

    // Expected share of outliers in the training data; sets the decision offset.
    private double contamination = 0.05;

    private long seed = 42;
    private int minTrainSamples = 50;
}
