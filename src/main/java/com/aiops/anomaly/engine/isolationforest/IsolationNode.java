package com.aiops.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One node of an isolation tree. A node without children is a leaf and records how many
 * training rows reached it. Short JSON names keep persisted models compact.
 */
@Getter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IsolationNode {

    @JsonProperty("f")
    private int feature;

    @JsonProperty("t")
    private double threshold;

    @JsonProperty("l")
    private IsolationNode left;

    @JsonProperty("r")
    private IsolationNode right;

    @JsonProperty("n")
    private int size;

    static IsolationNode split(int feature, double threshold, IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.feature = feature;
        node.threshold = threshold;
        node.left = left;
        node.right = right;
        return node;
    }

    static IsolationNode leaf(int size) {
        IsolationNode node = new IsolationNode();
        node.size = size;
        return node;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return left == null || right == null;
    }

    IsolationNode childFor(double[] point) {
        return point[feature] < threshold ? left : right;
    }
}
