package com.cx.anomaly.engine.pipeline;

public enum ImputationStrategy {
    MEAN,
    MEDIAN,
    CONSTANT
}
