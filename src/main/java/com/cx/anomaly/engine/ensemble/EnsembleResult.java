package com.cx.anomaly.engine.ensemble;

public record EnsembleResult(double score, boolean anomaly) {}
