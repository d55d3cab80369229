package com.cx.anomaly.engine.pipeline;

public enum ScalingMethod {
    /** Zero mean, unit variance. */
    STANDARD,
    /** Rescaled to [0, 1] over the training range. */
    MINMAX
}
