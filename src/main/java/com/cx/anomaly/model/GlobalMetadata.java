package com.cx.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Records which models were trained together and under what configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GlobalMetadata {

    private String trainTimestamp;
    private int sampleCount;
    private int featureCount;
    private List<String> modelsTrained;
    private List<String> featureNames;
    private Map<String, Object> configSnapshot;
}
