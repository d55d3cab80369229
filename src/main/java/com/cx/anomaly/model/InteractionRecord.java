package com.cx.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "A customer-service interaction submitted for anomaly scoring")
public class InteractionRecord {

    public static final List<String> COLUMNS = List.of(
            "interaction_id", "timestamp", "csat", "ies", "complaints", "aht_seconds",
            "hold_time_seconds", "transfers", "channel", "language", "queue");

    @Schema(description = "Unique interaction identifier", example = "abc-123")
    String interactionId;

    @Schema(description = "Interaction timestamp (ISO-8601)", example = "2025-10-15T10:00:00Z")
    Instant timestamp;

    @Schema(description = "Customer satisfaction score, 1 to 5", example = "3.2")
    Double csat;

    @Schema(description = "Internal efficiency score, 0 to 100", example = "64.0")
    Double ies;

    @Schema(description = "Number of complaints", example = "1")
    Integer complaints;

    @Schema(description = "Average handle time in seconds", example = "420.0")
    Double ahtSeconds;

    @Schema(description = "Hold time in seconds", example = "60.0")
    Double holdTimeSeconds;

    @Schema(description = "Number of transfers", example = "0")
    Integer transfers;

    @Schema(description = "Communication channel", example = "voice")
    String channel;

    @Schema(description = "Language code", example = "en")
    String language;

    @Schema(description = "Queue name", example = "billing")
    String queue;

    /**
     * Field-level problems with this record; empty when it can be scored.
     */
    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        if (interactionId == null || interactionId.isBlank()) problems.add("interaction_id is required");
        if (timestamp == null) problems.add("timestamp is required");
        if (csat != null && (csat < 1.0 || csat > 5.0)) problems.add("csat must be within [1, 5]");
        if (ies != null && (ies < 0.0 || ies > 100.0)) problems.add("ies must be within [0, 100]");
        if (complaints != null && complaints < 0) problems.add("complaints must be >= 0");
        if (ahtSeconds != null && ahtSeconds < 0) problems.add("aht_seconds must be >= 0");
        if (holdTimeSeconds != null && holdTimeSeconds < 0) problems.add("hold_time_seconds must be >= 0");
        if (transfers != null && transfers < 0) problems.add("transfers must be >= 0");
        return problems;
    }

    /**
     * Column view used by the feature pipeline; missing metrics stay null.
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("interaction_id", interactionId);
        row.put("timestamp", timestamp == null ? null : timestamp.toString());
        row.put("csat", csat);
        row.put("ies", ies);
        row.put("complaints", complaints);
        row.put("aht_seconds", ahtSeconds);
        row.put("hold_time_seconds", holdTimeSeconds);
        row.put("transfers", transfers);
        row.put("channel", channel);
        row.put("language", language);
        row.put("queue", queue);
        return row;
    }
}
