package com.cx.anomaly.controller;

import com.cx.anomaly.engine.DetectorException;
import com.cx.anomaly.engine.ErrorKind;
import com.cx.anomaly.engine.ensemble.EnsembleResult;
import com.cx.anomaly.engine.ensemble.ModelScores;
import com.cx.anomaly.model.ModelSelection;
import com.cx.anomaly.registry.ModelRegistry;
import com.cx.anomaly.registry.ScoringBatch;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScoringController.class)
class ScoringControllerTest {

    private static final String BODY = """
            [
              {"interaction_id": "r-1", "timestamp": "2025-10-15T10:00:00Z", "csat": 4.5, "ies": 80,
               "complaints": 0, "aht_seconds": 300, "hold_time_seconds": 20, "transfers": 0,
               "channel": "voice", "language": "en", "queue": "billing"},
              {"interaction_id": "r-2", "timestamp": "2025-10-15T11:00:00Z", "csat": 1.2, "ies": 30,
               "complaints": 3, "aht_seconds": 900, "hold_time_seconds": 200, "transfers": 4,
               "channel": "chat", "language": "en", "queue": "support"}
            ]
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModelRegistry registry;

    private static ScoringBatch twoModelBatch() {
        Map<String, ModelScores> scores = new LinkedHashMap<>();
        scores.put("iforest", new ModelScores("iforest", new double[]{0.41, 0.72}, new boolean[]{false, true}));
        scores.put("lof", new ModelScores("lof", new double[]{1.02, 1.35}, new boolean[]{false, false}));
        return new ScoringBatch(3, List.of("r-1", "r-2"), scores,
                List.of(new EnsembleResult(0.05, false), new EnsembleResult(0.98, true)));
    }

    @Test
    void score_defaultSelection_returnsModelAndEnsembleScores() throws Exception {
        when(registry.score(anyList(), eq(ModelSelection.BOTH))).thenReturn(twoModelBatch());

        mockMvc.perform(post("/score").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_records").value(2))
                .andExpect(jsonPath("$.anomalies_detected").value(1))
                .andExpect(jsonPath("$.processing_time_ms").exists())
                .andExpect(jsonPath("$.scores[0].interaction_id").value("r-1"))
                .andExpect(jsonPath("$.scores[1].scores.iforest").value(0.72))
                .andExpect(jsonPath("$.scores[1].scores.ensemble").value(0.98))
                .andExpect(jsonPath("$.scores[1].is_anomaly.iforest").value(1))
                .andExpect(jsonPath("$.scores[1].is_anomaly.lof").value(0))
                .andExpect(jsonPath("$.scores[1].is_anomaly.ensemble").value(1));
    }

    @Test
    void score_singleModel_hasNoEnsembleEntry() throws Exception {
        ScoringBatch batch = new ScoringBatch(1, List.of("r-1", "r-2"),
                Map.of("lof", new ModelScores("lof", new double[]{1.0, 2.1}, new boolean[]{false, true})), List.of());
        when(registry.score(anyList(), eq(ModelSelection.LOF))).thenReturn(batch);

        mockMvc.perform(post("/score").param("model", "lof")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scores[1].scores.lof").value(2.1))
                .andExpect(jsonPath("$.scores[1].scores.ensemble").doesNotExist())
                .andExpect(jsonPath("$.anomalies_detected").value(1));
    }

    @Test
    void score_unknownModel_returns400WithoutScoring() throws Exception {
        mockMvc.perform(post("/score").param("model", "bogus")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("model must be one of: iforest, lof, both"));

        verifyNoInteractions(registry);
    }

    @Test
    void score_notLoaded_returns503() throws Exception {
        when(registry.score(anyList(), any())).thenThrow(DetectorException.notLoaded());

        mockMvc.perform(post("/score").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Models not loaded"))
                .andExpect(jsonPath("$.kind").value("NOT_LOADED"));
    }

    @Test
    void score_invalidRecord_returns400() throws Exception {
        when(registry.score(anyList(), any()))
                .thenThrow(DetectorException.schema("Record 1 (r-2): csat must be within [1, 5]"));

        mockMvc.perform(post("/score").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("SCHEMA"));
    }

    @Test
    void score_modelMissingFromSnapshot_returns503() throws Exception {
        when(registry.score(anyList(), eq(ModelSelection.IFOREST)))
                .thenThrow(new DetectorException(ErrorKind.MODEL_UNAVAILABLE, "Model not loaded: iforest"));

        mockMvc.perform(post("/score").param("model", "IFOREST")
                        .contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.kind").value("MODEL_UNAVAILABLE"));
    }

    @Test
    void score_malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/score").contentType(MediaType.APPLICATION_JSON).content("[{\"csat\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("SCHEMA"));
    }
}
