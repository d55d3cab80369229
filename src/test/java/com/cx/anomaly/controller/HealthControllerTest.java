package com.cx.anomaly.controller;

import com.cx.anomaly.registry.ModelRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ModelRegistry registry;

    @Test
    void health_loaded_isHealthy() throws Exception {
        when(registry.isLoaded()).thenReturn(true);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.model_loaded").value(true))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void health_notLoaded_isDegradedButStill200() throws Exception {
        when(registry.isLoaded()).thenReturn(false);

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.model_loaded").value(false));
    }

    @Test
    void root_listsEndpoints() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("CX Anomaly Detector API"))
                .andExpect(jsonPath("$.endpoints.score").value("/score?model=iforest|lof|both"));
    }
}
