package com.logsense.anomaly.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logsense.anomaly.config.AerospikeConfig;
import com.logsense.anomaly.config.DetectionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private DetectionConfig detectionConfig;

    @MockBean
    private AerospikeConfig aerospikeConfig;

    @BeforeEach
    void setUp() {
        when(detectionConfig.getDefaultContamination()).thenReturn(0.05);
        when(detectionConfig.getNumTrees()).thenReturn(200);
        when(detectionConfig.getSubsampleSize()).thenReturn(256);
        when(detectionConfig.getSeed()).thenReturn(42L);
        when(detectionConfig.getParallelism()).thenReturn(1);
        when(detectionConfig.getHistoryLimit()).thenReturn(25);
    }

    @Test
    void getDetectionConfig_success() throws Exception {
        mockMvc.perform(get("/config/detection"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaultContamination").value(0.05))
                .andExpect(jsonPath("$.numTrees").value(200))
                .andExpect(jsonPath("$.subsampleSize").value(256))
                .andExpect(jsonPath("$.seed").value(42))
                .andExpect(jsonPath("$.parallelism").value(1))
                .andExpect(jsonPath("$.historyLimit").value(25));
    }

    @Test
    void updateDetectionConfig_success() throws Exception {
        mockMvc.perform(put("/config/detection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "defaultContamination", 0.1,
                                "numTrees", 100,
                                "seed", 7,
                                "parallelism", 4))))
                .andExpect(status().isOk());

        verify(detectionConfig).setDefaultContamination(0.1);
        verify(detectionConfig).setNumTrees(100);
        verify(detectionConfig).setSubsampleSize(256);
        verify(detectionConfig).setSeed(7L);
        verify(detectionConfig).setParallelism(4);
        verify(detectionConfig).setHistoryLimit(25);
    }

    @Test
    void updateDetectionConfig_contaminationOutOfRange_returns400() throws Exception {
        mockMvc.perform(put("/config/detection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("defaultContamination", 0.5))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("defaultContamination"));

        verify(detectionConfig, never()).setDefaultContamination(anyDouble());
    }

    @Test
    void updateDetectionConfig_zeroTrees_returns400() throws Exception {
        mockMvc.perform(put("/config/detection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("numTrees", 0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("numTrees"));

        verify(detectionConfig, never()).setNumTrees(anyInt());
    }

    @Test
    void updateDetectionConfig_zeroParallelism_returns400() throws Exception {
        mockMvc.perform(put("/config/detection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("parallelism", 0))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("parallelism"));
    }
}
