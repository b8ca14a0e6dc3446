package com.commerce.sync.controller;

import com.commerce.sync.domain.ResourceKey;
import com.commerce.sync.service.platform.SimulatedPlatformClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SyncControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    @Qualifier("sourcePlatform")
    private SimulatedPlatformClient source;

    @Autowired
    @Qualifier("targetPlatform")
    private SimulatedPlatformClient target;

    @BeforeEach
    void setUp() {
        source.clear();
        target.clear();
        source.setSimulateOutage(false);
        target.setSimulateOutage(false);
    }

    @Test
    @DisplayName("POST /run returns the finished run")
    void shouldTriggerRun() throws Exception {
        source.setQuantity(ResourceKey.of("SKU-A"), new BigDecimal("8"));
        target.setQuantity(ResourceKey.of("SKU-A"), new BigDecimal("6"));

        mockMvc.perform(post("/api/v1/sync/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operation\":\"INVENTORY\",\"resourceKeys\":[\"sku-a\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("COMPLETED"))
                .andExpect(jsonPath("$.resourceKeys[0]").value("SKU-A"))
                .andExpect(jsonPath("$.resolutions[0].strategy").value("conservative_minimum"))
                .andExpect(jsonPath("$.succeeded").value(1));
    }

    @Test
    @DisplayName("POST /run without an operation is rejected")
    void shouldRejectMissingOperation() throws Exception {
        mockMvc.perform(post("/api/v1/sync/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resourceKeys\":[\"SKU-A\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("operation is required"));
    }

    @Test
    @DisplayName("POST /run with an unknown operation is rejected")
    void shouldRejectUnknownOperation() throws Exception {
        mockMvc.perform(post("/api/v1/sync/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operation\":\"SHIPPING\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    @DisplayName("POST /run with a blank key is rejected")
    void shouldRejectBlankKey() throws Exception {
        mockMvc.perform(post("/api/v1/sync/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operation\":\"PRICE\",\"resourceKeys\":[\"  \"]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Cancelling a run that is not in flight returns 404")
    void shouldReturnNotFoundForUnknownRun() throws Exception {
        mockMvc.perform(post("/api/v1/sync/runs/no-such-run/cancel"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /locks reports the normalized key and whether it is held")
    void shouldReportLockStatus() throws Exception {
        mockMvc.perform(get("/api/v1/sync/locks/INVENTORY/sku-b"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resourceKey").value("SKU-B"))
                .andExpect(jsonPath("$.held").value(false));
    }

    @Test
    @DisplayName("GET /locks with an unknown operation is rejected")
    void shouldRejectUnknownLockOperation() throws Exception {
        mockMvc.perform(get("/api/v1/sync/locks/SHIPPING/SKU-A"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /stats returns statistics")
    void shouldReturnStats() throws Exception {
        mockMvc.perform(get("/api/v1/sync/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeRunIds").isArray())
                .andExpect(jsonPath("$.conflictWindowDays").value(7));
    }

    @Test
    @DisplayName("GET /stats with a non-positive window is rejected")
    void shouldRejectNonPositiveStatsWindow() throws Exception {
        mockMvc.perform(get("/api/v1/sync/stats").param("days", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /conflicts/{resourceKey} returns the newest resolution first")
    void shouldReturnConflictHistory() throws Exception {
        source.setQuantity(ResourceKey.of("SKU-H"), new BigDecimal("4"));
        target.setQuantity(ResourceKey.of("SKU-H"), new BigDecimal("9"));
        mockMvc.perform(post("/api/v1/sync/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"operation\":\"INVENTORY\",\"resourceKeys\":[\"SKU-H\"]}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/sync/conflicts/sku-h"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].resourceKey").value("SKU-H"))
                .andExpect(jsonPath("$[0].strategy").value("conservative_minimum"))
                .andExpect(jsonPath("$[0].evidence").isNotEmpty());
    }
}
