package com.rfid.positioning;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rfid.positioning.dto.PositioningDatasetRequest;
import com.rfid.positioning.dto.PositioningRunRequest;
import com.rfid.positioning.repository.InMemoryReadingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
        "positioning.window.warmup-size=2",
        "positioning.window.window-size=2",
        "positioning.processing.workers=2"
})
@AutoConfigureMockMvc
@DisplayName("RFID Positioning Service Application Tests")
class RfidPositioningServiceApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private InMemoryReadingStore readingStore;

    @BeforeEach
    void setUp() {
        readingStore.clear();
    }

    @Test
    @DisplayName("should evaluate a dataset end to end")
    void shouldEvaluateDataset() throws Exception {
        PositioningDatasetRequest request = new PositioningDatasetRequest(
                PositioningTestData.scenarioAntennas(),
                PositioningTestData.scenarioTags(),
                PositioningTestData.scenarioReadings(),
                PositioningRunRequest.defaults());

        mockMvc.perform(post("/api/positioning/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.algorithm").value("nearest_neighbour"))
                .andExpect(jsonPath("$.featureRowCount").value(6))
                .andExpect(jsonPath("$.predictions[0].tagId").value("T2"))
                .andExpect(jsonPath("$.predictions[0].predX").value(0.0))
                .andExpect(jsonPath("$.errors[0].MAE_x").value(0.0));
    }

    @Test
    @DisplayName("should run over the configured store and persist predictions")
    void shouldRunOverStore() throws Exception {
        PositioningTestData.scenarioAntennas().forEach(readingStore::saveAntenna);
        PositioningTestData.scenarioTags().forEach(readingStore::saveTag);
        readingStore.appendReadings(PositioningTestData.scenarioReadings());

        mockMvc.perform(post("/api/positioning/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.persisted").value(true))
                .andExpect(jsonPath("$.predictions[0].predY").value(0.0));

        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.readingStore.details.trainable").value(true));
    }

    @Test
    @DisplayName("should reject a run over an empty store")
    void shouldRejectEmptyStore() throws Exception {
        mockMvc.perform(post("/api/positioning/run"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Positioning Configuration Error"));
    }
}
