package com.rfid.positioning.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.rfid.positioning.PositioningTestData;
import com.rfid.positioning.dto.PositioningDatasetRequest;
import com.rfid.positioning.dto.PositioningReport;
import com.rfid.positioning.dto.PositioningRunRequest;
import com.rfid.positioning.dto.TagPrediction;
import com.rfid.positioning.evaluation.TagErrorSummary;
import com.rfid.positioning.exception.MissingFeatureValueException;
import com.rfid.positioning.exception.PositioningConfigurationException;
import com.rfid.positioning.service.PositioningService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("Positioning Controller Tests")
class PositioningControllerTest {

    @Mock
    private PositioningService positioningService;

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new PositioningController(positioningService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        objectMapper = JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    private PositioningReport sampleReport(boolean persisted) {
        return new PositioningReport(
                Instant.parse("2025-05-01T00:00:00Z"),
                "nearest_neighbour",
                2, 6, 20, 20, 2, 2, 3,
                List.of(new TagPrediction("T2", 0.0, 0.0, 3)),
                List.of(TagErrorSummary.of("T1", 0.0, 0.0), TagErrorSummary.of("T2", 2.0, 2.0)),
                persisted);
    }

    private PositioningDatasetRequest scenarioRequest() {
        return new PositioningDatasetRequest(
                PositioningTestData.scenarioAntennas(),
                PositioningTestData.scenarioTags(),
                PositioningTestData.scenarioReadings(),
                new PositioningRunRequest(2, 2, null));
    }

    @Nested
    @DisplayName("Run Endpoint")
    class RunEndpointTests {

        @Test
        @DisplayName("should run with defaults when no body is sent")
        void shouldRunWithDefaults() throws Exception {
            when(positioningService.run(PositioningRunRequest.defaults())).thenReturn(sampleReport(true));

            mockMvc.perform(post("/api/positioning/run"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.persisted").value(true))
                    .andExpect(jsonPath("$.predictions[0].tagId").value("T2"))
                    .andExpect(jsonPath("$.predictions[0].rowCount").value(3));
        }

        @Test
        @DisplayName("should reject non-positive window sizes")
        void shouldRejectInvalidOverrides() throws Exception {
            mockMvc.perform(post("/api/positioning/run")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"warmupSize\":0}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Validation Failed"))
                    .andExpect(jsonPath("$.fieldErrors.warmupSize").value("Warm-up size must be at least 1"));

            verify(positioningService, never()).run(any());
        }

        @Test
        @DisplayName("should map configuration errors to 400")
        void shouldMapConfigurationErrors() throws Exception {
            when(positioningService.run(any()))
                    .thenThrow(new PositioningConfigurationException("No reference tags are registered"));

            mockMvc.perform(post("/api/positioning/run"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Positioning Configuration Error"))
                    .andExpect(jsonPath("$.message").value("No reference tags are registered"));
        }

        @Test
        @DisplayName("should map missing feature values to 422")
        void shouldMapMissingFeatureValues() throws Exception {
            when(positioningService.run(any())).thenThrow(
                    new MissingFeatureValueException("T2", Instant.EPOCH, "rssi_antenna2"));

            mockMvc.perform(post("/api/positioning/run"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error").value("Missing Feature Value"))
                    .andExpect(jsonPath("$.tagId").value("T2"))
                    .andExpect(jsonPath("$.feature").value("rssi_antenna2"));
        }
    }

    @Nested
    @DisplayName("Evaluate Endpoint")
    class EvaluateEndpointTests {

        @Test
        @DisplayName("should return the report for a supplied dataset")
        void shouldEvaluateDataset() throws Exception {
            when(positioningService.evaluate(any())).thenReturn(sampleReport(false));

            mockMvc.perform(post("/api/positioning/evaluate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(scenarioRequest())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.persisted").value(false))
                    .andExpect(jsonPath("$.featureLength").value(20))
                    .andExpect(jsonPath("$.errors[1].tagId").value("T2"))
                    .andExpect(jsonPath("$.errors[1].MAE_x").value(2.0))
                    .andExpect(jsonPath("$.errors[1].MAE_avg").value(2.0));

            verify(positioningService).evaluate(scenarioRequest());
        }

        @Test
        @DisplayName("should reject a dataset without tags")
        void shouldRejectEmptyTags() throws Exception {
            mockMvc.perform(post("/api/positioning/evaluate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"antennas\":[],\"tags\":[],\"readings\":[]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.fieldErrors.tags").value("At least one tag is required"));
        }

        @Test
        @DisplayName("should reject a reference tag without true coordinates")
        void shouldRejectReferenceWithoutTruth() throws Exception {
            mockMvc.perform(post("/api/positioning/evaluate")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"antennas\":[],\"tags\":[{\"tagId\":\"T1\",\"role\":\"ref\"}],\"readings\":[]}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Bad Request"));

            verify(positioningService, never()).evaluate(any());
        }
    }
}
