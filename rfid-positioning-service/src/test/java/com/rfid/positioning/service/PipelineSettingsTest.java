package com.rfid.positioning.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.rfid.positioning.config.PositioningProperties;
import com.rfid.positioning.dto.PositioningRunRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Pipeline Settings Tests")
class PipelineSettingsTest {

    @Test
    @DisplayName("should read defaults from properties")
    void shouldReadDefaults() {
        PipelineSettings settings = PipelineSettings.from(new PositioningProperties());

        assertThat(settings.warmupSize()).isEqualTo(10);
        assertThat(settings.windowSize()).isEqualTo(10);
        assertThat(settings.featureCount()).isNull();
        assertThat(settings.statisticScale()).isEqualTo(4);
        assertThat(settings.resolveFeatureCount(40)).isEqualTo(40);
    }

    @Test
    @DisplayName("should apply only the non-null overrides")
    void shouldApplyOverrides() {
        PipelineSettings settings = PipelineSettings.from(new PositioningProperties())
                .withOverrides(new PositioningRunRequest(3, null, 16));

        assertThat(settings.warmupSize()).isEqualTo(3);
        assertThat(settings.windowSize()).isEqualTo(10);
        assertThat(settings.resolveFeatureCount(40)).isEqualTo(16);
    }

    @Test
    @DisplayName("should keep settings when there are no overrides")
    void shouldIgnoreMissingOverrides() {
        PipelineSettings settings = PipelineSettings.from(new PositioningProperties());

        assertThat(settings.withOverrides(null)).isEqualTo(settings);
        assertThat(settings.withOverrides(PositioningRunRequest.defaults())).isEqualTo(settings);
    }
}
