package com.rfid.positioning.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.rfid.positioning.model.NearestNeighbourRegression;
import com.rfid.positioning.model.RegressionAlgorithm;
import com.rfid.positioning.model.RegressionAlgorithmType;
import com.rfid.positioning.model.RidgeRegression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@DisplayName("Pipeline Config Tests")
class PipelineConfigTest {

    @Test
    @DisplayName("should size the executor from the worker count")
    void shouldSizeExecutor() {
        PositioningProperties properties = new PositioningProperties();
        properties.getProcessing().setWorkers(3);
        PipelineConfig config = new PipelineConfig(properties);

        ThreadPoolTaskExecutor executor = config.positioningTaskExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(3);
            assertThat(executor.getMaxPoolSize()).isEqualTo(3);
            assertThat(executor.getThreadPoolExecutor().getQueue().remainingCapacity()).isEqualTo(192);
        } finally {
            config.shutdown();
        }
    }

    @Test
    @DisplayName("should build the configured regression algorithm")
    void shouldBuildConfiguredAlgorithm() {
        PositioningProperties properties = new PositioningProperties();
        PipelineConfig config = new PipelineConfig(properties);

        RegressionAlgorithm knn = config.regressionAlgorithm();
        assertThat(knn).isInstanceOf(NearestNeighbourRegression.class);
        assertThat(((NearestNeighbourRegression) knn).getNeighbours()).isEqualTo(3);

        properties.getModel().setAlgorithm(RegressionAlgorithmType.RIDGE);
        properties.getModel().setRidgePenalty(0.5);
        RegressionAlgorithm ridge = config.regressionAlgorithm();
        assertThat(ridge).isInstanceOf(RidgeRegression.class);
        assertThat(((RidgeRegression) ridge).getPenalty()).isEqualTo(0.5);
    }
}
