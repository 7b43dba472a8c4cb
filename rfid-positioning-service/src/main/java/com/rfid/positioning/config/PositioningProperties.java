package com.rfid.positioning.config;

import com.rfid.positioning.model.RegressionAlgorithmType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the positioning pipeline.
 * Maps to the 'positioning' section in application.yml.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "positioning")
public class PositioningProperties {

    @Valid
    private Window window = new Window();
    @Valid
    private Features features = new Features();
    @Valid
    private Model model = new Model();
    @Valid
    private Processing processing = new Processing();

    @Data
    public static class Window {
        /** Rows per tag that share the warm-up statistics. */
        @Min(value = 1, message = "Warm-up size must be at least 1")
        private int warmupSize = 10;

        /** Width of the trailing window after warm-up. */
        @Min(value = 1, message = "Window size must be at least 1")
        private int windowSize = 10;
    }

    @Data
    public static class Features {
        /** Decimal places statistics are rounded to; unset keeps full precision. */
        @Min(value = 0, message = "Statistic scale must not be negative")
        @Max(value = 15, message = "Statistic scale cannot exceed 15")
        private Integer statisticScale = 4;
    }

    @Data
    public static class Model {
        @NotNull(message = "Regression algorithm is required")
        private RegressionAlgorithmType algorithm = RegressionAlgorithmType.NEAREST_NEIGHBOUR;

        /** Feature-vector prefix fed to the regressors; unset uses the whole vector. */
        @Min(value = 1, message = "Feature count must be at least 1")
        private Integer featureCount;

        @Min(value = 1, message = "Neighbour count must be at least 1")
        private int neighbours = 3;

        @DecimalMin(value = "0.0", message = "Ridge penalty must not be negative")
        private double ridgePenalty = 1.0;
    }

    @Data
    public static class Processing {
        @Min(value = 1, message = "Worker count must be at least 1")
        private int workers = 4;
    }
}
