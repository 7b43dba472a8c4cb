package com.rfid.positioning.service;

import com.rfid.positioning.config.PositioningProperties;
import com.rfid.positioning.dto.Antenna;
import com.rfid.positioning.dto.Coordinates;
import com.rfid.positioning.dto.PositioningDatasetRequest;
import com.rfid.positioning.dto.PositioningReport;
import com.rfid.positioning.dto.PositioningRunRequest;
import com.rfid.positioning.dto.Reading;
import com.rfid.positioning.dto.Tag;
import com.rfid.positioning.dto.TagPrediction;
import com.rfid.positioning.dto.TagRole;
import com.rfid.positioning.evaluation.EvaluationResult;
import com.rfid.positioning.evaluation.PositionEvaluator;
import com.rfid.positioning.evaluation.TagPositionEstimate;
import com.rfid.positioning.feature.FeatureTable;
import com.rfid.positioning.feature.WindowFeatureExtractor;
import com.rfid.positioning.fingerprint.FingerprintAssembler;
import com.rfid.positioning.fingerprint.FingerprintTable;
import com.rfid.positioning.model.CoordinateModelTrainer;
import com.rfid.positioning.model.TrainedCoordinateModels;
import com.rfid.positioning.repository.InMemoryReadingStore;
import com.rfid.positioning.repository.ReadingStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Implementation of the PositioningService interface.
 *
 * This service:
 * 1. Reads antennas, tags and readings from a ReadingStore snapshot
 * 2. Assembles per-(tag, timestamp) fingerprints, left-joined with true coordinates
 * 3. Extracts two-phase sliding-window features per tag
 * 4. Trains the X and Y regressors on reference-tag rows
 * 5. Evaluates every tag and averages each tag's row predictions into one position
 * 6. Writes target-tag positions back to the store when the run is persistent
 */
@Service
public class PositioningServiceImpl implements PositioningService {

    private static final Logger logger = LoggerFactory.getLogger(PositioningServiceImpl.class);

    static final String PIPELINE_TIMER = "rfid.positioning.pipeline.duration";
    static final String FEATURE_ROWS_COUNTER = "rfid.positioning.feature.rows";
    static final String PREDICTIONS_COUNTER = "rfid.positioning.predictions";

    private final ReadingStore readingStore;
    private final FingerprintAssembler assembler;
    private final CoordinateModelTrainer trainer;
    private final PositionEvaluator evaluator;
    private final Executor executor;
    private final PositioningProperties properties;
    private final MeterRegistry meterRegistry;

    public PositioningServiceImpl(
            ReadingStore readingStore,
            FingerprintAssembler assembler,
            CoordinateModelTrainer trainer,
            PositionEvaluator evaluator,
            @Qualifier("positioningTaskExecutor") Executor executor,
            PositioningProperties properties,
            MeterRegistry meterRegistry) {
        this.readingStore = readingStore;
        this.assembler = assembler;
        this.trainer = trainer;
        this.evaluator = evaluator;
        this.executor = executor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public PositioningReport run(PositioningRunRequest request) {
        PipelineSettings settings = PipelineSettings.from(properties).withOverrides(request);
        logger.info("Running positioning pipeline over configured store with {}", settings);
        return timed("store", () -> runPipeline(readingStore, settings, true));
    }

    @Override
    public PositioningReport evaluate(PositioningDatasetRequest request) {
        PipelineSettings settings = PipelineSettings.from(properties).withOverrides(request.options());
        logger.info("Evaluating supplied dataset of {} antennas, {} tags, {} readings with {}",
                request.antennas().size(), request.tags().size(), request.readings().size(), settings);
        InMemoryReadingStore snapshot =
                InMemoryReadingStore.of(request.antennas(), request.tags(), request.readings());
        return timed("dataset", () -> runPipeline(snapshot, settings, false));
    }

    /**
     * Runs every pipeline stage over {@code store}.
     *
     * @param store source of the snapshot and, when {@code persist} is set, target of write-back
     * @param settings window and feature settings
     * @param persist whether target-tag predictions are saved to the store
     * @return the report
     */
    PositioningReport runPipeline(ReadingStore store, PipelineSettings settings, boolean persist) {
        List<Antenna> antennas = store.listAntennas();
        List<Tag> tags = store.listTags();
        List<Reading> readings = store.listReadings();

        Map<String, Coordinates> trueCoordinates = new HashMap<>();
        tags.stream()
                .filter(tag -> tag.trueCoordinates() != null)
                .forEach(tag -> trueCoordinates.put(tag.tagId(), tag.trueCoordinates()));
        Set<String> referenceTagIds = tags.stream()
                .filter(Tag::isReference)
                .map(Tag::tagId)
                .collect(Collectors.toSet());
        Set<String> targetTagIds = tags.stream()
                .filter(tag -> tag.role() == TagRole.TARGET)
                .map(Tag::tagId)
                .collect(Collectors.toSet());

        FingerprintTable fingerprints = assembler.assemble(readings, antennas, trueCoordinates);
        WindowFeatureExtractor extractor = new WindowFeatureExtractor(
                settings.warmupSize(), settings.windowSize(), settings.statisticScale(), executor);
        FeatureTable features = extractor.extract(fingerprints);
        meterRegistry.counter(FEATURE_ROWS_COUNTER).increment(features.size());

        int featureCount = settings.resolveFeatureCount(features.layout().length());
        TrainedCoordinateModels models = trainer.train(features, referenceTagIds, featureCount);
        EvaluationResult evaluation = evaluator.evaluate(features, models);

        List<TagPrediction> predictions = new ArrayList<>();
        for (TagPositionEstimate estimate : evaluation.tagPositions()) {
            if (!targetTagIds.contains(estimate.tagId())) {
                continue;
            }
            predictions.add(new TagPrediction(
                    estimate.tagId(), estimate.x(), estimate.y(), estimate.rowCount()));
            if (persist) {
                store.savePredictedPosition(estimate.tagId(), estimate.coordinates());
            }
        }
        meterRegistry.counter(PREDICTIONS_COUNTER).increment(predictions.size());

        if (persist) {
            logger.info("Persisted predicted coordinates for {} target tags", predictions.size());
        }
        return new PositioningReport(
                Instant.now(),
                models.algorithm(),
                features.layout().antennaLayout().size(),
                features.size(),
                features.layout().length(),
                featureCount,
                settings.warmupSize(),
                settings.windowSize(),
                models.trainingRows(),
                predictions,
                evaluation.errors(),
                persist);
    }

    private PositioningReport timed(String source, Supplier<PositioningReport> pipeline) {
        return Timer.builder(PIPELINE_TIMER)
                .tag("source", source)
                .register(meterRegistry)
                .record(pipeline);
    }
}
