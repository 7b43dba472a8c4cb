package com.rfid.positioning.controller;

import com.rfid.positioning.dto.PositioningDatasetRequest;
import com.rfid.positioning.dto.PositioningReport;
import com.rfid.positioning.dto.PositioningRunRequest;
import com.rfid.positioning.service.PositioningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for RFID fingerprint positioning.
 *
 * Errors are raised as exceptions and rendered by {@link GlobalExceptionHandler}:
 * - 400 Bad Request: validation errors and invalid pipeline configuration
 * - 422 Unprocessable Entity: feature gaps in rows used for training or prediction
 * - 500 Internal Server Error: unexpected failures
 */
@RestController
@RequestMapping("/api/positioning")
@Validated
@Tag(name = "RFID Positioning", description = "APIs for fingerprint-based RFID tag positioning")
public class PositioningController {

    private final PositioningService positioningService;

    @Autowired
    public PositioningController(PositioningService positioningService) {
        this.positioningService = positioningService;
    }

    @PostMapping(value = "/run", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Run positioning",
            description = "Train on reference tags in the store, predict every tag and persist target predictions")
    public ResponseEntity<PositioningReport> run(
            @Valid @RequestBody(required = false) PositioningRunRequest request) {
        PositioningReport report = positioningService.run(
                request != null ? request : PositioningRunRequest.defaults());
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(report);
    }

    @PostMapping(value = "/evaluate", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Evaluate dataset",
            description = "Position the tags of a supplied dataset without persisting anything")
    public ResponseEntity<PositioningReport> evaluate(
            @Valid @RequestBody PositioningDatasetRequest request) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(positioningService.evaluate(request));
    }
}
