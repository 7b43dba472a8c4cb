package com.rfid.positioning.service;

import com.rfid.positioning.dto.PositioningDatasetRequest;
import com.rfid.positioning.dto.PositioningReport;
import com.rfid.positioning.dto.PositioningRunRequest;

/**
 * Service interface for fingerprint positioning of RFID tags.
 */
public interface PositioningService {

    /**
     * Runs the pipeline over the configured store and writes predicted coordinates of target tags
     * back to it.
     *
     * @param request optional overrides of the configured window and feature settings
     * @return the positioning report
     */
    PositioningReport run(PositioningRunRequest request);

    /**
     * Runs the pipeline over a supplied dataset without persisting anything.
     *
     * @param request dataset and optional overrides
     * @return the positioning report
     */
    PositioningReport evaluate(PositioningDatasetRequest request);
}
