package com.rfid.positioning.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Self-contained dataset to position without touching the configured store.
 *
 * @param antennas registered antennas
 * @param tags reference and target tags
 * @param readings raw readings
 * @param options optional pipeline overrides
 */
public record PositioningDatasetRequest(
    @NotNull(message = "Antennas are required") List<@Valid Antenna> antennas,
    @NotEmpty(message = "At least one tag is required") List<@Valid Tag> tags,
    @NotNull(message = "Readings are required") List<@Valid Reading> readings,
    @Valid PositioningRunRequest options) {}
