package com.rfid.positioning.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * One raw observation of a tag by an antenna.
 *
 * @param tagId observed tag
 * @param antennaId observing antenna
 * @param readCount number of successful reads aggregated into this observation
 * @param signalStrength received signal strength, typically negative dBm
 * @param timestamp observation time
 */
public record Reading(
    @NotBlank(message = "Tag id is required") String tagId,
    @NotBlank(message = "Antenna id is required") String antennaId,
    @NotNull(message = "Read count is required")
        @Min(value = 0, message = "Read count must be non-negative")
        Integer readCount,
    @NotNull(message = "Signal strength is required") Double signalStrength,
    @NotNull(message = "Timestamp is required") Instant timestamp) {

  public Reading {
    if (tagId == null) {
      throw new IllegalArgumentException("Reading must name a tag");
    }
    if (antennaId == null) {
      throw new IllegalArgumentException("Reading of tag " + tagId + " must name an antenna");
    }
    if (signalStrength == null) {
      throw new IllegalArgumentException("Reading of tag " + tagId + " has no signal strength");
    }
    if (timestamp == null) {
      throw new IllegalArgumentException("Reading of tag " + tagId + " has no timestamp");
    }
    if (readCount == null) {
      throw new IllegalArgumentException("Reading of tag " + tagId + " has no read count");
    }
    if (readCount < 0) {
      throw new IllegalArgumentException("Read count must be non-negative: " + readCount);
    }
  }

  public static Reading of(
      String tagId, String antennaId, int readCount, double signalStrength, Instant timestamp) {
    return new Reading(tagId, antennaId, readCount, signalStrength, timestamp);
  }
}
