package com.rfid.positioning.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Fixed reader antenna. The installed position is informational only: the positioning pipeline
 * uses antennas solely to lay out per-antenna signal columns.
 */
public record Antenna(
    @NotBlank(message = "Antenna id is required") String antennaId,
    @NotNull(message = "Antenna x position is required") Double x,
    @NotNull(message = "Antenna y position is required") Double y) {

  public Antenna {
    if (antennaId == null) {
      throw new IllegalArgumentException("Antenna id is required");
    }
  }

  public static Antenna of(String antennaId, double x, double y) {
    return new Antenna(antennaId, x, y);
  }
}
