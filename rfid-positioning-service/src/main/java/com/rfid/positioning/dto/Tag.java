package com.rfid.positioning.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Passive RFID tag.
 *
 * <p>A {@link TagRole#REFERENCE} tag always carries its surveyed coordinates and never carries
 * predicted coordinates. A {@link TagRole#TARGET} tag may carry predicted coordinates once the
 * pipeline has evaluated it, and true coordinates only when they are known for validation.
 *
 * @param tagId tag identifier (EPC)
 * @param role reference or target
 * @param trueCoordinates surveyed position, null when unknown
 * @param predictedCoordinates last predicted position, null until evaluated
 * @param observed whether any reader has reported the tag
 */
public record Tag(
    @NotBlank(message = "Tag id is required") String tagId,
    @NotNull(message = "Tag role is required") TagRole role,
    Coordinates trueCoordinates,
    Coordinates predictedCoordinates,
    boolean observed) {

  public Tag {
    if (role == TagRole.REFERENCE) {
      if (trueCoordinates == null) {
        throw new IllegalArgumentException(
            "Reference tag " + tagId + " must carry true coordinates");
      }
      if (predictedCoordinates != null) {
        throw new IllegalArgumentException(
            "Reference tag " + tagId + " must not carry predicted coordinates");
      }
    }
  }

  public static Tag reference(String tagId, double x, double y) {
    return new Tag(tagId, TagRole.REFERENCE, Coordinates.of(x, y), null, false);
  }

  public static Tag target(String tagId) {
    return new Tag(tagId, TagRole.TARGET, null, null, false);
  }

  public static Tag target(String tagId, Coordinates trueCoordinates) {
    return new Tag(tagId, TagRole.TARGET, trueCoordinates, null, false);
  }

  @JsonIgnore
  public boolean isReference() {
    return role == TagRole.REFERENCE;
  }

  public Tag withPredictedCoordinates(Coordinates predicted) {
    return new Tag(tagId, role, trueCoordinates, predicted, observed);
  }

  public Tag withObserved(boolean value) {
    return new Tag(tagId, role, trueCoordinates, predictedCoordinates, value);
  }
}
