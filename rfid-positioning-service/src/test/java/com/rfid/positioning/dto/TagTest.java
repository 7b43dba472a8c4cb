package com.rfid.positioning.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Tag Tests")
class TagTest {

  @Nested
  @DisplayName("Role Invariants")
  class RoleInvariantTests {

    @Test
    @DisplayName("should reject reference tag without true coordinates")
    void shouldRejectReferenceWithoutTruth() {
      assertThatThrownBy(() -> new Tag("R1", TagRole.REFERENCE, null, null, false))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("must carry true coordinates");
    }

    @Test
    @DisplayName("should reject reference tag with predicted coordinates")
    void shouldRejectReferenceWithPrediction() {
      assertThatThrownBy(
              () ->
                  new Tag(
                      "R1",
                      TagRole.REFERENCE,
                      Coordinates.of(0, 0),
                      Coordinates.of(1, 1),
                      false))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("must not carry predicted coordinates");
    }

    @Test
    @DisplayName("should allow target tag with truth and prediction")
    void shouldAllowTargetWithTruthAndPrediction() {
      Tag tag = Tag.target("T1", Coordinates.of(2, 2)).withPredictedCoordinates(Coordinates.of(1.5, 2.5));

      assertThat(tag.isReference()).isFalse();
      assertThat(tag.trueCoordinates()).isEqualTo(Coordinates.of(2, 2));
      assertThat(tag.predictedCoordinates()).isEqualTo(Coordinates.of(1.5, 2.5));
    }

    @Test
    @DisplayName("should allow target tag without any coordinates")
    void shouldAllowBareTarget() {
      Tag tag = Tag.target("T1");

      assertThat(tag.trueCoordinates()).isNull();
      assertThat(tag.predictedCoordinates()).isNull();
      assertThat(tag.observed()).isFalse();
    }
  }

  @Nested
  @DisplayName("Role Codes")
  class RoleCodeTests {

    @Test
    @DisplayName("should resolve short codes and enum names")
    void shouldResolveRoleValues() {
      assertThat(TagRole.fromValue("ref")).isEqualTo(TagRole.REFERENCE);
      assertThat(TagRole.fromValue("TAR")).isEqualTo(TagRole.TARGET);
      assertThat(TagRole.fromValue("reference")).isEqualTo(TagRole.REFERENCE);
    }

    @Test
    @DisplayName("should reject unknown role")
    void shouldRejectUnknownRole() {
      assertThatThrownBy(() -> TagRole.fromValue("anchor"))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> TagRole.fromValue(null))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  @DisplayName("should reject non-finite coordinates")
  void shouldRejectNonFiniteCoordinates() {
    assertThatThrownBy(() -> Coordinates.of(Double.NaN, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Coordinates.of(0, Double.POSITIVE_INFINITY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should reject negative read count")
  void shouldRejectNegativeReadCount() {
    assertThatThrownBy(() -> Reading.of("T1", "1", -1, -50.0, java.time.Instant.EPOCH))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
