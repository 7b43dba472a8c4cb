package com.rfid.positioning.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Role of a tag in fingerprint positioning. */
public enum TagRole {
  /** Tag at a surveyed position, used to supervise model training. */
  REFERENCE("ref"),
  /** Tag whose position is unknown and must be predicted. */
  TARGET("tar");

  private final String code;

  TagRole(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  /**
   * Resolves a role from its short code ("ref", "tar") or its enum name, ignoring case.
   *
   * @throws IllegalArgumentException if the value names no role
   */
  @JsonCreator
  public static TagRole fromValue(String value) {
    if (value != null) {
      for (TagRole role : values()) {
        if (role.code.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
          return role;
        }
      }
    }
    throw new IllegalArgumentException("Unknown tag role: " + value);
  }
}
