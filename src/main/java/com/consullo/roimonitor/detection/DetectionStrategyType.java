package com.consullo.roimonitor.detection;

import java.util.Locale;

/**
 * Change-detection algorithms selectable per session.
 *
 * @since 1.0
 */
public enum DetectionStrategyType {

  /** Relative byte-size difference of the encoded payloads. */
  SIZE("size"),

  /** Mean channel difference over a fixed grid of sampled pixels. */
  PIXEL("pixel"),

  /** Digest equality of the encoded payloads. */
  HASH("hash");

  private final String wireName;

  DetectionStrategyType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire name such as {@code "pixel"}. Matching is case-insensitive.
   *
   * @param name wire name
   * @return strategy type
   * @throws IllegalArgumentException if the name is unknown
   */
  public static DetectionStrategyType fromWireName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Strategy name must not be null.");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (DetectionStrategyType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown change-detection strategy: " + name);
  }
}
