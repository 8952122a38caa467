package com.consullo.roimonitor.detection;

import org.apache.commons.lang3.Validate;

/**
 * Creates change-detection strategies by type.
 *
 * @since 1.0
 */
public final class ChangeDetectionStrategyFactory {

  private final int pixelGridColumns;
  private final int pixelGridRows;
  private final String hashAlgorithm;

  /**
   * Creates a factory.
   *
   * @param pixelGridColumns sample columns for the pixel strategy
   * @param pixelGridRows sample rows for the pixel strategy
   * @param hashAlgorithm digest algorithm for the hash strategy
   */
  public ChangeDetectionStrategyFactory(int pixelGridColumns, int pixelGridRows, String hashAlgorithm) {
    Validate.isTrue(pixelGridColumns > 0, "pixelGridColumns must be positive");
    Validate.isTrue(pixelGridRows > 0, "pixelGridRows must be positive");
    Validate.notBlank(hashAlgorithm, "hashAlgorithm must not be blank");
    this.pixelGridColumns = pixelGridColumns;
    this.pixelGridRows = pixelGridRows;
    this.hashAlgorithm = hashAlgorithm;
  }

  public static ChangeDetectionStrategyFactory defaults() {
    return new ChangeDetectionStrategyFactory(
        SampledPixelDiffStrategy.DEFAULT_GRID_SIZE,
        SampledPixelDiffStrategy.DEFAULT_GRID_SIZE,
        ContentHashStrategy.DEFAULT_ALGORITHM);
  }

  /**
   * Creates a new strategy instance.
   *
   * @param type strategy type
   * @return strategy
   */
  public ChangeDetectionStrategy create(DetectionStrategyType type) {
    Validate.notNull(type, "type must not be null");
    switch (type) {
      case SIZE:
        return new SizeHeuristicStrategy();
      case PIXEL:
        return new SampledPixelDiffStrategy(pixelGridColumns, pixelGridRows);
      case HASH:
        return new ContentHashStrategy(hashAlgorithm);
      default:
        throw new IllegalArgumentException("Unsupported strategy type: " + type);
    }
  }
}
