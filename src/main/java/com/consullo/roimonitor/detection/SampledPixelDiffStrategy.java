package com.consullo.roimonitor.detection;

import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.core.FrameCodec;
import java.awt.image.BufferedImage;
import java.io.IOException;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares decoded pixels on a fixed sampling grid.
 *
 * <p>
 * Both frames are decoded and a grid of {@code columns x rows} sample points,
 * placed at the centres of equal-sized cells, is read from each. The magnitude
 * is the mean absolute difference over the red, green and blue channels of all
 * samples, scaled from 0..255 to 0..100.
 * </p>
 *
 * <p>
 * Frames of different dimensions are reported as changed with magnitude 100.
 * A payload that cannot be decoded yields an unchanged verdict with magnitude 0.
 * </p>
 */
public final class SampledPixelDiffStrategy implements ChangeDetectionStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(SampledPixelDiffStrategy.class);

  public static final int DEFAULT_GRID_SIZE = 32;

  private final int columns;
  private final int rows;

  // Last decoded baseline; the baseline stays the same across many ticks.
  private volatile DecodedBaseline decodedBaseline;

  private record DecodedBaseline(Frame frame, BufferedImage image) {
  }

  public SampledPixelDiffStrategy() {
    this(DEFAULT_GRID_SIZE, DEFAULT_GRID_SIZE);
  }

  public SampledPixelDiffStrategy(final int columns, final int rows) {
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");
    this.columns = columns;
    this.rows = rows;
  }

  @Override
  public DetectionStrategyType type() {
    return DetectionStrategyType.PIXEL;
  }

  @Override
  public DetectionVerdict compare(final Frame baseline, final Frame candidate, final double threshold) {
    Validate.notNull(baseline, "baseline must not be null");
    Validate.notNull(candidate, "candidate must not be null");

    if (baseline.getWidth() != candidate.getWidth() || baseline.getHeight() != candidate.getHeight()) {
      LOGGER.debug("Dimension mismatch {}x{} vs {}x{}, treating as changed",
              baseline.getWidth(), baseline.getHeight(), candidate.getWidth(), candidate.getHeight());
      return DetectionVerdict.changed(type(), 100.0);
    }
    if (baseline.hasSamePayload(candidate)) {
      return DetectionVerdict.unchanged(type(), 0.0);
    }

    final BufferedImage before;
    final BufferedImage after;
    try {
      before = decodeBaseline(baseline);
      after = FrameCodec.decode(candidate);
    } catch (final IOException e) {
      LOGGER.warn("Pixel comparison skipped, frame could not be decoded: {}", e.getMessage());
      return DetectionVerdict.unchanged(type(), 0.0);
    }

    if (before.getWidth() != after.getWidth() || before.getHeight() != after.getHeight()) {
      return DetectionVerdict.changed(type(), 100.0);
    }

    final double magnitude = meanChannelDifference(before, after) / 255.0 * 100.0;
    return DetectionVerdict.of(type(), magnitude, threshold);
  }

  private double meanChannelDifference(final BufferedImage before, final BufferedImage after) {
    final int width = before.getWidth();
    final int height = before.getHeight();
    final int sampleColumns = Math.min(columns, width);
    final int sampleRows = Math.min(rows, height);

    long total = 0;
    int samples = 0;
    for (int row = 0; row < sampleRows; row++) {
      final int y = (int) (((2L * row + 1) * height) / (2L * sampleRows));
      for (int col = 0; col < sampleColumns; col++) {
        final int x = (int) (((2L * col + 1) * width) / (2L * sampleColumns));
        final int a = before.getRGB(x, y);
        final int b = after.getRGB(x, y);
        total += Math.abs(((a >> 16) & 0xFF) - ((b >> 16) & 0xFF));
        total += Math.abs(((a >> 8) & 0xFF) - ((b >> 8) & 0xFF));
        total += Math.abs((a & 0xFF) - (b & 0xFF));
        samples++;
      }
    }
    return samples == 0 ? 0.0 : (double) total / (samples * 3.0);
  }

  private BufferedImage decodeBaseline(final Frame baseline) throws IOException {
    final DecodedBaseline cached = decodedBaseline;
    if (cached != null && cached.frame() == baseline) {
      return cached.image();
    }
    final BufferedImage image = FrameCodec.decode(baseline);
    decodedBaseline = new DecodedBaseline(baseline, image);
    return image;
  }
}
