package com.consullo.roimonitor.core;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import javax.imageio.ImageIO;
import org.apache.commons.lang3.Validate;

/**
 * PNG encoding, decoding and cropping of {@link Frame} payloads.
 *
 * @since 1.0
 */
public final class FrameCodec {

  public static final String FORMAT = "png";

  private FrameCodec() {
  }

  /**
   * Encodes an image into a frame.
   *
   * @param image raster
   * @param strategyName producing capture strategy
   * @param region display area covered by the image, may be null
   * @return frame
   * @throws IOException if encoding fails
   */
  public static Frame encode(final BufferedImage image, final String strategyName, final Region region)
          throws IOException {
    Validate.notNull(image, "image must not be null");
    final ByteArrayOutputStream out = new ByteArrayOutputStream(64 * 1024);
    if (!ImageIO.write(image, FORMAT, out)) {
      throw new IOException("No " + FORMAT + " writer available");
    }
    return Frame.builder()
            .data(out.toByteArray())
            .width(image.getWidth())
            .height(image.getHeight())
            .capturedAt(Instant.now())
            .strategyName(strategyName)
            .region(region)
            .build();
  }

  /**
   * Decodes a frame payload.
   *
   * @param frame frame
   * @return decoded raster
   * @throws IOException if the payload is not a readable image
   */
  public static BufferedImage decode(final Frame frame) throws IOException {
    Validate.notNull(frame, "frame must not be null");
    try (InputStream in = frame.openStream()) {
      return read(in);
    }
  }

  /**
   * Decodes raw image bytes, typically the standard output of a screenshot tool.
   *
   * @param payload encoded image
   * @return decoded raster
   * @throws IOException if the payload is empty or not a readable image
   */
  public static BufferedImage decode(final byte[] payload) throws IOException {
    if (payload == null || payload.length == 0) {
      throw new IOException("Image payload is empty");
    }
    return read(new ByteArrayInputStream(payload));
  }

  /**
   * Builds a frame from raw image bytes after checking that they decode.
   *
   * @param payload encoded image
   * @param strategyName producing capture strategy
   * @param region display area covered by the image, may be null
   * @return frame
   * @throws IOException if the payload is empty or malformed
   */
  public static Frame fromPayload(final byte[] payload, final String strategyName, final Region region)
          throws IOException {
    final BufferedImage image = decode(payload);
    return Frame.builder()
            .data(payload)
            .width(image.getWidth())
            .height(image.getHeight())
            .capturedAt(Instant.now())
            .strategyName(strategyName)
            .region(region)
            .build();
  }

  /**
   * Crops a frame to a sub-rectangle. The source frame is left untouched.
   *
   * @param frame source frame
   * @param area area relative to the frame's top-left corner
   * @param displayRegion display area the cropped frame covers
   * @return new frame
   * @throws IOException if decoding or encoding fails, or the area falls outside the frame
   */
  public static Frame crop(final Frame frame, final Region area, final Region displayRegion) throws IOException {
    Validate.notNull(area, "area must not be null");
    final BufferedImage source = decode(frame);
    if (area.left() < 0 || area.top() < 0 || area.right() > source.getWidth() || area.bottom() > source.getHeight()) {
      throw new IOException("Crop area " + area + " exceeds frame " + source.getWidth() + "x" + source.getHeight());
    }
    // getSubimage shares the raster, so copy before encoding.
    final BufferedImage copy = new BufferedImage(area.width(), area.height(), BufferedImage.TYPE_INT_RGB);
    final Graphics2D g = copy.createGraphics();
    try {
      g.drawImage(source.getSubimage(area.left(), area.top(), area.width(), area.height()), 0, 0, null);
    } finally {
      g.dispose();
    }
    final Frame cropped = encode(copy, frame.getStrategyName(), displayRegion);
    return cropped.toBuilder().capturedAt(frame.getCapturedAt()).clamped(frame.isClamped()).build();
  }

  private static BufferedImage read(final InputStream in) throws IOException {
    final BufferedImage image = ImageIO.read(in);
    if (image == null) {
      throw new IOException("Payload is not a recognized image format");
    }
    if (image.getWidth() <= 0 || image.getHeight() <= 0) {
      throw new IOException("Decoded image has no pixels");
    }
    return image;
  }
}
