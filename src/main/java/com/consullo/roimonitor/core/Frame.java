package com.consullo.roimonitor.core;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;

/**
 * Immutable captured image.
 *
 * <p>
 * The payload is an encoded raster (PNG for every built-in capture strategy).
 * The byte array is copied on the way in and never handed out, so a frame can
 * be shared between the monitor loop, the detection strategies and event
 * subscribers without further synchronization.
 * </p>
 */
public final class Frame {

  private final byte[] data;
  private final int width;
  private final int height;
  private final Instant capturedAt;
  private final String strategyName;
  private final Region region;
  private final boolean clamped;

  private Frame(Builder b) {
    this.data = b.data;
    this.width = b.width;
    this.height = b.height;
    this.capturedAt = b.capturedAt;
    this.strategyName = b.strategyName;
    this.region = b.region;
    this.clamped = b.clamped;
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public Instant getCapturedAt() {
    return capturedAt;
  }

  /**
   * Name of the capture strategy that produced the payload.
   */
  public String getStrategyName() {
    return strategyName;
  }

  /**
   * Display area covered by this frame, or null when unknown.
   */
  public Region getRegion() {
    return region;
  }

  /**
   * True when the requested region was clamped to the virtual display bounds.
   */
  public boolean isClamped() {
    return clamped;
  }

  public int size() {
    return data.length;
  }

  public byte[] toByteArray() {
    return Arrays.copyOf(data, data.length);
  }

  public ByteBuffer asReadOnlyBuffer() {
    return ByteBuffer.wrap(data).asReadOnlyBuffer();
  }

  public InputStream openStream() {
    return new ByteArrayInputStream(data);
  }

  /**
   * Returns true if both frames carry byte-identical payloads.
   *
   * @param other other frame
   * @return true if the payloads are equal
   */
  public boolean hasSamePayload(Frame other) {
    return other != null && Arrays.equals(data, other.data);
  }

  /**
   * Returns a builder pre-populated with this frame's values.
   *
   * @return builder
   */
  public Builder toBuilder() {
    return new Builder()
            .data(data)
            .width(width)
            .height(height)
            .capturedAt(capturedAt)
            .strategyName(strategyName)
            .region(region)
            .clamped(clamped);
  }

  @Override
  public String toString() {
    return "Frame{" + width + "x" + height + ", " + data.length + " bytes, strategy=" + strategyName
            + ", region=" + region + (clamped ? ", clamped" : "") + ", capturedAt=" + capturedAt + "}";
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {

    private byte[] data;
    private int width;
    private int height;
    private Instant capturedAt;
    private String strategyName;
    private Region region;
    private boolean clamped;

    private Builder() {
    }

    public Builder data(byte[] data) {
      this.data = data == null ? null : Arrays.copyOf(data, data.length);
      return this;
    }

    public Builder width(int width) {
      this.width = width;
      return this;
    }

    public Builder height(int height) {
      this.height = height;
      return this;
    }

    public Builder capturedAt(Instant capturedAt) {
      this.capturedAt = capturedAt;
      return this;
    }

    public Builder strategyName(String strategyName) {
      this.strategyName = strategyName;
      return this;
    }

    public Builder region(Region region) {
      this.region = region;
      return this;
    }

    public Builder clamped(boolean clamped) {
      this.clamped = clamped;
      return this;
    }

    public Frame build() {
      if (data == null || data.length == 0) {
        throw new IllegalArgumentException("data must not be empty.");
      }
      if (width <= 0 || height <= 0) {
        throw new IllegalArgumentException("width/height must be positive.");
      }
      if (strategyName == null || strategyName.isBlank()) {
        throw new IllegalArgumentException("strategyName must not be blank.");
      }
      if (capturedAt == null) {
        capturedAt = Instant.now();
      }
      return new Frame(this);
    }
  }
}
