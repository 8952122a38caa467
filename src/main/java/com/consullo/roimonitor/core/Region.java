package com.consullo.roimonitor.core;

import java.awt.Rectangle;

/**
 * Rectangle of the virtual display in full-display pixel coordinates. Right and bottom are exclusive.
 *
 * <p>A region is a plain value; {@link #validate()} checks the monitoring-area invariants so that callers
 * can decide where the check happens (start of a session, region update, after clamping).
 *
 * @param left left edge (inclusive)
 * @param top top edge (inclusive)
 * @param right right edge (exclusive)
 * @param bottom bottom edge (exclusive)
 * @since 1.0
 */
public record Region(int left, int top, int right, int bottom) {

  /** Smallest width and height accepted for a monitored region. */
  public static final int MIN_SIZE = 10;

  /**
   * Parses the wire form {@code [left, top, right, bottom]}.
   *
   * @param coordinates four coordinates
   * @return validated region
   * @throws InvalidRegionException if the array is malformed or the region is invalid
   */
  public static Region of(int[] coordinates) throws InvalidRegionException {
    if (coordinates == null || coordinates.length != 4) {
      throw new InvalidRegionException(null, "Region must have exactly four coordinates [left, top, right, bottom].");
    }
    Region region = new Region(coordinates[0], coordinates[1], coordinates[2], coordinates[3]);
    region.validate();
    return region;
  }

  /**
   * Creates a region from an AWT rectangle.
   *
   * @param rectangle rectangle
   * @return region
   */
  public static Region fromRectangle(Rectangle rectangle) {
    return new Region(rectangle.x, rectangle.y, rectangle.x + rectangle.width, rectangle.y + rectangle.height);
  }

  public int width() {
    return right - left;
  }

  public int height() {
    return bottom - top;
  }

  public long area() {
    return (long) width() * height();
  }

  /**
   * Checks the monitoring-area invariants.
   *
   * @return this region
   * @throws InvalidRegionException if an invariant is violated
   */
  public Region validate() throws InvalidRegionException {
    if (left < 0 || top < 0) {
      throw new InvalidRegionException(this, "Region coordinates must not be negative: " + this);
    }
    if (right <= left) {
      throw new InvalidRegionException(this, "Region right (" + right + ") must be greater than left (" + left + ").");
    }
    if (bottom <= top) {
      throw new InvalidRegionException(this, "Region bottom (" + bottom + ") must be greater than top (" + top + ").");
    }
    if (width() < MIN_SIZE || height() < MIN_SIZE) {
      throw new InvalidRegionException(this,
          "Region must be at least " + MIN_SIZE + "x" + MIN_SIZE + " pixels, was " + width() + "x" + height() + ".");
    }
    return this;
  }

  /**
   * Returns true if {@code other} lies entirely inside this region.
   *
   * @param other region to test
   * @return true if contained
   */
  public boolean contains(Region other) {
    return other.left >= left && other.top >= top && other.right <= right && other.bottom <= bottom;
  }

  /**
   * Returns the overlap of this region and {@code other}, or null if they do not overlap.
   *
   * @param other other region
   * @return intersection or null
   */
  public Region intersect(Region other) {
    int l = Math.max(left, other.left);
    int t = Math.max(top, other.top);
    int r = Math.min(right, other.right);
    int b = Math.min(bottom, other.bottom);
    if (r <= l || b <= t) {
      return null;
    }
    return new Region(l, t, r, b);
  }

  /**
   * Translates this region into the coordinate space of {@code origin}.
   *
   * @param origin region whose top-left corner becomes (0, 0)
   * @return translated region
   */
  public Region relativeTo(Region origin) {
    return new Region(left - origin.left, top - origin.top, right - origin.left, bottom - origin.top);
  }

  public Rectangle toRectangle() {
    return new Rectangle(left, top, width(), height());
  }

  @Override
  public String toString() {
    return "[" + left + "," + top + "," + right + "," + bottom + "]";
  }
}
