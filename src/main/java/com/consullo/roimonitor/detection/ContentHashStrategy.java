package com.consullo.roimonitor.detection;

import com.consullo.roimonitor.core.Frame;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import org.apache.commons.lang3.Validate;

/**
 * Compares message digests of the encoded payloads.
 *
 * <p>The verdict is binary: magnitude 100 when the digests differ, 0 otherwise. The threshold is ignored.
 * Exact, but blind to how large a change is.
 *
 * @since 1.0
 */
public final class ContentHashStrategy implements ChangeDetectionStrategy {

  public static final String DEFAULT_ALGORITHM = "SHA-256";

  private final String algorithm;

  private volatile CachedDigest baselineDigest;

  private record CachedDigest(Frame frame, byte[] digest) {
  }

  public ContentHashStrategy() {
    this(DEFAULT_ALGORITHM);
  }

  /**
   * Creates a strategy using the given digest algorithm.
   *
   * @param algorithm JCA digest name, e.g. "SHA-256" or "MD5"
   * @throws IllegalArgumentException if the algorithm is not available
   */
  public ContentHashStrategy(final String algorithm) {
    Validate.notBlank(algorithm, "algorithm must not be blank");
    try {
      MessageDigest.getInstance(algorithm);
    } catch (final NoSuchAlgorithmException e) {
      throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm, e);
    }
    this.algorithm = algorithm;
  }

  public String algorithm() {
    return algorithm;
  }

  @Override
  public DetectionStrategyType type() {
    return DetectionStrategyType.HASH;
  }

  @Override
  public DetectionVerdict compare(final Frame baseline, final Frame candidate, final double threshold) {
    Validate.notNull(baseline, "baseline must not be null");
    Validate.notNull(candidate, "candidate must not be null");

    final boolean differs = !MessageDigest.isEqual(digestOfBaseline(baseline), digest(candidate));
    return differs ? DetectionVerdict.changed(type(), 100.0) : DetectionVerdict.unchanged(type(), 0.0);
  }

  /**
   * Returns the digest of a frame payload.
   *
   * @param frame frame
   * @return digest bytes
   */
  public byte[] digest(final Frame frame) {
    try {
      final MessageDigest md = MessageDigest.getInstance(algorithm);
      md.update(frame.asReadOnlyBuffer());
      return md.digest();
    } catch (final NoSuchAlgorithmException e) {
      // Checked in the constructor.
      throw new IllegalStateException(e);
    }
  }

  private byte[] digestOfBaseline(final Frame baseline) {
    final CachedDigest cached = baselineDigest;
    if (cached != null && cached.frame() == baseline) {
      return cached.digest();
    }
    final byte[] digest = digest(baseline);
    baselineDigest = new CachedDigest(baseline, Arrays.copyOf(digest, digest.length));
    return digest;
  }
}
