package com.consullo.roimonitor.detection;

import com.consullo.roimonitor.core.Frame;
import com.consullo.roimonitor.core.FrameFixtures;
import java.awt.Color;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for strategy hot-swapping and baseline handling.
 *
 * @since 1.0
 */
public class DetectionContextTest {

  private final ChangeDetectionStrategyFactory factory = ChangeDetectionStrategyFactory.defaults();

  @Test
  @DisplayName("Switching strategy without reset keeps the same baseline reference")
  void setStrategy_NoReset_KeepsBaseline() {
    final DetectionContext context = new DetectionContext(factory, DetectionStrategyType.HASH, 0.0);
    final Frame baseline = FrameFixtures.solid(20, 20, Color.BLACK);
    context.resetBaseline(baseline);

    final DetectionStrategyType previous = context.setStrategy(DetectionStrategyType.PIXEL, false);

    assertThat(previous).isEqualTo(DetectionStrategyType.HASH);
    assertThat(context.strategyType()).isEqualTo(DetectionStrategyType.PIXEL);
    assertThat(context.baseline()).containsSame(baseline);
  }

  @Test
  @DisplayName("Switching strategy with reset clears the baseline and bumps the version")
  void setStrategy_Reset_ClearsBaseline() {
    final DetectionContext context = new DetectionContext(factory, DetectionStrategyType.SIZE, 5.0);
    context.resetBaseline(FrameFixtures.solid(20, 20, Color.BLACK));
    final long version = context.version();

    context.setStrategy(DetectionStrategyType.HASH, true);

    assertThat(context.hasBaseline()).isFalse();
    assertThat(context.version()).isGreaterThan(version);
    assertThatThrownBy(() -> context.compare(FrameFixtures.solid(20, 20, Color.BLACK)))
            .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Compare uses the active strategy and threshold")
  void compare_UsesActiveStrategy() {
    final DetectionContext context = new DetectionContext(factory, DetectionStrategyType.PIXEL, 50.0);
    context.resetBaseline(FrameFixtures.solid(40, 40, Color.BLACK));

    final DetectionVerdict verdict = context.compare(FrameFixtures.solid(40, 40, Color.WHITE));

    assertThat(verdict.strategy()).isEqualTo(DetectionStrategyType.PIXEL);
    assertThat(verdict.changed()).isTrue();

    context.setThreshold(100.0);
    assertThat(context.compare(FrameFixtures.solid(40, 40, Color.WHITE)).changed()).isFalse();
  }

  @Test
  @DisplayName("Snapshots are unaffected by later mutations")
  void snapshot_IsImmutable() {
    final DetectionContext context = new DetectionContext(factory, DetectionStrategyType.HASH, 0.0);
    final Frame baseline = FrameFixtures.solid(20, 20, Color.RED);
    context.resetBaseline(baseline);

    final DetectionContext.Snapshot snapshot = context.snapshot();
    context.resetBaseline(null);

    assertThat(snapshot.baseline()).isSameAs(baseline);
    assertThat(snapshot.version()).isLessThan(context.version());
  }

  @Test
  @DisplayName("Thresholds outside 0..100 are rejected")
  void validateThreshold_OutOfRange_Throws() {
    assertThatThrownBy(() -> DetectionContext.validateThreshold(-0.1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> DetectionContext.validateThreshold(100.1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> DetectionContext.validateThreshold(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
  }
}
