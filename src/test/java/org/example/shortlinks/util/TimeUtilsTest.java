package org.example.shortlinks.util;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class TimeUtilsTest {

  private static final Instant NOW = Instant.parse("2025-05-31T00:00:00Z");

  @Test
  void cutoffIsNowMinusDays() {
    assertEquals(Instant.parse("2025-05-01T00:00:00Z"), TimeUtils.cutoff(NOW, 30));
    assertEquals(NOW, TimeUtils.cutoff(NOW, 0));
    assertThrows(IllegalArgumentException.class, () -> TimeUtils.cutoff(NOW, -1));
  }

  @Test
  void unusedOnlyWhenStrictlyBeforeCutoff() {
    Instant cutoff = TimeUtils.cutoff(NOW, 30);
    assertTrue(TimeUtils.isUnusedSince(cutoff.minusMillis(1), cutoff));
    assertFalse(TimeUtils.isUnusedSince(cutoff, cutoff));
    assertTrue(TimeUtils.isUnusedSince(null, cutoff));
  }

  @Test
  void latestPicksLaterAndToleratesNull() {
    Instant later = NOW.plusSeconds(1);
    assertEquals(later, TimeUtils.latest(NOW, later));
    assertEquals(later, TimeUtils.latest(later, NOW));
    assertEquals(NOW, TimeUtils.latest(null, NOW));
  }
}
