package com.hedgeplatform.worker.feed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class FeedSettingsTest {
  @Test
  void shouldDoubleResubscribeDelayUpToCap() {
    FeedSettings settings =
        new FeedSettings(Duration.ofSeconds(3), Duration.ofSeconds(30), Duration.ofMillis(500), Duration.ofSeconds(3));

    assertEquals(Duration.ofMillis(500), settings.resubscribeDelay(1));
    assertEquals(Duration.ofMillis(1000), settings.resubscribeDelay(2));
    assertEquals(Duration.ofMillis(2000), settings.resubscribeDelay(3));
    assertEquals(Duration.ofSeconds(3), settings.resubscribeDelay(4));
    assertEquals(Duration.ofSeconds(3), settings.resubscribeDelay(60));
  }

  @Test
  void shouldRejectMaxBackoffBelowBase() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new FeedSettings(
                Duration.ofSeconds(3), Duration.ofSeconds(30), Duration.ofSeconds(2), Duration.ofSeconds(1)));
  }
}
