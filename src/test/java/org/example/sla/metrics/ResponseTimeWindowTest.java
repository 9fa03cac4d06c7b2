package org.example.sla.metrics;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResponseTimeWindowTest {

  @Test
  void shouldKeepSamplesInArrivalOrderBeforeFull() {
    ResponseTimeWindow window = new ResponseTimeWindow(4);
    window.add(0.1);
    window.add(0.2);

    assertEquals(2, window.size());
    assertArrayEquals(new double[] {0.1, 0.2}, window.toArray());
  }

  @Test
  @DisplayName("Should evict the oldest sample once capacity is reached")
  void shouldEvictOldestFirst() {
    ResponseTimeWindow window = new ResponseTimeWindow(3);
    for (int i = 1; i <= 5; i++) {
      window.add(i);
    }

    assertEquals(3, window.size());
    assertArrayEquals(new double[] {3, 4, 5}, window.toArray());
  }

  @Test
  @DisplayName("Should retain only the last 1000 samples by default")
  void shouldBoundDefaultWindow() {
    ResponseTimeWindow window = new ResponseTimeWindow();
    for (int i = 0; i < 1_500; i++) {
      window.add(i);
    }

    double[] samples = window.toArray();
    assertEquals(1_000, samples.length);
    assertEquals(500, samples[0]);
    assertEquals(1_499, samples[999]);
  }

  @Test
  void shouldReturnIndependentCopies() {
    ResponseTimeWindow window = new ResponseTimeWindow(2);
    window.add(1.0);

    double[] copy = window.toArray();
    copy[0] = 42.0;

    assertEquals(1.0, window.toArray()[0]);
  }

  @Test
  void shouldRejectNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new ResponseTimeWindow(0));
  }
}
