package org.example.sla.metrics;

/**
 * Fixed-capacity ring buffer of response time samples in seconds. Once full, each new sample
 * overwrites the oldest one.
 *
 * <p>Not thread-safe; {@link TierMetrics} guards every access with its lock.
 */
public final class ResponseTimeWindow {

  public static final int DEFAULT_CAPACITY = 1000;

  private final double[] samples;
  private int size;
  private int next;

  public ResponseTimeWindow() {
    this(DEFAULT_CAPACITY);
  }

  public ResponseTimeWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
    }
    this.samples = new double[capacity];
  }

  public void add(double seconds) {
    samples[next] = seconds;
    next = (next + 1) % samples.length;
    if (size < samples.length) {
      size++;
    }
  }

  public int size() {
    return size;
  }

  public int capacity() {
    return samples.length;
  }

  /** Copies the buffered samples, oldest first. */
  public double[] toArray() {
    double[] copy = new double[size];
    int oldest = size < samples.length ? 0 : next;
    int head = Math.min(size, samples.length - oldest);
    System.arraycopy(samples, oldest, copy, 0, head);
    System.arraycopy(samples, 0, copy, head, size - head);
    return copy;
  }
}
