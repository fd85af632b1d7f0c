package org.m2mrsp.server.metrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Sink for operation timings. Implementations must be thread-safe and must not throw.
 */
public interface MetricsRecorder {

  /**
   * Records how long an operation took.
   *
   * @param operationName metric name, e.g. {@code key_establishment}
   * @param duration      elapsed time
   */
  void recordDuration(String operationName, Duration duration);

  /**
   * Runs {@code action} and records its duration, whether it returns or throws.
   */
  default <T> T time(String operationName, Supplier<T> action) {
    long start = System.nanoTime();
    try {
      return action.get();
    } finally {
      recordDuration(operationName, Duration.ofNanos(System.nanoTime() - start));
    }
  }
}
