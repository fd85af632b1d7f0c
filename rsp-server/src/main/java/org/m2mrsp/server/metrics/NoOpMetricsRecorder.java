package org.m2mrsp.server.metrics;

import java.time.Duration;

/**
 * Discards every timing.
 */
public class NoOpMetricsRecorder implements MetricsRecorder {

  @Override
  public void recordDuration(String operationName, Duration duration) {
    // intentionally empty
  }
}
