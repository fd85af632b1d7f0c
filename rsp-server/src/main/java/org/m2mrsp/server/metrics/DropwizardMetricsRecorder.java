package org.m2mrsp.server.metrics;

import com.codahale.metrics.MetricRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Records durations as Dropwizard Metrics timers named {@code rsp.<operation>}.
 */
@Singleton
public class DropwizardMetricsRecorder implements MetricsRecorder {

  public static final String PREFIX = "rsp";

  private final MetricRegistry registry;

  @Inject
  public DropwizardMetricsRecorder(MetricRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void recordDuration(String operationName, Duration duration) {
    registry.timer(MetricRegistry.name(PREFIX, operationName))
        .update(duration.toNanos(), TimeUnit.NANOSECONDS);
  }
}
