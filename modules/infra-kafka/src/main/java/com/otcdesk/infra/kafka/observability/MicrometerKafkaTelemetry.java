package com.otcdesk.infra.kafka.observability;

import com.otcdesk.infra.kafka.producer.KafkaPublishException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

public class MicrometerKafkaTelemetry implements KafkaTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPublishSuccess(String topic, String key, String eventType, long durationNanos) {
    Counter.builder("infra.kafka.publish.total")
        .description("Total Kafka publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", "success")
        .register(meterRegistry)
        .increment();

    Timer.builder("infra.kafka.publish.duration")
        .description("Kafka publish latency")
        .tag("topic", safeValue(topic))
        .tag("event_type", safeValue(eventType))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String topic, String key, String eventType, Throwable error) {
    Counter.builder("infra.kafka.publish.total")
        .description("Total Kafka publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    Throwable cause = error;
    while ((cause instanceof KafkaPublishException || cause instanceof CompletionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause.getClass().getSimpleName();
  }
}
