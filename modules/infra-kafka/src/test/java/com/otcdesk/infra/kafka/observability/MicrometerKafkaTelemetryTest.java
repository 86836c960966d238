package com.otcdesk.infra.kafka.observability;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.otcdesk.infra.kafka.producer.KafkaPublishException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class MicrometerKafkaTelemetryTest {
  @Test
  void shouldTagPublishOutcomes() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MicrometerKafkaTelemetry telemetry = new MicrometerKafkaTelemetry(registry);

    telemetry.onPublishSuccess("offers.paid.v1", "base:42", "OfferPaid", 4_000_000L);
    telemetry.onPublishFailure(
        "offers.paid.v1", "base:42", "OfferPaid", new IllegalStateException("broker down"));

    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.publish.total")
            .tag("event_type", "OfferPaid")
            .tag("outcome", "success")
            .counter()
            .count());
    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.publish.total")
            .tag("outcome", "failure")
            .tag("error", "IllegalStateException")
            .counter()
            .count());
    assertEquals(
        4.0d,
        registry
            .get("infra.kafka.publish.duration")
            .tag("topic", "offers.paid.v1")
            .timer()
            .totalTime(TimeUnit.MILLISECONDS));
  }

  @Test
  void shouldTagBlankEventTypeAsUnknown() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();

    new MicrometerKafkaTelemetry(registry).onPublishSuccess("offers.paid.v1", "k", " ", -5L);

    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.publish.total")
            .tag("event_type", "unknown")
            .counter()
            .count());
  }

  @Test
  void shouldTagUnderlyingCauseOfWrappedFailure() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    KafkaPublishException wrapped =
        new KafkaPublishException(
            "offers.paid.v1",
            "base:42",
            "OfferPaid",
            "Timed out publishing",
            new CompletionException(new TimeoutException("no ack")));

    new MicrometerKafkaTelemetry(registry)
        .onPublishFailure("offers.paid.v1", "base:42", "OfferPaid", wrapped);

    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.publish.total")
            .tag("error", "TimeoutException")
            .counter()
            .count());
  }
}
