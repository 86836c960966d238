package com.otcdesk.infra.kafka.producer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.otcdesk.infra.kafka.contract.EventEnvelope;
import com.otcdesk.infra.kafka.contract.EventHeaders;
import com.otcdesk.infra.kafka.contract.EventTypes;
import com.otcdesk.infra.kafka.contract.payload.OfferLifecycleV1;
import com.otcdesk.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.otcdesk.infra.kafka.observability.NoOpKafkaTelemetry;
import com.otcdesk.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.otcdesk.infra.kafka.serde.EventObjectMapperFactory;
import com.otcdesk.infra.kafka.topics.TopicNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaEventPublisherTest {
  private final EventEnvelopeJsonCodec codec =
      new EventEnvelopeJsonCodec(EventObjectMapperFactory.create());

  @Test
  void shouldPublishWithRequiredHeadersAndKey() throws Exception {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(kafkaTemplate, codec, new NoOpKafkaTelemetry(), Duration.ZERO);

    ProducerRecord<String, String> mockedResultRecord =
        new ProducerRecord<>(TopicNames.OFFERS_PAID_V1, "base:42", "{}");
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(CompletableFuture.completedFuture(new SendResult<>(mockedResultRecord, null)));

    EventEnvelope<OfferLifecycleV1> envelope = paidEnvelope();
    publisher.publish(TopicNames.OFFERS_PAID_V1, "base:42", envelope).get();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<ProducerRecord<String, String>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(kafkaTemplate).send(captor.capture());
    ProducerRecord<String, String> actualRecord = captor.getValue();

    assertEquals(TopicNames.OFFERS_PAID_V1, actualRecord.topic());
    assertEquals("base:42", actualRecord.key());
    assertNotNull(actualRecord.value());
    assertEquals(envelope.eventId().toString(), headerValue(actualRecord, EventHeaders.X_EVENT_ID));
    assertEquals(EventTypes.OFFER_PAID, headerValue(actualRecord, EventHeaders.X_EVENT_TYPE));
    assertEquals("1", headerValue(actualRecord, EventHeaders.X_EVENT_VERSION));
    assertEquals("base:42", headerValue(actualRecord, EventHeaders.X_CORRELATION_ID));
    assertEquals(
        EventHeaders.APPLICATION_JSON, headerValue(actualRecord, EventHeaders.CONTENT_TYPE));
  }

  @Test
  void shouldWrapPublishFailureAndCountIt() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(
            kafkaTemplate, codec, new MicrometerKafkaTelemetry(registry), Duration.ZERO);

    CompletableFuture<SendResult<String, String>> failedFuture = new CompletableFuture<>();
    failedFuture.completeExceptionally(new IllegalStateException("broker unavailable"));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(failedFuture);

    ExecutionException ex =
        assertThrows(
            ExecutionException.class,
            () -> publisher.publish(TopicNames.OFFERS_PAID_V1, "base:42", paidEnvelope()).get());

    assertEquals(KafkaPublishException.class, ex.getCause().getClass());
    assertEquals(
        1.0d,
        registry
            .get("infra.kafka.publish.total")
            .tag("outcome", "failure")
            .tag("error", "IllegalStateException")
            .counter()
            .count());
  }

  @Test
  void shouldRejectInvalidTopicBeforeSending() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(kafkaTemplate, codec, new NoOpKafkaTelemetry(), Duration.ZERO);

    assertThrows(
        IllegalArgumentException.class,
        () -> publisher.publish("offers_paid", "base:42", paidEnvelope()));
    verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
  }

  private static EventEnvelope<OfferLifecycleV1> paidEnvelope() {
    return EventEnvelope.of(
        EventTypes.OFFER_PAID,
        1,
        "desk-api",
        "base:42",
        "base:42",
        new OfferLifecycleV1(
            "base",
            "42",
            "7",
            "PAID",
            "STABLE",
            "1250000000",
            "0xabc",
            null,
            Instant.parse("2026-03-01T12:00:00Z")));
  }

  private static String headerValue(ProducerRecord<String, String> record, String headerName) {
    Header header = record.headers().lastHeader(headerName);
    assertNotNull(header, "Expected header " + headerName + " to exist");
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}
