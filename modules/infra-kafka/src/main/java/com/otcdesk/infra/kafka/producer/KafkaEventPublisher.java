package com.otcdesk.infra.kafka.producer;

import com.otcdesk.infra.kafka.contract.EventEnvelope;
import com.otcdesk.infra.kafka.contract.EventHeaders;
import com.otcdesk.infra.kafka.observability.KafkaTelemetry;
import com.otcdesk.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.otcdesk.infra.kafka.topics.TopicNameValidator;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

public class KafkaEventPublisher implements EventPublisher {
  private final KafkaTemplate<String, String> kafkaTemplate;
  private final EventEnvelopeJsonCodec codec;
  private final KafkaTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaEventPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      EventEnvelopeJsonCodec codec,
      KafkaTelemetry telemetry,
      Duration sendTimeout) {
    this.kafkaTemplate = kafkaTemplate;
    this.codec = codec;
    this.telemetry = telemetry;
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public <T> CompletableFuture<SendResult<String, String>> publish(
      String topic, String key, EventEnvelope<T> envelope) {
    TopicNameValidator.assertValid(topic);
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Kafka key must not be blank");
    }

    long started = System.nanoTime();
    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, key, codec.encode(envelope));
    addHeaders(record, envelope);

    CompletableFuture<SendResult<String, String>> sendFuture = kafkaTemplate.send(record);
    if (!sendTimeout.isZero() && !sendTimeout.isNegative()) {
      sendFuture = sendFuture.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    CompletableFuture<SendResult<String, String>> result = new CompletableFuture<>();
    sendFuture.whenComplete(
        (sendResult, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(
                topic, key, envelope.eventType(), System.nanoTime() - started);
            result.complete(sendResult);
            return;
          }
          KafkaPublishException publishException =
              wrapPublishException(topic, key, envelope.eventType(), throwable);
          telemetry.onPublishFailure(topic, key, envelope.eventType(), publishException);
          result.completeExceptionally(publishException);
        });
    return result;
  }

  private KafkaPublishException wrapPublishException(
      String topic, String key, String eventType, Throwable throwable) {
    Throwable cause = throwable;
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      cause = completionException.getCause();
    }
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }
    String verb = cause instanceof TimeoutException ? "Timed out publishing" : "Failed to publish";
    return new KafkaPublishException(
        topic,
        key,
        eventType,
        verb + " event to Kafka topic=" + topic + " key=" + key + " eventType=" + eventType,
        cause);
  }

  private static void addHeaders(ProducerRecord<String, String> record, EventEnvelope<?> envelope) {
    addHeader(record, EventHeaders.X_EVENT_ID, envelope.eventId().toString());
    addHeader(record, EventHeaders.X_EVENT_TYPE, envelope.eventType());
    addHeader(record, EventHeaders.X_EVENT_VERSION, Integer.toString(envelope.eventVersion()));
    addHeader(record, EventHeaders.X_CORRELATION_ID, envelope.correlationId());
    addHeader(record, EventHeaders.CONTENT_TYPE, EventHeaders.APPLICATION_JSON);
  }

  private static void addHeader(ProducerRecord<String, String> record, String name, String value) {
    record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
  }
}
