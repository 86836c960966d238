package com.otcdesk.infra.kafka.config;

import com.otcdesk.infra.kafka.observability.KafkaTelemetry;
import com.otcdesk.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.otcdesk.infra.kafka.observability.NoOpKafkaTelemetry;
import com.otcdesk.infra.kafka.producer.EventPublisher;
import com.otcdesk.infra.kafka.producer.KafkaEventPublisher;
import com.otcdesk.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.otcdesk.infra.kafka.serde.EventObjectMapperFactory;
import com.otcdesk.infra.kafka.topics.KafkaTopicDefinitions;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@AutoConfiguration
@EnableConfigurationProperties(InfraKafkaProperties.class)
public class InfraKafkaAutoConfiguration {
  // The event mapper stays private to the codec: the context holds a single ObjectMapper.
  @Bean
  @ConditionalOnMissingBean
  public EventEnvelopeJsonCodec eventEnvelopeJsonCodec() {
    return new EventEnvelopeJsonCodec(EventObjectMapperFactory.create());
  }

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(KafkaTelemetry.class)
  public KafkaTelemetry micrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerKafkaTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(KafkaTelemetry.class)
  public KafkaTelemetry noOpKafkaTelemetry() {
    return new NoOpKafkaTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaProducerFactory")
  public ProducerFactory<String, String> infraKafkaProducerFactory(
      InfraKafkaProperties properties) {
    InfraKafkaProperties.Producer producer = properties.getProducer();

    Map<String, Object> config = new HashMap<>();
    config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.bootstrapServersAsCsv());
    config.put(ProducerConfig.CLIENT_ID_CONFIG, producer.getClientId());
    config.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
    config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isIdempotenceEnabled());
    config.put(ProducerConfig.RETRIES_CONFIG, Math.max(0, producer.getRetries()));
    config.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompressionType());
    config.put(ProducerConfig.LINGER_MS_CONFIG, producer.getLingerMs());
    config.put(ProducerConfig.BATCH_SIZE_CONFIG, producer.getBatchSize());
    config.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, producer.getDeliveryTimeoutMs());
    config.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, producer.getRequestTimeoutMs());
    config.put(
        ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, resolveMaxInFlightRequests(producer));
    config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    return new DefaultKafkaProducerFactory<>(config);
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaTemplate")
  public KafkaTemplate<String, String> infraKafkaTemplate(
      ProducerFactory<String, String> infraKafkaProducerFactory) {
    return new KafkaTemplate<>(infraKafkaProducerFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public EventPublisher eventPublisher(
      KafkaTemplate<String, String> infraKafkaTemplate,
      EventEnvelopeJsonCodec eventEnvelopeJsonCodec,
      KafkaTelemetry kafkaTelemetry,
      InfraKafkaProperties properties) {
    long sendTimeoutMs = Math.max(0L, properties.getProducer().getSendTimeoutMs());
    return new KafkaEventPublisher(
        infraKafkaTemplate,
        eventEnvelopeJsonCodec,
        kafkaTelemetry,
        Duration.ofMillis(sendTimeoutMs));
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "infra.kafka.topics",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(name = "infraKafkaTopics")
  public KafkaAdmin.NewTopics infraKafkaTopics(InfraKafkaProperties properties) {
    int partitions = Math.max(1, properties.getTopics().getPartitions());
    short replicationFactor = (short) Math.max(1, properties.getTopics().getReplicationFactor());
    NewTopic[] topics =
        KafkaTopicDefinitions.defaults(partitions, replicationFactor).stream()
            .map(KafkaTopicDefinitions.KafkaTopicDefinition::toNewTopic)
            .toArray(NewTopic[]::new);
    return new KafkaAdmin.NewTopics(topics);
  }

  private static int resolveMaxInFlightRequests(InfraKafkaProperties.Producer producer) {
    int configuredMax = Math.max(1, producer.getMaxInFlightRequestsPerConnection());
    if (producer.isIdempotenceEnabled()) {
      return Math.min(5, configuredMax);
    }
    return configuredMax;
  }
}
