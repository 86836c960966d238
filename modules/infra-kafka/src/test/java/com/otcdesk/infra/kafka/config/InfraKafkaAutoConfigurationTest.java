package com.otcdesk.infra.kafka.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import com.otcdesk.infra.kafka.observability.KafkaTelemetry;
import com.otcdesk.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.otcdesk.infra.kafka.observability.NoOpKafkaTelemetry;
import com.otcdesk.infra.kafka.producer.EventPublisher;
import com.otcdesk.infra.kafka.producer.KafkaEventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.kafka.core.KafkaAdmin;

class InfraKafkaAutoConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(InfraKafkaAutoConfiguration.class);

  @Test
  void shouldRegisterTopicsAndPublisherByDefault() {
    contextRunner
        .withPropertyValues("infra.kafka.topics.partitions=6")
        .run(
            context -> {
              assertEquals(1, context.getBeansOfType(KafkaAdmin.NewTopics.class).size());
              assertInstanceOf(KafkaEventPublisher.class, context.getBean(EventPublisher.class));
              assertInstanceOf(NoOpKafkaTelemetry.class, context.getBean(KafkaTelemetry.class));
              assertEquals(
                  6, context.getBean(InfraKafkaProperties.class).getTopics().getPartitions());
            });
  }

  @Test
  void shouldRegisterNoTopicsWhenDisabled() {
    contextRunner
        .withPropertyValues("infra.kafka.topics.enabled=false")
        .run(
            context ->
                assertEquals(0, context.getBeansOfType(KafkaAdmin.NewTopics.class).size()));
  }

  @Test
  void shouldUseMicrometerTelemetryWhenRegistryPresent() {
    contextRunner
        .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
        .run(
            context ->
                assertInstanceOf(
                    MicrometerKafkaTelemetry.class, context.getBean(KafkaTelemetry.class)));
  }
}
