package com.execrisk.infra.kafka.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.execrisk.infra.kafka.observability.KafkaTelemetry;
import com.execrisk.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.execrisk.infra.kafka.observability.NoOpKafkaTelemetry;
import com.execrisk.infra.kafka.producer.EventPublisher;
import com.execrisk.infra.kafka.producer.ExecutionEventProducer;
import com.execrisk.infra.kafka.producer.RiskEventProducer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.kafka.core.KafkaAdmin;

class InfraKafkaAutoConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(InfraKafkaAutoConfiguration.class);

  @Test
  void shouldRegisterProducersAndTopicsByDefault() {
    contextRunner.run(
        context -> {
          assertEquals(1, context.getBeansOfType(EventPublisher.class).size());
          assertEquals(1, context.getBeansOfType(RiskEventProducer.class).size());
          assertEquals(1, context.getBeansOfType(ExecutionEventProducer.class).size());
          assertEquals(1, context.getBeansOfType(KafkaAdmin.NewTopics.class).size());
          assertEquals(
              NoOpKafkaTelemetry.class, context.getBean(KafkaTelemetry.class).getClass());
        });
  }

  @Test
  void shouldUseMicrometerTelemetryWhenMeterRegistryIsPresent() {
    contextRunner
        .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
        .run(
            context ->
                assertEquals(
                    MicrometerKafkaTelemetry.class,
                    context.getBean(KafkaTelemetry.class).getClass()));
  }

  @Test
  void shouldSkipTopicsWhenDisabled() {
    contextRunner
        .withPropertyValues("infra.kafka.topics.enabled=false")
        .run(context -> assertEquals(0, context.getBeansOfType(KafkaAdmin.NewTopics.class).size()));
  }

  @Test
  void shouldCapInFlightRequestsForIdempotentProducerAndFallBackToClientIdAsProducerName() {
    contextRunner
        .withPropertyValues(
            "infra.kafka.bootstrap-servers=broker-a:9092,broker-b:9092",
            "infra.kafka.producer.client-id=execution-service",
            "infra.kafka.producer.max-in-flight-requests-per-connection=12")
        .run(
            context -> {
              InfraKafkaProperties properties = context.getBean(InfraKafkaProperties.class);
              Map<String, Object> config = properties.producerClientConfig();
              assertEquals(
                  "broker-a:9092,broker-b:9092",
                  config.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
              assertEquals(5, config.get(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION));
              assertEquals("execution-service", properties.producerName());
            });
  }

  @Test
  void shouldBackOffEntirelyWhenKafkaIsDisabled() {
    contextRunner
        .withPropertyValues("infra.kafka.enabled=false")
        .run(
            context -> {
              assertEquals(0, context.getBeansOfType(EventPublisher.class).size());
              assertEquals(0, context.getBeansOfType(RiskEventProducer.class).size());
            });
  }
}
