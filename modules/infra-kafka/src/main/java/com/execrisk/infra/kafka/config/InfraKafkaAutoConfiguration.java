package com.execrisk.infra.kafka.config;

import com.execrisk.infra.kafka.observability.KafkaTelemetry;
import com.execrisk.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.execrisk.infra.kafka.observability.NoOpKafkaTelemetry;
import com.execrisk.infra.kafka.producer.EventPublisher;
import com.execrisk.infra.kafka.producer.ExecutionEventProducer;
import com.execrisk.infra.kafka.producer.KafkaEventPublisher;
import com.execrisk.infra.kafka.producer.RiskEventProducer;
import com.execrisk.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.execrisk.infra.kafka.serde.EventObjectMapperFactory;
import com.execrisk.infra.kafka.topics.KafkaTopicDefinitions;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Qualifier;
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
@ConditionalOnProperty(
    prefix = "infra.kafka",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties(InfraKafkaProperties.class)
public class InfraKafkaAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "kafkaEventObjectMapper")
  public ObjectMapper kafkaEventObjectMapper() {
    return EventObjectMapperFactory.create();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventEnvelopeJsonCodec eventEnvelopeJsonCodec(
      @Qualifier("kafkaEventObjectMapper") ObjectMapper kafkaEventObjectMapper) {
    return new EventEnvelopeJsonCodec(kafkaEventObjectMapper);
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
  @ConditionalOnMissingBean(name = "eventProducerFactory")
  public ProducerFactory<String, String> eventProducerFactory(InfraKafkaProperties properties) {
    return new DefaultKafkaProducerFactory<>(properties.producerClientConfig());
  }

  @Bean
  @ConditionalOnMissingBean(name = "eventKafkaTemplate")
  public KafkaTemplate<String, String> eventKafkaTemplate(
      ProducerFactory<String, String> eventProducerFactory) {
    return new KafkaTemplate<>(eventProducerFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public EventPublisher eventPublisher(
      KafkaTemplate<String, String> eventKafkaTemplate,
      EventEnvelopeJsonCodec eventEnvelopeJsonCodec,
      KafkaTelemetry kafkaTelemetry,
      InfraKafkaProperties properties) {
    return new KafkaEventPublisher(
        eventKafkaTemplate, eventEnvelopeJsonCodec, kafkaTelemetry, properties.sendTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public RiskEventProducer riskEventProducer(
      EventPublisher eventPublisher, InfraKafkaProperties properties) {
    return new RiskEventProducer(eventPublisher, properties.producerName());
  }

  @Bean
  @ConditionalOnMissingBean
  public ExecutionEventProducer executionEventProducer(
      EventPublisher eventPublisher, InfraKafkaProperties properties) {
    return new ExecutionEventProducer(eventPublisher, properties.producerName());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "infra.kafka.topics",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(name = "eventTopics")
  public KafkaAdmin.NewTopics eventTopics(InfraKafkaProperties properties) {
    int partitions = Math.max(1, properties.getTopics().getPartitions());
    short replicationFactor = (short) Math.max(1, properties.getTopics().getReplicationFactor());
    return new KafkaAdmin.NewTopics(
        KafkaTopicDefinitions.newTopics(partitions, replicationFactor).toArray(new NewTopic[0]));
  }
}
