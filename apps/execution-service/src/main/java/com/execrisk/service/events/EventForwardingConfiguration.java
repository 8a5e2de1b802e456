package com.execrisk.service.events;

import com.execrisk.engine.monitor.AlertFeed;
import com.execrisk.engine.scheduler.ExecutionScheduler;
import com.execrisk.infra.kafka.producer.ExecutionEventProducer;
import com.execrisk.infra.kafka.producer.RiskEventProducer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Sends alerts and terminal parent statuses to Kafka, or to the log when Kafka is off. */
@Configuration
public class EventForwardingConfiguration {
  private static final String PREFIX = "execrisk.events.kafka";

  @Bean
  @ConditionalOnProperty(prefix = PREFIX, name = "enabled", havingValue = "true")
  KafkaAlertForwarder kafkaAlertForwarder(AlertFeed alertFeed, RiskEventProducer producer) {
    KafkaAlertForwarder forwarder = new KafkaAlertForwarder(producer);
    alertFeed.subscribe(forwarder);
    return forwarder;
  }

  @Bean
  @ConditionalOnProperty(prefix = PREFIX, name = "enabled", havingValue = "true")
  KafkaExecutionStatusForwarder kafkaExecutionStatusForwarder(
      ExecutionScheduler scheduler, ExecutionEventProducer producer) {
    KafkaExecutionStatusForwarder forwarder = new KafkaExecutionStatusForwarder(producer);
    scheduler.addListener(forwarder);
    return forwarder;
  }

  @Bean
  @ConditionalOnProperty(
      prefix = PREFIX,
      name = "enabled",
      havingValue = "false",
      matchIfMissing = true)
  LoggingAlertForwarder loggingAlertForwarder(AlertFeed alertFeed) {
    LoggingAlertForwarder forwarder = new LoggingAlertForwarder();
    alertFeed.subscribe(forwarder);
    return forwarder;
  }

  @Bean
  @ConditionalOnProperty(
      prefix = PREFIX,
      name = "enabled",
      havingValue = "false",
      matchIfMissing = true)
  LoggingExecutionStatusForwarder loggingExecutionStatusForwarder(ExecutionScheduler scheduler) {
    LoggingExecutionStatusForwarder forwarder = new LoggingExecutionStatusForwarder();
    scheduler.addListener(forwarder);
    return forwarder;
  }
}
