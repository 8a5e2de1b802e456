package com.execrisk.infra.kafka.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.kafka")
public class InfraKafkaProperties {
  private boolean enabled = true;
  private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
  private Producer producer = new Producer();
  private Topics topics = new Topics();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public List<String> getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(List<String> bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public Producer getProducer() {
    return producer;
  }

  public void setProducer(Producer producer) {
    this.producer = producer;
  }

  public Topics getTopics() {
    return topics;
  }

  public void setTopics(Topics topics) {
    this.topics = topics;
  }

  public String bootstrapServersAsCsv() {
    return String.join(",", bootstrapServers);
  }

  /** Client config for the string-keyed, JSON-valued event producer. */
  public Map<String, Object> producerClientConfig() {
    int maxInFlight = Math.max(1, producer.getMaxInFlightRequestsPerConnection());
    if (producer.isIdempotenceEnabled()) {
      // idempotent producers only keep ordering with at most 5 in flight
      maxInFlight = Math.min(5, maxInFlight);
    }
    Map<String, Object> config = new HashMap<>();
    config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServersAsCsv());
    config.put(ProducerConfig.CLIENT_ID_CONFIG, producer.getClientId());
    config.put(ProducerConfig.ACKS_CONFIG, producer.getAcks());
    config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, producer.isIdempotenceEnabled());
    config.put(ProducerConfig.RETRIES_CONFIG, Math.max(0, producer.getRetries()));
    config.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompressionType());
    config.put(ProducerConfig.LINGER_MS_CONFIG, producer.getLingerMs());
    config.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, producer.getDeliveryTimeoutMs());
    config.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, producer.getRequestTimeoutMs());
    config.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, maxInFlight);
    config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
    return config;
  }

  /** Event source name stamped on every envelope; falls back to the client id. */
  public String producerName() {
    String name = producer.getProducerName();
    return name == null || name.isBlank() ? producer.getClientId() : name;
  }

  public Duration sendTimeout() {
    return Duration.ofMillis(Math.max(0L, producer.getSendTimeoutMs()));
  }

  public static class Producer {
    private String clientId = "execution-risk-producer";
    private String producerName;
    private String acks = "all";
    private boolean idempotenceEnabled = true;
    private int retries = 3;
    private String compressionType = "lz4";
    private int lingerMs = 5;
    private int deliveryTimeoutMs = 120000;
    private int requestTimeoutMs = 30000;
    private int maxInFlightRequestsPerConnection = 5;
    private long sendTimeoutMs = 10000L;

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getProducerName() {
      return producerName;
    }

    public void setProducerName(String producerName) {
      this.producerName = producerName;
    }

    public String getAcks() {
      return acks;
    }

    public void setAcks(String acks) {
      this.acks = acks;
    }

    public boolean isIdempotenceEnabled() {
      return idempotenceEnabled;
    }

    public void setIdempotenceEnabled(boolean idempotenceEnabled) {
      this.idempotenceEnabled = idempotenceEnabled;
    }

    public int getRetries() {
      return retries;
    }

    public void setRetries(int retries) {
      this.retries = retries;
    }

    public String getCompressionType() {
      return compressionType;
    }

    public void setCompressionType(String compressionType) {
      this.compressionType = compressionType;
    }

    public int getLingerMs() {
      return lingerMs;
    }

    public void setLingerMs(int lingerMs) {
      this.lingerMs = lingerMs;
    }

    public int getDeliveryTimeoutMs() {
      return deliveryTimeoutMs;
    }

    public void setDeliveryTimeoutMs(int deliveryTimeoutMs) {
      this.deliveryTimeoutMs = deliveryTimeoutMs;
    }

    public int getRequestTimeoutMs() {
      return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getMaxInFlightRequestsPerConnection() {
      return maxInFlightRequestsPerConnection;
    }

    public void setMaxInFlightRequestsPerConnection(int maxInFlightRequestsPerConnection) {
      this.maxInFlightRequestsPerConnection = maxInFlightRequestsPerConnection;
    }

    public long getSendTimeoutMs() {
      return sendTimeoutMs;
    }

    public void setSendTimeoutMs(long sendTimeoutMs) {
      this.sendTimeoutMs = sendTimeoutMs;
    }
  }

  public static class Topics {
    private boolean enabled = true;
    private int partitions = 3;
    private int replicationFactor = 1;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getPartitions() {
      return partitions;
    }

    public void setPartitions(int partitions) {
      this.partitions = partitions;
    }

    public int getReplicationFactor() {
      return replicationFactor;
    }

    public void setReplicationFactor(int replicationFactor) {
      this.replicationFactor = replicationFactor;
    }
  }
}
