package com.execrisk.infra.kafka.topics;

import com.execrisk.infra.kafka.contract.EventType;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.kafka.clients.admin.NewTopic;

/** Topics to provision, one per distinct {@link EventType#topic()}. */
public final class KafkaTopicDefinitions {
  private KafkaTopicDefinitions() {}

  public static Set<String> eventTopics() {
    Set<String> names = new LinkedHashSet<>();
    for (EventType type : EventType.values()) {
      names.add(type.topic());
    }
    return names;
  }

  public static List<NewTopic> newTopics(int partitions, short replicationFactor) {
    if (partitions < 1) {
      throw new IllegalArgumentException("partitions must be >= 1");
    }
    if (replicationFactor < 1) {
      throw new IllegalArgumentException("replicationFactor must be >= 1");
    }
    List<NewTopic> topics = new ArrayList<>();
    for (String name : eventTopics()) {
      TopicNames.requireVersioned(name);
      topics.add(new NewTopic(name, partitions, replicationFactor));
    }
    return List.copyOf(topics);
  }
}
