package com.smartexec.infra.kafka.topics;

import java.util.List;
import org.apache.kafka.clients.admin.NewTopic;

public final class KafkaTopicDefinitions {
  private KafkaTopicDefinitions() {}

  public static List<TopicDefinition> forAll(int partitions, short replicationFactor) {
    return TopicNames.all().stream()
        .map(name -> new TopicDefinition(name, partitions, replicationFactor))
        .toList();
  }

  public record TopicDefinition(String name, int partitions, short replicationFactor) {
    public TopicDefinition {
      TopicNameValidator.requireValid(name);
      if (partitions < 1) {
        throw new IllegalArgumentException("partitions must be >= 1 for topic " + name);
      }
      if (replicationFactor < 1) {
        throw new IllegalArgumentException("replicationFactor must be >= 1 for topic " + name);
      }
    }

    public NewTopic toNewTopic() {
      return new NewTopic(name, partitions, replicationFactor);
    }
  }
}
