package com.smartexec.infra.kafka.topics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.apache.kafka.clients.admin.NewTopic;
import org.junit.jupiter.api.Test;

class KafkaTopicDefinitionsTest {
  private static final String TOPIC = TopicNames.ORDERS_UPDATED_V1;

  @Test
  void shouldDefineEveryKnownTopic() {
    List<KafkaTopicDefinitions.TopicDefinition> definitions =
        KafkaTopicDefinitions.forAll(6, (short) 3);

    assertEquals(
        TopicNames.all(),
        definitions.stream().map(KafkaTopicDefinitions.TopicDefinition::name).toList());
    NewTopic topic = definitions.get(0).toNewTopic();
    assertEquals(6, topic.numPartitions());
    assertEquals(3, topic.replicationFactor());
  }

  @Test
  void shouldRejectInvalidProvisioningValues() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new KafkaTopicDefinitions.TopicDefinition(TOPIC, 0, (short) 1));
    assertThrows(
        IllegalArgumentException.class,
        () -> new KafkaTopicDefinitions.TopicDefinition(TOPIC, 3, (short) 0));
    assertThrows(
        IllegalArgumentException.class,
        () -> new KafkaTopicDefinitions.TopicDefinition("orders", 3, (short) 1));
  }
}
