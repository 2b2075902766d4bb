package com.smartexec.infra.kafka.topics;

import java.util.List;

public final class TopicNames {
  public static final String ORDERS_UPDATED_V1 = "execution.orders.updated.v1";
  public static final String EXECUTIONS_RECORDED_V1 = "execution.fills.recorded.v1";

  private TopicNames() {}

  public static List<String> all() {
    return List.of(ORDERS_UPDATED_V1, EXECUTIONS_RECORDED_V1);
  }
}
