package com.smartexec.infra.kafka.contract;

public final class EventTypes {
  public static final String ORDER_UPDATED = "OrderUpdated";
  public static final String EXECUTION_RECORDED = "ExecutionRecorded";

  private EventTypes() {}
}
