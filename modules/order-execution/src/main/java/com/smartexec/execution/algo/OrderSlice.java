package com.smartexec.execution.algo;

import java.time.Instant;
import java.util.Objects;

/**
 * A child execution unit of an algorithmic parent. {@code quantity} is the planned size;
 * {@code targetQuantity} adds the remainder carried from earlier slices and is fixed when the
 * slice is dispatched.
 */
public record OrderSlice(
    String sliceId,
    String parentOrderId,
    int sequence,
    long quantity,
    long targetQuantity,
    long filledQuantity,
    Instant scheduledTime,
    SliceStatus status) {
  public OrderSlice {
    Objects.requireNonNull(sliceId, "sliceId must not be null");
    Objects.requireNonNull(parentOrderId, "parentOrderId must not be null");
    Objects.requireNonNull(scheduledTime, "scheduledTime must not be null");
    Objects.requireNonNull(status, "status must not be null");
    if (quantity < 0 || targetQuantity < 0 || filledQuantity < 0) {
      throw new IllegalArgumentException("slice quantities must be >= 0");
    }
  }

  public static OrderSlice planned(
      String parentOrderId, int sequence, long quantity, Instant scheduledTime) {
    return new OrderSlice(
        parentOrderId + "-S" + sequence,
        parentOrderId,
        sequence,
        quantity,
        quantity,
        0L,
        scheduledTime,
        SliceStatus.PENDING);
  }

  public OrderSlice activate(long target) {
    requireStatus(SliceStatus.PENDING);
    return new OrderSlice(
        sliceId, parentOrderId, sequence, quantity, target, 0L, scheduledTime, SliceStatus.ACTIVE);
  }

  /** FILLED when the target was reached, otherwise CANCELED with the shortfall left over. */
  public OrderSlice complete(long filled) {
    requireStatus(SliceStatus.ACTIVE);
    SliceStatus next = filled >= targetQuantity ? SliceStatus.FILLED : SliceStatus.CANCELED;
    return new OrderSlice(
        sliceId, parentOrderId, sequence, quantity, targetQuantity, filled, scheduledTime, next);
  }

  public OrderSlice cancel() {
    if (status.isTerminal()) {
      return this;
    }
    return new OrderSlice(
        sliceId,
        parentOrderId,
        sequence,
        quantity,
        targetQuantity,
        filledQuantity,
        scheduledTime,
        SliceStatus.CANCELED);
  }

  public long shortfall() {
    return Math.max(0L, targetQuantity - filledQuantity);
  }

  public boolean isDue(Instant now) {
    return status == SliceStatus.PENDING && !scheduledTime.isAfter(now);
  }

  private void requireStatus(SliceStatus expected) {
    if (status != expected) {
      throw new IllegalStateException(
          "Slice " + sliceId + " is " + status + ", expected " + expected);
    }
  }
}
