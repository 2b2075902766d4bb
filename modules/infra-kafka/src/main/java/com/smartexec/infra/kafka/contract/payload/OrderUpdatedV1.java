package com.smartexec.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

/** One committed order transition. {@code previousStatus} is absent for a newly created order. */
public record OrderUpdatedV1(
    String orderId,
    String clientOrderId,
    String parentOrderId,
    String account,
    String symbol,
    String side,
    String orderType,
    String previousStatus,
    String status,
    String reason,
    long quantity,
    long filledQuantity,
    long remainingQuantity,
    BigDecimal limitPrice,
    BigDecimal averagePrice,
    String algorithmType,
    Instant updatedAt) {}
