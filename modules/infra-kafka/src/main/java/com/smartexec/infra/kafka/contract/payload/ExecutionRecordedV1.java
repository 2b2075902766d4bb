package com.smartexec.infra.kafka.contract.payload;

import java.math.BigDecimal;
import java.time.Instant;

public record ExecutionRecordedV1(
    String executionId,
    String orderId,
    String sliceId,
    String account,
    String symbol,
    String side,
    String venue,
    long quantity,
    BigDecimal price,
    long orderFilledQuantity,
    BigDecimal orderAveragePrice,
    String orderStatus,
    Instant executedAt) {}
