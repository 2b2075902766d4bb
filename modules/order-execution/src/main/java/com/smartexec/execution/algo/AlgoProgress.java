package com.smartexec.execution.algo;

import com.smartexec.domain.orders.AlgorithmType;
import com.smartexec.domain.orders.BenchmarkType;
import com.smartexec.domain.orders.OrderStatus;
import java.math.BigDecimal;

/**
 * Point-in-time view of an algorithmic order.
 *
 * @param progress filled share of the parent quantity
 * @param expectedProgress elapsed share of the execution window
 * @param slippageBps cost against the benchmark in basis points, positive when worse; null
 *     until something is filled or when no benchmark price is known
 */
public record AlgoProgress(
    String orderId,
    AlgorithmType algorithmType,
    OrderStatus orderStatus,
    AlgoState state,
    long quantity,
    long filledQuantity,
    BigDecimal progress,
    BigDecimal expectedProgress,
    BigDecimal averagePrice,
    BenchmarkType benchmark,
    BigDecimal benchmarkPrice,
    BigDecimal slippageBps,
    boolean onSchedule,
    int slicesCompleted,
    int slicesTotal) {}
