package com.smartexec.domain.orders;

import java.math.BigDecimal;
import java.time.Instant;

public record OrderRequest(
    String clientOrderId,
    String parentOrderId,
    String account,
    String symbol,
    String securityId,
    OrderSide side,
    OrderType orderType,
    long quantity,
    BigDecimal price,
    BigDecimal limitPrice,
    BigDecimal stopPrice,
    TimeInForce timeInForce,
    Instant expireAt,
    AlgorithmType algorithmType,
    AlgorithmParams algorithmParams) {

  public static OrderRequest limit(
      String clientOrderId, String symbol, OrderSide side, long quantity, BigDecimal price) {
    return new OrderRequest(
        clientOrderId,
        null,
        null,
        symbol,
        symbol,
        side,
        OrderType.LIMIT,
        quantity,
        price,
        null,
        null,
        TimeInForce.DAY,
        null,
        null,
        null);
  }

  public static OrderRequest market(
      String clientOrderId, String symbol, OrderSide side, long quantity) {
    return new OrderRequest(
        clientOrderId,
        null,
        null,
        symbol,
        symbol,
        side,
        OrderType.MARKET,
        quantity,
        null,
        null,
        null,
        TimeInForce.DAY,
        null,
        null,
        null);
  }

  public OrderRequest withAccount(String nextAccount) {
    return new OrderRequest(
        clientOrderId,
        parentOrderId,
        nextAccount,
        symbol,
        securityId,
        side,
        orderType,
        quantity,
        price,
        limitPrice,
        stopPrice,
        timeInForce,
        expireAt,
        algorithmType,
        algorithmParams);
  }

  public OrderRequest withTimeInForce(TimeInForce nextTimeInForce, Instant nextExpireAt) {
    return new OrderRequest(
        clientOrderId,
        parentOrderId,
        account,
        symbol,
        securityId,
        side,
        orderType,
        quantity,
        price,
        limitPrice,
        stopPrice,
        nextTimeInForce,
        nextExpireAt,
        algorithmType,
        algorithmParams);
  }

  public OrderRequest withStopPrice(BigDecimal nextStopPrice) {
    return new OrderRequest(
        clientOrderId,
        parentOrderId,
        account,
        symbol,
        securityId,
        side,
        orderType,
        quantity,
        price,
        limitPrice,
        nextStopPrice,
        timeInForce,
        expireAt,
        algorithmType,
        algorithmParams);
  }

  public OrderRequest withOrderType(OrderType nextOrderType) {
    return new OrderRequest(
        clientOrderId,
        parentOrderId,
        account,
        symbol,
        securityId,
        side,
        nextOrderType,
        quantity,
        price,
        limitPrice,
        stopPrice,
        timeInForce,
        expireAt,
        algorithmType,
        algorithmParams);
  }

  public OrderRequest withAlgorithm(AlgorithmType nextAlgorithmType, AlgorithmParams nextParams) {
    return new OrderRequest(
        clientOrderId,
        parentOrderId,
        account,
        symbol,
        securityId,
        side,
        orderType,
        quantity,
        price,
        limitPrice,
        stopPrice,
        timeInForce,
        expireAt,
        nextAlgorithmType,
        nextParams);
  }
}
