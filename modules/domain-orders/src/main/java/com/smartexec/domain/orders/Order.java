package com.smartexec.domain.orders;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of an order. Every mutation returns a new snapshot; the status change is
 * always looked up in {@link OrderStateMachine}.
 */
public record Order(
    String orderId,
    String clientOrderId,
    String parentOrderId,
    String account,
    String symbol,
    String securityId,
    OrderSide side,
    OrderType orderType,
    long quantity,
    long filledQuantity,
    long remainingQuantity,
    BigDecimal price,
    BigDecimal limitPrice,
    BigDecimal stopPrice,
    BigDecimal averagePrice,
    BigDecimal filledNotional,
    TimeInForce timeInForce,
    Instant expireAt,
    AlgorithmType algorithmType,
    AlgorithmParams algorithmParams,
    OrderStatus status,
    Instant createdAt,
    Instant updatedAt) {
  public static final int PRICE_SCALE = 8;

  public Order {
    requireNonBlank(orderId, "orderId");
    requireNonBlank(symbol, "symbol");
    requirePresent(side, "side");
    requirePresent(orderType, "orderType");
    Objects.requireNonNull(timeInForce, "timeInForce must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    if (quantity <= 0) {
      throw new OrderValidationException("quantity must be > 0");
    }
    if (filledQuantity < 0 || filledQuantity > quantity) {
      throw new OrderValidationException("filledQuantity must be between 0 and quantity");
    }
    if (filledQuantity + remainingQuantity != quantity) {
      throw new OrderValidationException(
          "filledQuantity + remainingQuantity must equal quantity for order " + orderId);
    }
    validatePrices(orderType, price, limitPrice, stopPrice);
    if (timeInForce == TimeInForce.GTD && expireAt == null) {
      throw new OrderValidationException("GTD order requires expireAt");
    }
    if (algorithmType != null) {
      if (algorithmParams == null) {
        throw new OrderValidationException(algorithmType + " order requires algorithmParams");
      }
      algorithmParams.validateFor(algorithmType);
    }
    filledNotional = filledNotional == null ? BigDecimal.ZERO : filledNotional;
    if (filledQuantity == 0 && filledNotional.signum() != 0) {
      throw new OrderValidationException("filledNotional must be zero when nothing is filled");
    }
    averagePrice = averageOf(filledNotional, filledQuantity);
  }

  public static Order createPending(String orderId, OrderRequest request, Instant now) {
    Objects.requireNonNull(request, "request must not be null");
    Objects.requireNonNull(now, "now must not be null");
    TimeInForce timeInForce =
        request.timeInForce() == null ? TimeInForce.DAY : request.timeInForce();
    String securityId =
        request.securityId() == null || request.securityId().isBlank()
            ? request.symbol()
            : request.securityId();
    return new Order(
        orderId,
        request.clientOrderId() == null ? orderId : request.clientOrderId(),
        request.parentOrderId(),
        request.account(),
        request.symbol(),
        securityId,
        request.side(),
        request.orderType(),
        request.quantity(),
        0,
        request.quantity(),
        request.price(),
        request.limitPrice(),
        request.stopPrice(),
        null,
        BigDecimal.ZERO,
        timeInForce,
        request.expireAt(),
        request.algorithmType(),
        request.algorithmParams(),
        OrderStatus.PENDING,
        now,
        now);
  }

  /** Limit price of a LIMIT or STOP_LIMIT order; {@code limitPrice} wins over {@code price}. */
  public BigDecimal effectiveLimitPrice() {
    return limitPrice != null ? limitPrice : price;
  }

  public boolean isAlgorithmic() {
    return algorithmType != null;
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public Order apply(OrderEvent event, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    OrderStatus next = OrderStateMachine.transition(status, event);
    return withStatus(next, now);
  }

  public Order applyFill(long fillQuantity, BigDecimal fillPrice, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    if (fillQuantity <= 0) {
      throw new OrderValidationException("fill quantity must be > 0");
    }
    if (fillPrice == null || fillPrice.signum() <= 0) {
      throw new OrderValidationException("fill price must be > 0");
    }
    if (fillQuantity > remainingQuantity) {
      throw new OrderValidationException(
          String.format(
              "Fill of %d exceeds remaining quantity %d for order %s",
              fillQuantity, remainingQuantity, orderId));
    }
    long nextFilled = filledQuantity + fillQuantity;
    OrderEvent event = nextFilled == quantity ? OrderEvent.FULL_FILL : OrderEvent.PARTIAL_FILL;
    OrderStatus next = OrderStateMachine.transition(status, event);
    BigDecimal nextNotional =
        filledNotional.add(fillPrice.multiply(BigDecimal.valueOf(fillQuantity)));
    return new Order(
        orderId,
        clientOrderId,
        parentOrderId,
        account,
        symbol,
        securityId,
        side,
        orderType,
        quantity,
        nextFilled,
        quantity - nextFilled,
        price,
        limitPrice,
        stopPrice,
        null,
        nextNotional,
        timeInForce,
        expireAt,
        algorithmType,
        algorithmParams,
        next,
        createdAt,
        now);
  }

  /**
   * Applies amended economics without changing status. Callers move the order to
   * PENDING_REPLACE first.
   */
  public Order withReplacement(OrderChanges changes, Instant now) {
    Objects.requireNonNull(changes, "changes must not be null");
    Objects.requireNonNull(now, "now must not be null");
    long nextQuantity = changes.quantity() == null ? quantity : changes.quantity();
    if (nextQuantity <= filledQuantity) {
      throw new OrderValidationException(
          String.format(
              "New quantity %d must exceed filled quantity %d for order %s",
              nextQuantity, filledQuantity, orderId));
    }
    BigDecimal nextLimitPrice = limitPrice;
    BigDecimal nextPrice = price;
    if (changes.limitPrice() != null) {
      if (!orderType.requiresLimitPrice()) {
        throw new OrderValidationException(
            "Cannot amend limit price of " + orderType + " order " + orderId);
      }
      nextLimitPrice = changes.limitPrice();
      nextPrice = changes.limitPrice();
    }
    return new Order(
        orderId,
        clientOrderId,
        parentOrderId,
        account,
        symbol,
        securityId,
        side,
        orderType,
        nextQuantity,
        filledQuantity,
        nextQuantity - filledQuantity,
        nextPrice,
        nextLimitPrice,
        stopPrice,
        null,
        filledNotional,
        timeInForce,
        expireAt,
        algorithmType,
        algorithmParams,
        status,
        createdAt,
        now);
  }

  /** Moves a REPLACED order back to a working state. */
  public Order restate(Instant now) {
    return apply(filledQuantity == 0 ? OrderEvent.RESTATE : OrderEvent.RESTATE_PARTIAL, now);
  }

  /**
   * A non-algorithmic child snapshot used to check and route one slice of this order. It is
   * never stored in the ledger; fills are applied to the parent.
   */
  public Order childSlice(String sliceOrderId, long sliceQuantity, Instant now) {
    return new Order(
        sliceOrderId,
        sliceOrderId,
        orderId,
        account,
        symbol,
        securityId,
        side,
        orderType,
        sliceQuantity,
        0,
        sliceQuantity,
        price,
        limitPrice,
        stopPrice,
        null,
        BigDecimal.ZERO,
        TimeInForce.DAY,
        null,
        null,
        null,
        OrderStatus.NEW,
        now,
        now);
  }

  private Order withStatus(OrderStatus next, Instant now) {
    return new Order(
        orderId,
        clientOrderId,
        parentOrderId,
        account,
        symbol,
        securityId,
        side,
        orderType,
        quantity,
        filledQuantity,
        remainingQuantity,
        price,
        limitPrice,
        stopPrice,
        averagePrice,
        filledNotional,
        timeInForce,
        expireAt,
        algorithmType,
        algorithmParams,
        next,
        createdAt,
        now);
  }

  private static BigDecimal averageOf(BigDecimal notional, long filled) {
    if (filled == 0) {
      return BigDecimal.ZERO;
    }
    return notional.divide(BigDecimal.valueOf(filled), PRICE_SCALE, RoundingMode.HALF_UP);
  }

  private static void validatePrices(
      OrderType type, BigDecimal price, BigDecimal limitPrice, BigDecimal stopPrice) {
    requirePositiveIfPresent(price, "price");
    requirePositiveIfPresent(limitPrice, "limitPrice");
    requirePositiveIfPresent(stopPrice, "stopPrice");
    if (type.requiresLimitPrice() && price == null && limitPrice == null) {
      throw new OrderValidationException(type + " order requires price or limitPrice");
    }
    if (type.requiresStopPrice() && stopPrice == null) {
      throw new OrderValidationException(type + " order requires stopPrice");
    }
  }

  private static void requirePositiveIfPresent(BigDecimal value, String fieldName) {
    if (value != null && value.signum() <= 0) {
      throw new OrderValidationException(fieldName + " must be > 0");
    }
  }

  private static void requirePresent(Object value, String fieldName) {
    if (value == null) {
      throw new OrderValidationException(fieldName + " must not be null");
    }
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new OrderValidationException(fieldName + " must not be blank");
    }
  }
}
