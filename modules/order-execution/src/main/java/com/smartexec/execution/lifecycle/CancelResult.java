package com.smartexec.execution.lifecycle;

import com.smartexec.domain.orders.Order;

/**
 * Outcome of a cancel request. {@code cancelled} is false when the order was already terminal
 * or already pending cancel; the order is then returned unchanged.
 */
public record CancelResult(Order order, boolean cancelled) {}
