package com.smartexec.domain.orders;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class OrderStateMachineTest {
  @Test
  void shouldFollowHappyPathToFilled() {
    assertEquals(
        OrderStatus.NEW, OrderStateMachine.transition(OrderStatus.PENDING, OrderEvent.ACCEPT));
    assertEquals(
        OrderStatus.PARTIALLY_FILLED,
        OrderStateMachine.transition(OrderStatus.NEW, OrderEvent.PARTIAL_FILL));
    assertEquals(
        OrderStatus.PARTIALLY_FILLED,
        OrderStateMachine.transition(OrderStatus.PARTIALLY_FILLED, OrderEvent.PARTIAL_FILL));
    assertEquals(
        OrderStatus.FILLED,
        OrderStateMachine.transition(OrderStatus.PARTIALLY_FILLED, OrderEvent.FULL_FILL));
  }

  @Test
  void shouldRouteCancelAndReplaceThroughPendingStates() {
    assertEquals(
        OrderStatus.PENDING_CANCEL,
        OrderStateMachine.transition(OrderStatus.NEW, OrderEvent.CANCEL_REQUEST));
    assertEquals(
        OrderStatus.CANCELED,
        OrderStateMachine.transition(OrderStatus.PENDING_CANCEL, OrderEvent.CANCEL_CONFIRM));
    assertEquals(
        OrderStatus.PENDING_REPLACE,
        OrderStateMachine.transition(OrderStatus.PARTIALLY_FILLED, OrderEvent.REPLACE_REQUEST));
    assertEquals(
        OrderStatus.REPLACED,
        OrderStateMachine.transition(OrderStatus.PENDING_REPLACE, OrderEvent.REPLACE_CONFIRM));
    assertEquals(
        OrderStatus.NEW, OrderStateMachine.transition(OrderStatus.REPLACED, OrderEvent.RESTATE));
  }

  @Test
  void shouldKeepPendingCancelWhileInFlightFillsArrive() {
    assertEquals(
        OrderStatus.PENDING_CANCEL,
        OrderStateMachine.transition(OrderStatus.PENDING_CANCEL, OrderEvent.PARTIAL_FILL));
    assertEquals(
        OrderStatus.FILLED,
        OrderStateMachine.transition(OrderStatus.PENDING_CANCEL, OrderEvent.FULL_FILL));
  }

  @Test
  void shouldOnlyRejectBeforeNew() {
    assertTrue(OrderStateMachine.canApply(OrderStatus.PENDING, OrderEvent.REJECT));
    assertFalse(OrderStateMachine.canApply(OrderStatus.NEW, OrderEvent.REJECT));
    assertFalse(OrderStateMachine.canApply(OrderStatus.PARTIALLY_FILLED, OrderEvent.REJECT));
  }

  @Test
  void shouldHaveNoTransitionsOutOfTerminalStates() {
    for (OrderStatus status : OrderStatus.values()) {
      if (!status.isTerminal()) {
        continue;
      }
      for (OrderEvent event : OrderEvent.values()) {
        assertFalse(
            OrderStateMachine.canApply(status, event), status + " must not accept " + event);
      }
    }
  }

  @Test
  void shouldThrowInvalidTransitionWithContext() {
    InvalidTransitionException exception =
        assertThrows(
            InvalidTransitionException.class,
            () -> OrderStateMachine.transition(OrderStatus.FILLED, OrderEvent.CANCEL_REQUEST));

    assertEquals(OrderStatus.FILLED, exception.from());
    assertEquals(OrderEvent.CANCEL_REQUEST, exception.event());
  }

  @Test
  void shouldTreatNullInputsAsNoTransition() {
    assertTrue(OrderStateMachine.next(null, OrderEvent.ACCEPT).isEmpty());
    assertTrue(OrderStateMachine.next(OrderStatus.NEW, null).isEmpty());
  }
}
