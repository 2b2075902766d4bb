package com.smartexec.execution.compliance;

import static com.smartexec.execution.support.ExecutionFixtures.NOW;
import static com.smartexec.execution.support.ExecutionFixtures.limitBuy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderRequest;
import com.smartexec.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RuleBasedComplianceGateTest {
  private final RuleBasedComplianceGate gate =
      new RuleBasedComplianceGate(Set.of("gme"), 50_000, new BigDecimal("1000000"), 10_000);

  @Test
  void shouldPassOrdinaryOrder() {
    ComplianceResult result = gate.check(order(limitBuy("AAPL", 100, "150")));

    assertTrue(result.passed());
    assertTrue(result.violations().isEmpty());
    assertTrue(result.warnings().isEmpty());
  }

  @Test
  void shouldBlockRestrictedSymbolCaseInsensitively() {
    ComplianceResult result = gate.check(order(limitBuy("GME", 10, "20")));

    assertFalse(result.passed());
    assertEquals(
        RuleBasedComplianceGate.RESTRICTED_SYMBOL, result.violations().get(0).name());
  }

  @Test
  void shouldBlockOrdersAboveQuantityAndNotionalLimits() {
    ComplianceResult quantity = gate.check(order(limitBuy("F", 60_000, "12")));
    ComplianceResult notional = gate.check(order(limitBuy("AAPL", 8000, "150")));

    assertEquals(
        RuleBasedComplianceGate.MAX_ORDER_QUANTITY, quantity.violations().get(0).name());
    assertEquals(
        RuleBasedComplianceGate.MAX_ORDER_NOTIONAL, notional.violations().get(0).name());
  }

  @Test
  void shouldSkipNotionalCheckWithoutPrice() {
    ComplianceResult result =
        gate.check(order(OrderRequest.market("client-1", "AAPL", OrderSide.BUY, 9000)));

    assertTrue(result.passed());
    assertTrue(
        result.checks().stream()
            .noneMatch(check -> check.name().equals(RuleBasedComplianceGate.MAX_ORDER_NOTIONAL)));
  }

  @Test
  void shouldWarnWithoutBlockingLargeOrders() {
    ComplianceResult result = gate.check(order(limitBuy("F", 20_000, "12")));

    assertTrue(result.passed());
    assertEquals(1, result.warnings().size());
    assertEquals(RuleBasedComplianceGate.LARGE_ORDER, result.warnings().get(0).name());
    assertEquals(Severity.WARNING, result.warnings().get(0).severity());
  }

  @Test
  void shouldTreatFailedErrorCheckAsBlockingWhateverThePassedFlag() {
    ComplianceResult flaggedPassed =
        new ComplianceResult(
            true, List.of(ComplianceCheck.fail("custom_rule", Severity.ERROR, "breach")));
    ComplianceResult warningOnly =
        new ComplianceResult(
            true, List.of(ComplianceCheck.fail("custom_rule", Severity.WARNING, "large")));

    assertTrue(flaggedPassed.isBlocked());
    assertFalse(warningOnly.isBlocked());
    assertTrue(new ComplianceResult(false, List.of()).isBlocked());
  }

  private static Order order(OrderRequest request) {
    return Order.createPending("ord-1", request, NOW);
  }
}
