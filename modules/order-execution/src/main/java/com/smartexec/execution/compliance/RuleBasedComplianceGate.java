package com.smartexec.execution.compliance;

import com.smartexec.domain.orders.Order;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static pre-trade limits. Notional is only checked when the order carries a price; market
 * orders pass that rule.
 */
public class RuleBasedComplianceGate implements ComplianceGate {
  public static final String RESTRICTED_SYMBOL = "restricted_symbol";
  public static final String MAX_ORDER_QUANTITY = "max_order_quantity";
  public static final String MAX_ORDER_NOTIONAL = "max_order_notional";
  public static final String LARGE_ORDER = "large_order";

  private static final Logger log = LoggerFactory.getLogger(RuleBasedComplianceGate.class);

  private final Set<String> restrictedSymbols;
  private final long maxOrderQuantity;
  private final BigDecimal maxOrderNotional;
  private final long largeOrderWarningQuantity;

  public RuleBasedComplianceGate(
      Set<String> restrictedSymbols,
      long maxOrderQuantity,
      BigDecimal maxOrderNotional,
      long largeOrderWarningQuantity) {
    this.restrictedSymbols =
        restrictedSymbols == null
            ? Set.of()
            : restrictedSymbols.stream()
                .map(symbol -> symbol.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    this.maxOrderQuantity = maxOrderQuantity;
    this.maxOrderNotional = maxOrderNotional;
    this.largeOrderWarningQuantity = largeOrderWarningQuantity;
  }

  @Override
  public ComplianceResult check(Order order) {
    List<ComplianceCheck> checks = new ArrayList<>();

    if (restrictedSymbols.contains(order.symbol().toUpperCase(Locale.ROOT))) {
      checks.add(
          ComplianceCheck.fail(
              RESTRICTED_SYMBOL, Severity.ERROR, "Symbol " + order.symbol() + " is restricted"));
    } else {
      checks.add(ComplianceCheck.pass(RESTRICTED_SYMBOL, Severity.ERROR));
    }

    if (maxOrderQuantity > 0 && order.quantity() > maxOrderQuantity) {
      checks.add(
          ComplianceCheck.fail(
              MAX_ORDER_QUANTITY,
              Severity.ERROR,
              "Quantity " + order.quantity() + " exceeds limit " + maxOrderQuantity));
    } else {
      checks.add(ComplianceCheck.pass(MAX_ORDER_QUANTITY, Severity.ERROR));
    }

    BigDecimal price = order.effectiveLimitPrice();
    if (maxOrderNotional != null && price != null) {
      BigDecimal notional = price.multiply(BigDecimal.valueOf(order.quantity()));
      if (notional.compareTo(maxOrderNotional) > 0) {
        checks.add(
            ComplianceCheck.fail(
                MAX_ORDER_NOTIONAL,
                Severity.ERROR,
                "Notional "
                    + notional.toPlainString()
                    + " exceeds limit "
                    + maxOrderNotional.toPlainString()));
      } else {
        checks.add(ComplianceCheck.pass(MAX_ORDER_NOTIONAL, Severity.ERROR));
      }
    }

    if (largeOrderWarningQuantity > 0 && order.quantity() >= largeOrderWarningQuantity) {
      checks.add(
          ComplianceCheck.fail(
              LARGE_ORDER,
              Severity.WARNING,
              "Quantity " + order.quantity() + " is at or above " + largeOrderWarningQuantity));
    } else {
      checks.add(ComplianceCheck.pass(LARGE_ORDER, Severity.WARNING));
    }

    ComplianceResult result = ComplianceResult.of(checks);
    if (result.isBlocked()) {
      log.info(
          "Compliance blocked orderId={} symbol={} violations={}",
          order.orderId(),
          order.symbol(),
          result.violations().stream().map(ComplianceCheck::name).toList());
    }
    return result;
  }
}
