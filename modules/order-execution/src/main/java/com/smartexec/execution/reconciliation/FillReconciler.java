package com.smartexec.execution.reconciliation;

import com.smartexec.domain.orders.ExecutionReport;
import com.smartexec.domain.orders.Order;
import com.smartexec.execution.lifecycle.OrderLifecycleService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FillReconciler {
  private static final Logger log = LoggerFactory.getLogger(FillReconciler.class);

  private final OrderLifecycleService lifecycle;

  public FillReconciler(OrderLifecycleService lifecycle) {
    this.lifecycle = lifecycle;
  }

  public ReconciliationReport reconcile(String orderId) {
    Order order = lifecycle.get(orderId);
    List<ExecutionReport> executions = lifecycle.executions(orderId);
    long executed = executions.stream().mapToLong(ExecutionReport::quantity).sum();
    ReconciliationReport report =
        new ReconciliationReport(
            orderId,
            order.filledQuantity(),
            executed,
            executions.size(),
            order.filledQuantity() - executed);
    if (!report.matched()) {
      log.warn(
          "Fill reconciliation mismatch orderId={} ledgerFilled={} executed={} difference={}",
          orderId,
          report.ledgerFilledQuantity(),
          report.executionQuantity(),
          report.difference());
    }
    return report;
  }
}
