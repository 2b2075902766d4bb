package com.smartexec.execution.reconciliation;

/**
 * Comparison of the ledger's filled quantity with the applied execution reports of one order.
 * {@code difference} is ledger minus executions.
 */
public record ReconciliationReport(
    String orderId,
    long ledgerFilledQuantity,
    long executionQuantity,
    int executionCount,
    long difference) {

  public boolean matched() {
    return difference == 0;
  }
}
