package com.smartexec.execution.dispatch;

import com.smartexec.domain.orders.ExecutionReport;
import java.util.List;

/**
 * Outcome of one dispatch. {@code reports} holds the fills applied to the ledger and
 * {@code totalFilled} is their summed quantity; fills the ledger refused are kept apart in
 * {@code rejectedReports}. A total below {@code requestedQuantity} is a partial fill, not an
 * error.
 */
public record DispatchResult(
    List<ExecutionReport> reports,
    List<VenueFailure> failures,
    List<ExecutionReport> rejectedReports,
    long totalFilled,
    long requestedQuantity) {
  public DispatchResult {
    reports = List.copyOf(reports);
    failures = List.copyOf(failures);
    rejectedReports = List.copyOf(rejectedReports);
  }

  public static DispatchResult empty(long requestedQuantity) {
    return new DispatchResult(List.of(), List.of(), List.of(), 0L, requestedQuantity);
  }

  public boolean isComplete() {
    return totalFilled >= requestedQuantity;
  }

  public long unfilledQuantity() {
    return Math.max(0L, requestedQuantity - totalFilled);
  }
}
