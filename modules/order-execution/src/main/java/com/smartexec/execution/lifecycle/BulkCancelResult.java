package com.smartexec.execution.lifecycle;

import java.util.List;

public record BulkCancelResult(List<String> cancelledOrderIds, List<String> failedOrderIds) {
  public BulkCancelResult {
    cancelledOrderIds = List.copyOf(cancelledOrderIds);
    failedOrderIds = List.copyOf(failedOrderIds);
  }

  public int cancelled() {
    return cancelledOrderIds.size();
  }

  public int failed() {
    return failedOrderIds.size();
  }
}
