package com.smartexec.execution.dispatch;

import com.smartexec.domain.orders.ExecutionReport;

public interface VenueExecutionEndpoint {
  /**
   * Executes the request on its venue and returns the fill, which may be smaller than the
   * requested quantity.
   *
   * @throws VenueFailureException when the venue rejects the request or cannot be reached
   */
  ExecutionReport execute(VenueExecutionRequest request);
}
