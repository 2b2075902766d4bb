package com.smartexec.execution.routing;

public enum RoutingStrategy {
  /** Best VWAP, then latency. */
  BEST_EXECUTION,
  /** Best VWAP after venue fees. */
  LOWEST_COST,
  /** Lowest expected latency first. */
  FASTEST,
  /** Dark venues first; requires dark pools to be enabled. */
  DARK_POOL,
  /** Always splits across the ranked venues. */
  CUSTOM
}
