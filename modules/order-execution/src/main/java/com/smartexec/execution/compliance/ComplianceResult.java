package com.smartexec.execution.compliance;

import java.util.List;

/**
 * Gate outcome. A failed ERROR check blocks regardless of {@code passed}; failed WARNING checks
 * are carried along.
 */
public record ComplianceResult(boolean passed, List<ComplianceCheck> checks) {
  public ComplianceResult {
    checks = checks == null ? List.of() : List.copyOf(checks);
  }

  public static ComplianceResult of(List<ComplianceCheck> checks) {
    boolean blocked = checks.stream().anyMatch(ComplianceCheck::isBlocking);
    return new ComplianceResult(!blocked, checks);
  }

  public boolean isBlocked() {
    return !passed || checks.stream().anyMatch(ComplianceCheck::isBlocking);
  }

  public List<ComplianceCheck> violations() {
    return checks.stream().filter(ComplianceCheck::isBlocking).toList();
  }

  public List<ComplianceCheck> warnings() {
    return checks.stream().filter(ComplianceCheck::isWarning).toList();
  }
}
