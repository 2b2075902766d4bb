package com.smartexec.execution.compliance;

import java.util.Objects;

public record ComplianceCheck(String name, Severity severity, boolean passed, String message) {
  public ComplianceCheck {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(severity, "severity must not be null");
  }

  public static ComplianceCheck pass(String name, Severity severity) {
    return new ComplianceCheck(name, severity, true, null);
  }

  public static ComplianceCheck fail(String name, Severity severity, String message) {
    return new ComplianceCheck(name, severity, false, message);
  }

  public boolean isBlocking() {
    return !passed && severity == Severity.ERROR;
  }

  public boolean isWarning() {
    return !passed && severity == Severity.WARNING;
  }
}
