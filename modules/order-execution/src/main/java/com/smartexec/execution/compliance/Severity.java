package com.smartexec.execution.compliance;

public enum Severity {
  INFO,
  WARNING,
  ERROR
}
