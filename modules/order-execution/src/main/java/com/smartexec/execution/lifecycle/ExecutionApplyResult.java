package com.smartexec.execution.lifecycle;

public enum ExecutionApplyResult {
  APPLIED,
  DUPLICATE
}
