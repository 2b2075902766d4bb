package com.smartexec.execution.ledger;

public enum AuditEventType {
  CREATED,
  ACCEPTED,
  REJECTED,
  EXECUTION_APPLIED,
  CANCEL_REQUESTED,
  CANCELED,
  REPLACE_REQUESTED,
  REPLACED,
  RESTATED,
  EXPIRED
}
