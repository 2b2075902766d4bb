package com.smartexec.domain.orders;

public enum OrderEvent {
  ACCEPT,
  REJECT,
  PARTIAL_FILL,
  FULL_FILL,
  CANCEL_REQUEST,
  CANCEL_CONFIRM,
  REPLACE_REQUEST,
  REPLACE_CONFIRM,
  RESTATE,
  RESTATE_PARTIAL,
  EXPIRE
}
