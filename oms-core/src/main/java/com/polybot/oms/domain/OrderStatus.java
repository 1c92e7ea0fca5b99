package com.polybot.oms.domain;

public enum OrderStatus {
  PENDING,
  OPEN,
  PARTIAL,
  FILLED,
  CANCELED,
  FAILED;

  public boolean isTerminal() {
    return this == FILLED || this == CANCELED || this == FAILED;
  }
}
