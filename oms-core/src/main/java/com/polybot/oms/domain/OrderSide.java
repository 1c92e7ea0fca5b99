package com.polybot.oms.domain;

public enum OrderSide {
  BUY,
  SELL
}
