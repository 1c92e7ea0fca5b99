package com.polybot.oms.trading;

/**
 * The substrate deliberately refused an order (trading paused, market mismatch, ...). Not retried.
 */
public class OrderRejectedException extends TradingException {

  public OrderRejectedException(String message) {
    super(message);
  }
}
