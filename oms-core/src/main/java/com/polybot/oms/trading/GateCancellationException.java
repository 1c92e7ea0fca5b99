package com.polybot.oms.trading;

/**
 * The caller stopped waiting for a serialized write: its deadline passed or its thread was interrupted.
 */
public class GateCancellationException extends TradingException {

  public GateCancellationException(String message, Throwable cause) {
    super(message, cause);
  }
}
