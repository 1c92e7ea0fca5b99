package com.polybot.oms.trading;

/**
 * A trading substrate call failed (timeout, connectivity, unexpected response).
 * Callers log it and retry on their own schedule.
 */
public class TradingException extends RuntimeException {

  public TradingException(String message) {
    super(message);
  }

  public TradingException(String message, Throwable cause) {
    super(message, cause);
  }
}
