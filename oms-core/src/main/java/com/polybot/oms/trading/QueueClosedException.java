package com.polybot.oms.trading;

public class QueueClosedException extends TradingException {

  public QueueClosedException() {
    super("trading queue closed");
  }
}
