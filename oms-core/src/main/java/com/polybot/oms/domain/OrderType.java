package com.polybot.oms.domain;

/**
 * Time-in-force class of an order.
 */
public enum OrderType {
  /**
   * Fill-and-kill: executes what it can immediately, the rest is canceled.
   */
  FAK,
  /**
   * Good-til-canceled: rests on the book until filled or canceled.
   */
  GTC
}
