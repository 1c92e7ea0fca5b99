package com.polybot.oms.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Unit price in pips (1/100 of a cent, i.e. four decimal digits of a 0..1 price).
 */
public record Price(int pips) {

  public static final Price ZERO = new Price(0);

  public static Price ofCents(int cents) {
    return new Price(cents * 100);
  }

  public static Price fromDecimal(double decimal) {
    return new Price((int) Math.round(decimal * 10_000));
  }

  public static Price fromDecimal(BigDecimal decimal) {
    if (decimal == null) {
      return ZERO;
    }
    return new Price(decimal.movePointRight(4).setScale(0, RoundingMode.HALF_UP).intValueExact());
  }

  public int toCents() {
    return (int) Math.round(pips / 100.0);
  }

  public BigDecimal toDecimal() {
    return BigDecimal.valueOf(pips, 4);
  }

  public boolean isPositive() {
    return pips > 0;
  }

  @Override
  public String toString() {
    return toCents() + "c";
  }
}
