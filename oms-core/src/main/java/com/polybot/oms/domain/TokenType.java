package com.polybot.oms.domain;

/**
 * The two complementary outcome tokens of a binary market. UP is the YES token, DOWN the NO token.
 */
public enum TokenType {
  UP,
  DOWN;

  public TokenType opposite() {
    return this == UP ? DOWN : UP;
  }
}
