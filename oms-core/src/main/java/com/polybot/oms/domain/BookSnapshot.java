package com.polybot.oms.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Most recent best bid/ask pair of both tokens, stamped with the time it was observed.
 */
public record BookSnapshot(
    Price yesBid,
    Price yesAsk,
    Price noBid,
    Price noAsk,
    Instant updatedAt
) {

  public BookSnapshot {
    yesBid = yesBid == null ? Price.ZERO : yesBid;
    yesAsk = yesAsk == null ? Price.ZERO : yesAsk;
    noBid = noBid == null ? Price.ZERO : noBid;
    noAsk = noAsk == null ? Price.ZERO : noAsk;
  }

  public Price askFor(TokenType tokenType) {
    return tokenType == TokenType.UP ? yesAsk : noAsk;
  }

  public boolean isFresh(Instant now, Duration maxAge) {
    if (updatedAt == null) {
      return false;
    }
    return Duration.between(updatedAt, now).compareTo(maxAge) <= 0;
  }
}
