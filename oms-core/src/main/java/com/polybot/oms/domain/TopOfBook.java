package com.polybot.oms.domain;

public record TopOfBook(
    Price yesBid,
    Price yesAsk,
    Price noBid,
    Price noAsk,
    String source
) {

  public TopOfBook {
    yesBid = yesBid == null ? Price.ZERO : yesBid;
    yesAsk = yesAsk == null ? Price.ZERO : yesAsk;
    noBid = noBid == null ? Price.ZERO : noBid;
    noAsk = noAsk == null ? Price.ZERO : noAsk;
  }

  public Price askFor(TokenType tokenType) {
    return tokenType == TokenType.UP ? yesAsk : noAsk;
  }
}
