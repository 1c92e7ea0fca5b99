package com.polybot.oms.domain;

/**
 * A binary-outcome market cycle. {@code yesAssetId} is the UP token, {@code noAssetId} the DOWN token.
 */
public record Market(
    String slug,
    String yesAssetId,
    String noAssetId
) {

  public boolean isValid() {
    return slug != null && !slug.isBlank()
        && yesAssetId != null && !yesAssetId.isBlank()
        && noAssetId != null && !noAssetId.isBlank();
  }

  public String assetFor(TokenType tokenType) {
    return tokenType == TokenType.UP ? yesAssetId : noAssetId;
  }
}
