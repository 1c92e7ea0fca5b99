package com.polybot.oms.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable view of an order as last reported by the trading substrate.
 *
 * @param linkedOrderId for hedge orders, the id of the entry order they cover
 */
public record Order(
    String orderId,
    String marketSlug,
    String assetId,
    TokenType tokenType,
    OrderSide side,
    Price price,
    BigDecimal size,
    OrderType orderType,
    OrderStatus status,
    boolean entry,
    String linkedOrderId,
    BigDecimal filledSize,
    Price filledPrice,
    Instant filledAt,
    Instant createdAt,
    boolean disableSizeAdjust,
    boolean bypassRiskOff
) {

  public Order {
    if (status == null) {
      status = OrderStatus.PENDING;
    }
    if (filledSize == null) {
      filledSize = BigDecimal.ZERO;
    }
    if (price == null) {
      price = Price.ZERO;
    }
    if (side == null) {
      side = OrderSide.BUY;
    }
  }

  public static Order buy(String marketSlug, String assetId, TokenType tokenType, Price price, BigDecimal size,
                          OrderType orderType, boolean entry, Instant createdAt) {
    return new Order(null, marketSlug, assetId, tokenType, OrderSide.BUY, price, size, orderType,
        OrderStatus.PENDING, entry, null, BigDecimal.ZERO, null, null, createdAt, false, false);
  }

  public boolean isFilled() {
    return status == OrderStatus.FILLED;
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public boolean hasId() {
    return orderId != null && !orderId.isBlank();
  }

  /**
   * Cost basis in cents: the fill price when known, otherwise the limit price.
   */
  public int costCents() {
    return filledPrice != null ? filledPrice.toCents() : price.toCents();
  }

  /**
   * Filled size when positive, otherwise the requested size.
   */
  public BigDecimal executedSize() {
    return filledSize.signum() > 0 ? filledSize : size;
  }

  public Order withOrderId(String id) {
    return new Order(id, marketSlug, assetId, tokenType, side, price, size, orderType, status, entry,
        linkedOrderId, filledSize, filledPrice, filledAt, createdAt, disableSizeAdjust, bypassRiskOff);
  }

  public Order withStatus(OrderStatus newStatus) {
    return new Order(orderId, marketSlug, assetId, tokenType, side, price, size, orderType, newStatus, entry,
        linkedOrderId, filledSize, filledPrice, filledAt, createdAt, disableSizeAdjust, bypassRiskOff);
  }

  public Order withLinkedOrderId(String entryOrderId) {
    return new Order(orderId, marketSlug, assetId, tokenType, side, price, size, orderType, status, entry,
        entryOrderId, filledSize, filledPrice, filledAt, createdAt, disableSizeAdjust, bypassRiskOff);
  }

  public Order withRiskFlags(boolean noSizeAdjust, boolean bypassRisk) {
    return new Order(orderId, marketSlug, assetId, tokenType, side, price, size, orderType, status, entry,
        linkedOrderId, filledSize, filledPrice, filledAt, createdAt, noSizeAdjust, bypassRisk);
  }

  public Order withFill(OrderStatus newStatus, BigDecimal newFilledSize, Price fillPrice, Instant at) {
    return new Order(orderId, marketSlug, assetId, tokenType, side, price, size, orderType, newStatus, entry,
        linkedOrderId, newFilledSize, fillPrice, at, createdAt, disableSizeAdjust, bypassRiskOff);
  }

  public Order withOrderType(OrderType type) {
    return new Order(orderId, marketSlug, assetId, tokenType, side, price, size, type, status, entry,
        linkedOrderId, filledSize, filledPrice, filledAt, createdAt, disableSizeAdjust, bypassRiskOff);
  }
}
