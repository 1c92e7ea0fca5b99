package com.polybot.oms.trading;

import com.polybot.oms.domain.BookSnapshot;
import com.polybot.oms.domain.Market;
import com.polybot.oms.domain.MultiLegRequest;
import com.polybot.oms.domain.Order;
import com.polybot.oms.domain.Position;
import com.polybot.oms.domain.TopOfBook;

import java.util.List;
import java.util.Optional;

/**
 * Trading substrate used by the coordinator.
 *
 * Mutating calls ({@link #placeOrder}, {@link #cancelOrder}, {@link #executeMultiLeg}) are expected to be
 * serialized by the caller. Read calls must be safe for concurrent use.
 */
public interface TradingGateway {

  /**
   * Places an order and returns it with its assigned id and the status known right after submission.
   *
   * @throws OrderRejectedException when the substrate refuses the order
   * @throws TradingException on transport failures
   */
  Order placeOrder(Order order);

  void cancelOrder(String orderId);

  List<Order> executeMultiLeg(MultiLegRequest request);

  Optional<Order> getOrder(String orderId);

  TopOfBook getTopOfBook(Market market);

  /**
   * Latest streamed best bid/ask of the current market, if any has been observed.
   */
  Optional<BookSnapshot> bestBookSnapshot();

  List<Position> getOpenPositionsForMarket(String marketSlug);

  Optional<Market> getCurrentMarketInfo();

  /**
   * Refreshes cached positions for the market from the authoritative source.
   */
  void reconcileMarketPositions(Market market);
}
