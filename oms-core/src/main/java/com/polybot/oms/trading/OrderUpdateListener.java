package com.polybot.oms.trading;

import com.polybot.oms.domain.Order;

@FunctionalInterface
public interface OrderUpdateListener {

  void onOrderUpdate(Order order);
}
