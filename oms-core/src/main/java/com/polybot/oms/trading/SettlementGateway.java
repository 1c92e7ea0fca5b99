package com.polybot.oms.trading;

import com.polybot.oms.domain.Market;

/**
 * Settlement collaborator. Merges complete sets of the current cycle back into collateral.
 */
public interface SettlementGateway {

  void tryMergeCurrentCycle(Market market);
}
