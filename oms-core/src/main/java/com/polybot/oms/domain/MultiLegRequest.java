package com.polybot.oms.domain;

import java.util.List;

/**
 * Several legs submitted as one unit. Created orders are returned in leg order.
 */
public record MultiLegRequest(
    String name,
    String marketSlug,
    List<LegIntent> legs
) {

  public MultiLegRequest {
    legs = legs == null ? List.of() : List.copyOf(legs);
  }
}
