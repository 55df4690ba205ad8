package com.dexcex.arb.domain;

import lombok.Value;

/**
 * (asset, buyExchange, sellExchange) identity shared by routes and persisted opportunities.
 */
@Value
public class RouteKey {
    String asset;
    String buyExchange;
    String sellExchange;

    public static RouteKey of(ArbitrageOpportunity opp) {
        return new RouteKey(opp.getAsset(), opp.getBuyExchange(), opp.getSellExchange());
    }

    @Override
    public String toString() {
        return asset + " " + buyExchange + "->" + sellExchange;
    }
}
