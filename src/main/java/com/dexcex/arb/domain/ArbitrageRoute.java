package com.dexcex.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Candidate buy-low/sell-high pair produced by one detection pass. Never mutated;
 * the next pass supersedes it.
 */
@Value
@Builder
public class ArbitrageRoute {
    String id;
    String asset;
    Leg buyLeg;
    Leg sellLeg;

    BigDecimal estimatedProfitAmount;
    BigDecimal estimatedProfitPercentage;
    long estimatedExecutionTimeMs;
    int riskScore;
    double confidence;
    Instant detectedAt;

    public RouteKey key() {
        return new RouteKey(asset, buyLeg.getExchange(), sellLeg.getExchange());
    }

    @Value
    @Builder
    public static class Leg {
        String exchange;
        VenueKind venueKind;
        TradeSide side;
        BigDecimal expectedPrice;
        BigDecimal amount;
        BigDecimal estimatedFee;
    }
}
