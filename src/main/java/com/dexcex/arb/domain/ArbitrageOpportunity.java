package com.dexcex.arb.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persisted projection of a route. At most one {@link Status#ACTIVE} opportunity
 * exists per (asset, buyExchange, sellExchange).
 */
@Data
@Builder(toBuilder = true)
public class ArbitrageOpportunity {
    private long id;
    private String asset;
    private String buyExchange;
    private String sellExchange;
    private VenueKind buyVenueKind;
    private VenueKind sellVenueKind;

    private BigDecimal buyPrice;
    private BigDecimal sellPrice;
    private BigDecimal profitAmount;
    private BigDecimal profitPercentage;
    private int riskScore;
    private double confidence;
    private Instant timestamp;

    private Status status;

    // Filled in once executed
    private Instant executedAt;
    private BigDecimal actualProfit;
    private BigDecimal actualProfitPercentage;

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    public enum Status {
        ACTIVE,
        EXECUTING, // claimed by exactly one execution attempt
        EXECUTED,
        INACTIVE
    }
}
