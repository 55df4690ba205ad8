package com.dexcex.arb.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of one leg as reported by an exchange adapter. A failed trade is a
 * normal result ({@code success == false} with an {@code error}), not an exception.
 */
@Data
@Builder
public class TradeResult {
    private boolean success;
    private String txId;
    private String asset;
    private TradeSide side;
    private BigDecimal amount; // filled quantity
    private BigDecimal price;
    private BigDecimal fee;
    private Instant timestamp;
    private String error;

    public static TradeResult failed(String asset, TradeSide side, String error, Instant at) {
        return TradeResult.builder()
                .success(false)
                .asset(asset)
                .side(side)
                .amount(BigDecimal.ZERO)
                .price(BigDecimal.ZERO)
                .fee(BigDecimal.ZERO)
                .timestamp(at)
                .error(error)
                .build();
    }
}
