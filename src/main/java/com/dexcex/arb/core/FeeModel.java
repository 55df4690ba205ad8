package com.dexcex.arb.core;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.VenueKind;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Venue-kind fee and network-cost schedule, plus the net-spread arithmetic shared by
 * detection and pre-trade revalidation.
 */
@Component
@RequiredArgsConstructor
public class FeeModel {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ArbitrageProperties properties;

    public BigDecimal feeRate(VenueKind kind) {
        return properties.getFees().forKind(kind);
    }

    public BigDecimal gasCost(VenueKind buyKind, VenueKind sellKind) {
        ArbitrageProperties.VenueRates gas = properties.getGasCost();
        return gas.forKind(buyKind).add(gas.forKind(sellKind));
    }

    /**
     * Per-unit spread after both legs' fees. Returns {@code null} for a non-positive buy
     * price, since the percentage would be undefined.
     */
    public Spread spread(BigDecimal buyPrice, VenueKind buyKind, BigDecimal sellPrice, VenueKind sellKind) {
        if (buyPrice == null || sellPrice == null || buyPrice.signum() <= 0) {
            return null;
        }
        BigDecimal buyFee = buyPrice.multiply(feeRate(buyKind));
        BigDecimal sellFee = sellPrice.multiply(feeRate(sellKind));
        BigDecimal gross = sellPrice.subtract(buyPrice);
        BigDecimal net = gross.subtract(buyFee).subtract(sellFee);
        BigDecimal netPercentage = net.multiply(HUNDRED).divide(buyPrice, 8, RoundingMode.HALF_UP);
        return new Spread(gross, buyFee, sellFee, net, netPercentage);
    }

    @Value
    public static class Spread {
        BigDecimal grossSpread;
        BigDecimal buyFee;
        BigDecimal sellFee;
        BigDecimal netProfit;
        BigDecimal netProfitPercentage;
    }
}
