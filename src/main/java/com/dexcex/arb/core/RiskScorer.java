package com.dexcex.arb.core;

import com.dexcex.arb.domain.VenueKind;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Heuristic risk (0-100, higher is riskier) and confidence (0-1) for a route.
 * Pure: the same inputs always give the same score.
 */
@Component
public class RiskScorer {

    static final int BASE_RISK = 50;
    static final double BASE_CONFIDENCE = 0.7;
    static final double DEFAULT_RELIABILITY = 0.8;

    // Negative = established venue, lowers risk
    private static final Map<String, Integer> EXCHANGE_RISK = Map.of(
            "Uniswap", -5,
            "SushiSwap", 0,
            "Curve", -3,
            "PancakeSwap", 0,
            "Jupiter", 3,
            "OKX", -8,
            "Binance", -10,
            "Coinbase", -7,
            "Kraken", -5);

    private static final Map<String, Double> EXCHANGE_RELIABILITY = Map.ofEntries(
            Map.entry("Binance", 0.95),
            Map.entry("Coinbase", 0.95),
            Map.entry("Kraken", 0.93),
            Map.entry("OKX", 0.92),
            Map.entry("Bybit", 0.90),
            Map.entry("Huobi", 0.88),
            Map.entry("Bitfinex", 0.87),
            Map.entry("Kucoin", 0.86),
            Map.entry("Uniswap", 0.85),
            Map.entry("Curve", 0.84),
            Map.entry("PancakeSwap", 0.83),
            Map.entry("SushiSwap", 0.82),
            Map.entry("Jupiter", 0.82),
            Map.entry("Balancer", 0.81),
            Map.entry("Trader Joe", 0.80),
            Map.entry("Raydium", 0.80));

    public Score score(String buyExchange, VenueKind buyKind, String sellExchange, VenueKind sellKind,
            BigDecimal netProfitPercentage) {
        double pct = netProfitPercentage.doubleValue();
        return new Score(
                riskScore(buyExchange, buyKind, sellExchange, sellKind, pct),
                confidence(buyExchange, buyKind, sellExchange, sellKind, pct));
    }

    int riskScore(String buyExchange, VenueKind buyKind, String sellExchange, VenueKind sellKind, double pct) {
        int risk = BASE_RISK;

        // Outsized spreads are usually stale quotes or thin books
        if (pct > 5) {
            risk += 20;
        } else if (pct > 2) {
            risk += 10;
        } else if (pct > 1) {
            risk += 5;
        }

        if (buyKind == VenueKind.DEX) risk += 5;
        if (sellKind == VenueKind.DEX) risk += 5;

        risk += EXCHANGE_RISK.getOrDefault(buyExchange, 0);
        risk += EXCHANGE_RISK.getOrDefault(sellExchange, 0);

        return Math.max(0, Math.min(100, risk));
    }

    double confidence(String buyExchange, VenueKind buyKind, String sellExchange, VenueKind sellKind, double pct) {
        double confidence = BASE_CONFIDENCE;
        confidence *= EXCHANGE_RELIABILITY.getOrDefault(buyExchange, DEFAULT_RELIABILITY);
        confidence *= EXCHANGE_RELIABILITY.getOrDefault(sellExchange, DEFAULT_RELIABILITY);

        if (pct > 5) {
            confidence -= 0.3;
        } else if (pct > 3) {
            confidence -= 0.15;
        } else if (pct < 0.5) {
            confidence -= 0.1;
        }

        if (buyKind == VenueKind.CEX) confidence += 0.1;
        if (sellKind == VenueKind.CEX) confidence += 0.1;

        return Math.max(0.0, Math.min(1.0, confidence));
    }

    @Value
    public static class Score {
        int riskScore;
        double confidence;
    }
}
