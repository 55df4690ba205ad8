package com.dexcex.arb.core;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.ArbitrageRoute;
import com.dexcex.arb.domain.PriceSample;
import com.dexcex.arb.domain.RouteKey;
import com.dexcex.arb.domain.TradeSide;
import com.dexcex.arb.domain.VenueKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Buy on one venue, sell the same asset on another. Every ordered pair of venues
 * quoting an asset is checked against the fee-adjusted minimum profit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CrossExchangeSpreadStrategy implements ArbitrageDetector {

    static final long CEX_LEG_MILLIS = 1500;
    static final long DEX_LEG_MILLIS = 2500;

    private final PriceCache cache;
    private final FeeModel feeModel;
    private final RiskScorer riskScorer;
    private final ArbitrageProperties properties;
    private final Clock clock;

    @Override
    public List<ArbitrageRoute> detect() {
        Instant now = clock.instant();
        Instant freshAfter = now.minus(properties.effectivePriceStaleness());
        Map<RouteKey, ArbitrageRoute> routes = new LinkedHashMap<>();

        for (String asset : properties.getAssets()) {
            List<PriceSample> quotes = cache.getByAsset(asset).stream()
                    .filter(s -> !s.getSampledAt().isBefore(freshAfter))
                    .toList();

            if (quotes.size() < 2) {
                log.debug("Skipping {}: only {} fresh quote(s)", asset, quotes.size());
                continue;
            }

            for (PriceSample buy : quotes) {
                for (PriceSample sell : quotes) {
                    if (buy.getExchange().equals(sell.getExchange())) {
                        continue;
                    }
                    RouteKey key = new RouteKey(asset, buy.getExchange(), sell.getExchange());
                    if (routes.containsKey(key)) {
                        continue;
                    }
                    ArbitrageRoute route = evaluate(asset, buy, sell, now);
                    if (route != null) {
                        routes.put(key, route);
                        log.debug("Route {}: buy {} sell {} net {}%", key, buy.getPrice(), sell.getPrice(),
                                route.getEstimatedProfitPercentage().setScale(4, RoundingMode.HALF_UP));
                    }
                }
            }
        }

        List<ArbitrageRoute> ranked = new ArrayList<>(routes.values());
        ranked.sort(Comparator.comparing(ArbitrageRoute::getEstimatedProfitPercentage).reversed());
        return ranked;
    }

    private ArbitrageRoute evaluate(String asset, PriceSample buy, PriceSample sell, Instant now) {
        FeeModel.Spread spread = feeModel.spread(buy.getPrice(), buy.getVenueKind(), sell.getPrice(),
                sell.getVenueKind());
        if (spread == null) {
            return null;
        }
        if (spread.getNetProfitPercentage().compareTo(properties.getMinProfitPercentage()) < 0) {
            return null;
        }

        BigDecimal amount = properties.getTradeAmount();
        RiskScorer.Score score = riskScorer.score(buy.getExchange(), buy.getVenueKind(),
                sell.getExchange(), sell.getVenueKind(), spread.getNetProfitPercentage());

        return ArbitrageRoute.builder()
                .id(UUID.randomUUID().toString())
                .asset(asset)
                .buyLeg(ArbitrageRoute.Leg.builder()
                        .exchange(buy.getExchange())
                        .venueKind(buy.getVenueKind())
                        .side(TradeSide.BUY)
                        .expectedPrice(buy.getPrice())
                        .amount(amount)
                        .estimatedFee(spread.getBuyFee().multiply(amount))
                        .build())
                .sellLeg(ArbitrageRoute.Leg.builder()
                        .exchange(sell.getExchange())
                        .venueKind(sell.getVenueKind())
                        .side(TradeSide.SELL)
                        .expectedPrice(sell.getPrice())
                        .amount(amount)
                        .estimatedFee(spread.getSellFee().multiply(amount))
                        .build())
                .estimatedProfitAmount(spread.getNetProfit().multiply(amount))
                .estimatedProfitPercentage(spread.getNetProfitPercentage())
                .estimatedExecutionTimeMs(legMillis(buy.getVenueKind()) + legMillis(sell.getVenueKind()))
                .riskScore(score.getRiskScore())
                .confidence(score.getConfidence())
                .detectedAt(now)
                .build();
    }

    private static long legMillis(VenueKind kind) {
        return kind == VenueKind.DEX ? DEX_LEG_MILLIS : CEX_LEG_MILLIS;
    }
}
