package com.dexcex.arb.core;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.ArbitrageOpportunity;
import com.dexcex.arb.domain.ArbitrageRoute;
import com.dexcex.arb.domain.RouteKey;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reconciles one tick's routes with the persisted opportunities. A pass over an
 * unchanged route set makes no writes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpportunityStoreSync {

    private final OpportunityStore store;
    private final ArbitrageProperties properties;
    private final Clock clock;

    public SyncResult sync(List<ArbitrageRoute> routes) {
        Map<RouteKey, ArbitrageOpportunity> active = new HashMap<>();
        Set<RouteKey> executing = new HashSet<>();
        for (ArbitrageOpportunity opp : store.listOpportunities()) {
            if (opp.isActive()) {
                active.put(RouteKey.of(opp), opp);
            } else if (opp.getStatus() == ArbitrageOpportunity.Status.EXECUTING) {
                executing.add(RouteKey.of(opp));
            }
        }

        Instant now = clock.instant();
        int created = 0;
        int updated = 0;
        int deactivated = 0;

        Map<RouteKey, ArbitrageRoute> current = new HashMap<>();
        for (ArbitrageRoute route : routes) {
            current.putIfAbsent(route.key(), route);
        }

        for (ArbitrageRoute route : current.values()) {
            if (executing.contains(route.key())) {
                // the in-flight row may come back to ACTIVE after a failed buy
                log.debug("Skipping {}: opportunity is executing", route.key());
                continue;
            }
            ArbitrageOpportunity existing = active.get(route.key());
            if (existing == null) {
                ArbitrageOpportunity opp = store.createOpportunity(toOpportunity(route, now));
                log.info("New opportunity #{}: {} buy {} @ {} sell {} @ {} ({}%)", opp.getId(), route.getAsset(),
                        opp.getBuyExchange(), opp.getBuyPrice(), opp.getSellExchange(), opp.getSellPrice(),
                        opp.getProfitPercentage());
                created++;
            } else if (!isSameOpportunity(existing, route) && refresh(existing.getId(), route, now)) {
                updated++;
            }
        }

        for (ArbitrageOpportunity opp : active.values()) {
            if (!current.containsKey(RouteKey.of(opp))) {
                if (store.compareAndSetStatus(opp.getId(), ArbitrageOpportunity.Status.ACTIVE,
                        ArbitrageOpportunity.Status.INACTIVE)) {
                    deactivated++;
                }
            }
        }

        SyncResult result = new SyncResult(created, updated, deactivated);
        log.debug("Store sync: {}", result);
        return result;
    }

    /**
     * Applies the route only if the row is still ACTIVE when the store runs the patch.
     */
    private boolean refresh(long id, ArbitrageRoute route, Instant now) {
        AtomicBoolean applied = new AtomicBoolean(false);
        store.updateOpportunity(id, opp -> {
            if (!opp.isActive()) {
                return opp;
            }
            applied.set(true);
            return applyRoute(opp, route, now);
        });
        return applied.get();
    }

    /**
     * A persisted opportunity still represents a route when both prices are unchanged
     * and the profit percentage moved by less than the configured tolerance.
     */
    boolean isSameOpportunity(ArbitrageOpportunity opp, ArbitrageRoute route) {
        return withinTolerance(opp.getProfitPercentage(), route.getEstimatedProfitPercentage(),
                properties.getProfitTolerance())
                && opp.getBuyPrice().compareTo(route.getBuyLeg().getExpectedPrice()) == 0
                && opp.getSellPrice().compareTo(route.getSellLeg().getExpectedPrice()) == 0;
    }

    static boolean withinTolerance(BigDecimal a, BigDecimal b, BigDecimal tolerance) {
        return a.subtract(b).abs().compareTo(tolerance) < 0;
    }

    private static ArbitrageOpportunity toOpportunity(ArbitrageRoute route, Instant now) {
        return applyRoute(ArbitrageOpportunity.builder()
                .asset(route.getAsset())
                .buyExchange(route.getBuyLeg().getExchange())
                .sellExchange(route.getSellLeg().getExchange())
                .buyVenueKind(route.getBuyLeg().getVenueKind())
                .sellVenueKind(route.getSellLeg().getVenueKind())
                .status(ArbitrageOpportunity.Status.ACTIVE)
                .build(), route, now);
    }

    private static ArbitrageOpportunity applyRoute(ArbitrageOpportunity opp, ArbitrageRoute route, Instant now) {
        return opp.toBuilder()
                .buyPrice(route.getBuyLeg().getExpectedPrice())
                .sellPrice(route.getSellLeg().getExpectedPrice())
                .profitAmount(route.getEstimatedProfitAmount())
                .profitPercentage(route.getEstimatedProfitPercentage())
                .riskScore(route.getRiskScore())
                .confidence(route.getConfidence())
                .timestamp(now)
                .build();
    }

    @Value
    public static class SyncResult {
        int created;
        int updated;
        int deactivated;

        public int writes() {
            return created + updated + deactivated;
        }
    }
}
