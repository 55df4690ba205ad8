package com.dexcex.arb.core;

import com.dexcex.arb.domain.ArbitrageRoute;
import com.dexcex.arb.domain.RouteKey;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Most recent route per (asset, buyExchange, sellExchange). Written only by the
 * monitoring tick.
 */
@Component
public class RouteBook {

    private final ConcurrentHashMap<RouteKey, ArbitrageRoute> routes = new ConcurrentHashMap<>();

    public void supersede(Collection<ArbitrageRoute> latest) {
        latest.forEach(route -> routes.put(route.key(), route));
    }

    public int pruneOlderThan(Instant cutoff) {
        int before = routes.size();
        routes.values().removeIf(route -> route.getDetectedAt().isBefore(cutoff));
        return before - routes.size();
    }

    public Optional<ArbitrageRoute> find(RouteKey key) {
        return Optional.ofNullable(routes.get(key));
    }

    public List<ArbitrageRoute> snapshot() {
        return routes.values().stream()
                .sorted(Comparator.comparing(ArbitrageRoute::getEstimatedProfitPercentage).reversed())
                .toList();
    }

    public int size() {
        return routes.size();
    }
}
