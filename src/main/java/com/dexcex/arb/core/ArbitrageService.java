package com.dexcex.arb.core;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.ArbitrageOpportunity;
import com.dexcex.arb.domain.ArbitrageRoute;
import com.dexcex.arb.domain.Exchange;
import com.dexcex.arb.domain.ExecutionSummary;
import com.dexcex.arb.domain.PerformanceMetrics;
import com.dexcex.arb.infra.ExchangeRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for callers of the arbitrage engine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArbitrageService {

    private final MonitoringLoop monitoringLoop;
    private final OpportunityStore store;
    private final ExecutionEngine executionEngine;
    private final ExecutionHistory history;
    private final PerformanceAggregator aggregator;
    private final ExchangeRegistry registry;
    private final RouteBook routeBook;
    private final ArbitrageProperties properties;

    /**
     * Starts monitoring on first use, refreshing once so the first caller sees data.
     */
    public List<ArbitrageOpportunity> getOpportunities() {
        if (monitoringLoop.start()) {
            log.info("Monitoring was idle; running an initial refresh");
            monitoringLoop.runCycle();
        }
        return store.listOpportunities();
    }

    /**
     * Forces an out-of-band sampling and detection cycle.
     */
    public List<ArbitrageOpportunity> detectNewOpportunities() {
        monitoringLoop.runCycle();
        return store.listOpportunities();
    }

    /**
     * @throws ArbitrageExecutionException if the opportunity cannot be executed or a leg fails
     */
    public ExecutionSummary executeTrade(long opportunityId) {
        return executionEngine.execute(opportunityId);
    }

    public PerformanceMetrics getPerformanceMetrics() {
        PerformanceMetrics metrics = aggregator.aggregate(history.snapshot(), properties.getRecentExecutions());
        metrics.setMonitoredExchanges(registry.size());
        metrics.setMonitoredAssets(List.copyOf(properties.getAssets()));
        metrics.setActiveRoutes(routeBook.size());
        return metrics;
    }

    public List<ArbitrageRoute> getRoutes() {
        return routeBook.snapshot();
    }

    public List<Exchange> getExchanges() {
        return registry.adapters().stream().map(ExchangeAdapter::exchange).toList();
    }

    public boolean startMonitoring() {
        return monitoringLoop.start();
    }

    public boolean stopMonitoring() {
        return monitoringLoop.stop();
    }
}
