package com.dexcex.arb.core;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.ArbitrageRoute;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodic sample -> detect -> sync -> prune cycle. Cycles never overlap: a forced
 * refresh waits for a running tick to finish.
 */
@Slf4j
@Service
public class MonitoringLoop {

    private final PriceSampler sampler;
    private final List<ArbitrageDetector> detectors;
    private final RouteBook routeBook;
    private final OpportunityStoreSync storeSync;
    private final ArbitrageProperties properties;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private ScheduledFuture<?> scheduled;

    public MonitoringLoop(PriceSampler sampler, List<ArbitrageDetector> detectors, RouteBook routeBook,
            OpportunityStoreSync storeSync, ArbitrageProperties properties, TaskScheduler taskScheduler,
            Clock clock) {
        this.sampler = sampler;
        this.detectors = detectors;
        this.routeBook = routeBook;
        this.storeSync = storeSync;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getMonitoring().isAutoStart()) {
            start();
        }
    }

    /**
     * @return {@code false} if the loop was already running
     */
    public synchronized boolean start() {
        if (scheduled != null) {
            log.debug("Monitoring already active");
            return false;
        }
        scheduled = taskScheduler.scheduleAtFixedRate(this::tick, properties.getMonitoring().getInterval());
        log.info("Price monitoring started: {} assets, every {}", properties.getAssets().size(),
                properties.getMonitoring().getInterval());
        return true;
    }

    /**
     * @return {@code false} if the loop was not running
     */
    public synchronized boolean stop() {
        if (scheduled == null) {
            return false;
        }
        scheduled.cancel(false);
        scheduled = null;
        log.info("Price monitoring stopped");
        return true;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public synchronized boolean isRunning() {
        return scheduled != null;
    }

    /**
     * Scheduled entry point. Never throws, so the schedule is never cancelled by an error.
     */
    void tick() {
        try {
            CycleResult result = runCycle();
            log.info("Arb monitor heartbeat: {} exchanges sampled, {} routes, sync {}", result.getSampled(),
                    result.getRoutes().size(), result.getSync());
        } catch (Exception e) {
            log.error("Error in arbitrage monitoring cycle", e);
        }
    }

    public CycleResult runCycle() {
        cycleLock.lock();
        try {
            int sampled = sampler.sampleAll();

            List<ArbitrageRoute> routes = new ArrayList<>();
            for (ArbitrageDetector detector : detectors) {
                try {
                    routes.addAll(detector.detect());
                } catch (Exception e) {
                    log.error("Error in detector strategy: {}", detector.getClass().getSimpleName(), e);
                }
            }
            routes.sort(Comparator.comparing(ArbitrageRoute::getEstimatedProfitPercentage).reversed());

            routeBook.supersede(routes);
            OpportunityStoreSync.SyncResult sync = storeSync.sync(routes);
            int pruned = routeBook.pruneOlderThan(clock.instant().minus(properties.getRouteTtl()));
            if (pruned > 0) {
                log.debug("Pruned {} expired routes", pruned);
            }
            return new CycleResult(sampled, List.copyOf(routes), sync, pruned);
        } finally {
            cycleLock.unlock();
        }
    }

    @Value
    public static class CycleResult {
        int sampled;
        List<ArbitrageRoute> routes;
        OpportunityStoreSync.SyncResult sync;
        int pruned;
    }
}
