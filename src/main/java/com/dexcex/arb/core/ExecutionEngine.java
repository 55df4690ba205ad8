package com.dexcex.arb.core;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.ArbitrageOpportunity;
import com.dexcex.arb.domain.ArbitrageRoute;
import com.dexcex.arb.domain.ExecutionSummary;
import com.dexcex.arb.domain.FailureReason;
import com.dexcex.arb.domain.PriceSample;
import com.dexcex.arb.domain.RouteKey;
import com.dexcex.arb.domain.TradeResult;
import com.dexcex.arb.domain.TradeSide;
import com.dexcex.arb.domain.VenueKind;
import com.dexcex.arb.infra.ExchangeRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one opportunity through revalidation and its two legs.
 * <p>
 * Concurrency is bounded by a fixed pool of slots; a request that finds none free
 * fails immediately with {@link FailureReason#THROTTLED}. The opportunity is claimed by
 * an {@code ACTIVE -> EXECUTING} swap, so at most one attempt runs per opportunity.
 */
@Slf4j
@Service
public class ExecutionEngine {

    static final String DEADLINE_EXCEEDED = "execution deadline exceeded";
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final OpportunityStore store;
    private final PriceCache priceCache;
    private final ExchangeRegistry registry;
    private final FeeModel feeModel;
    private final RouteBook routeBook;
    private final ExecutionHistory history;
    private final ArbitrageProperties properties;
    private final ExecutorService tradeExecutor;
    private final Clock clock;
    private final Semaphore slots;

    public enum ExecutionState {
        REQUESTED,
        VALIDATED,
        LEG1_BUY,
        LEG2_SELL,
        SETTLED,
        ABORTED
    }

    public ExecutionEngine(OpportunityStore store, PriceCache priceCache, ExchangeRegistry registry,
            FeeModel feeModel, RouteBook routeBook, ExecutionHistory history, ArbitrageProperties properties,
            @Qualifier("tradeExecutor") ExecutorService tradeExecutor, Clock clock) {
        this.store = store;
        this.priceCache = priceCache;
        this.registry = registry;
        this.feeModel = feeModel;
        this.routeBook = routeBook;
        this.history = history;
        this.properties = properties;
        this.tradeExecutor = tradeExecutor;
        this.clock = clock;
        this.slots = new Semaphore(properties.getMaxConcurrentExecutions());
    }

    public ExecutionSummary execute(long opportunityId) {
        Instant start = clock.instant();
        ExecutionState state = ExecutionState.REQUESTED;
        log.info("--- START ARB EXECUTION: opportunity #{} ---", opportunityId);

        ArbitrageOpportunity opp = store.getOpportunity(opportunityId)
                .orElseThrow(() -> reject(FailureReason.NOT_FOUND, opportunityId,
                        "Arbitrage opportunity #" + opportunityId + " not found"));
        if (!opp.isActive()) {
            throw reject(FailureReason.STALE, opportunityId,
                    "Arbitrage opportunity #" + opportunityId + " is no longer active (" + opp.getStatus() + ")");
        }

        ExchangeAdapter buyAdapter = adapterFor(opp.getBuyExchange(), opportunityId);
        ExchangeAdapter sellAdapter = adapterFor(opp.getSellExchange(), opportunityId);
        VenueKind buyKind = buyAdapter.exchange().getKind();
        VenueKind sellKind = sellAdapter.exchange().getKind();

        revalidate(opp, buyKind, sellKind, start);
        state = ExecutionState.VALIDATED;

        if (!slots.tryAcquire()) {
            throw reject(FailureReason.THROTTLED, opportunityId,
                    "Maximum number of concurrent executions (" + properties.getMaxConcurrentExecutions()
                            + ") reached. Please try again later.");
        }
        try {
            if (!store.compareAndSetStatus(opportunityId, ArbitrageOpportunity.Status.ACTIVE,
                    ArbitrageOpportunity.Status.EXECUTING)) {
                throw reject(FailureReason.STALE, opportunityId,
                        "Arbitrage opportunity #" + opportunityId + " was claimed by another execution");
            }
            log.info("[EXECUTION] State: {} | {} buy {} / sell {}", state, opp.getAsset(), opp.getBuyExchange(),
                    opp.getSellExchange());
            return runLegs(opp, buyAdapter, sellAdapter, start);
        } finally {
            slots.release();
        }
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int inFlightExecutions() {
        return properties.getMaxConcurrentExecutions() - slots.availablePermits();
    }

    private ExecutionSummary runLegs(ArbitrageOpportunity opp, ExchangeAdapter buyAdapter,
            ExchangeAdapter sellAdapter, Instant start) {
        Instant deadline = start.plus(properties.getMaxExecutionTime());
        List<ExecutionSummary.LegExecution> legs = new ArrayList<>();
        ExecutionState state = ExecutionState.LEG1_BUY;

        try {
            log.info("[EXECUTION] State: {} | {} {} on {}", state, properties.getTradeAmount(), opp.getAsset(),
                    opp.getBuyExchange());
            TradeResult buy = runLeg(buyAdapter, opp.getAsset(), properties.getTradeAmount(), TradeSide.BUY,
                    deadline);
            legs.add(toLeg(buy, opp.getBuyExchange(), TradeSide.BUY, opp.getBuyPrice()));
            if (!buy.isSuccess()) {
                if (DEADLINE_EXCEEDED.equals(buy.getError())) {
                    // The cancelled call may still have filled
                    log.error("🚨 Buy leg on {} timed out with fill unknown: up to {} {} may be unhedged",
                            opp.getBuyExchange(), properties.getTradeAmount(), opp.getAsset());
                    deactivate(opp.getId());
                } else {
                    // Nothing filled, the opportunity can be retried
                    store.compareAndSetStatus(opp.getId(), ArbitrageOpportunity.Status.EXECUTING,
                            ArbitrageOpportunity.Status.ACTIVE);
                }
                throw abort(opp, legs, start, state, "Buy leg failed on " + opp.getBuyExchange() + ": "
                        + buy.getError());
            }

            state = ExecutionState.LEG2_SELL;
            log.info("[EXECUTION] State: {} | {} {} on {}", state, buy.getAmount(), opp.getAsset(),
                    opp.getSellExchange());
            TradeResult sell = runLeg(sellAdapter, opp.getAsset(), buy.getAmount(), TradeSide.SELL, deadline);
            legs.add(toLeg(sell, opp.getSellExchange(), TradeSide.SELL, opp.getSellPrice()));
            if (!sell.isSuccess()) {
                log.error("🚨 Sell leg failed after buy filled on {}: {} {} left unhedged",
                        opp.getBuyExchange(), buy.getAmount(), opp.getAsset());
                deactivate(opp.getId());
                throw abort(opp, legs, start, state, "Sell leg failed on " + opp.getSellExchange() + ": "
                        + sell.getError());
            }

            return settle(opp, buy, sell, buyAdapter.exchange().getKind(), sellAdapter.exchange().getKind(),
                    legs, start);
        } catch (ArbitrageExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[EXECUTION] FATAL ERROR during state {}", state, e);
            deactivate(opp.getId());
            throw abort(opp, legs, start, state, "Unexpected error during " + state + ": " + e.getMessage());
        }
    }

    private ExecutionSummary settle(ArbitrageOpportunity opp, TradeResult buy, TradeResult sell,
            VenueKind buyKind, VenueKind sellKind, List<ExecutionSummary.LegExecution> legs, Instant start) {
        BigDecimal buyTotal = buy.getAmount().multiply(buy.getPrice()).add(buy.getFee());
        BigDecimal sellTotal = sell.getAmount().multiply(sell.getPrice()).subtract(sell.getFee());
        BigDecimal actualProfit = sellTotal.subtract(buyTotal);
        BigDecimal actualProfitPercentage = buyTotal.signum() > 0
                ? actualProfit.multiply(HUNDRED).divide(buyTotal, 8, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        BigDecimal gasCost = feeModel.gasCost(buyKind, sellKind);
        BigDecimal netProfit = actualProfit.subtract(gasCost);
        Instant end = clock.instant();

        store.updateOpportunity(opp.getId(), o -> o.toBuilder()
                .status(ArbitrageOpportunity.Status.EXECUTED)
                .executedAt(end)
                .actualProfit(actualProfit)
                .actualProfitPercentage(actualProfitPercentage)
                .build());

        ExecutionSummary summary = baseSummary(opp, legs, start, end)
                .success(true)
                .actualProfit(actualProfit)
                .actualProfitPercentage(actualProfitPercentage)
                .profitDifference(actualProfit.subtract(opp.getProfitAmount()))
                .gasCost(gasCost)
                .netProfit(netProfit)
                .build();
        history.append(summary);

        log.info("--- 🎯 EXECUTION SUCCESSFUL for opportunity #{} | {} net profit {} (gas {}) in {} ms ---",
                opp.getId(), opp.getAsset(), netProfit, gasCost, summary.getExecutionTimeMs());
        return summary;
    }

    private ArbitrageExecutionException abort(ArbitrageOpportunity opp, List<ExecutionSummary.LegExecution> legs,
            Instant start, ExecutionState failedIn, String message) {
        ExecutionSummary summary = baseSummary(opp, legs, start, clock.instant())
                .success(false)
                .actualProfit(BigDecimal.ZERO)
                .actualProfitPercentage(BigDecimal.ZERO)
                .profitDifference(opp.getProfitAmount().negate())
                .gasCost(BigDecimal.ZERO)
                .netProfit(BigDecimal.ZERO)
                .failureReason(FailureReason.LEG_FAILURE)
                .failureMessage(message)
                .build();
        history.append(summary);

        log.warn("--- ⚠️ EXECUTION {} for opportunity #{} in state {}: {} ---", ExecutionState.ABORTED,
                opp.getId(), failedIn, message);
        return new ArbitrageExecutionException(FailureReason.LEG_FAILURE, opp.getId(), message, summary);
    }

    private ExecutionSummary.ExecutionSummaryBuilder baseSummary(ArbitrageOpportunity opp,
            List<ExecutionSummary.LegExecution> legs, Instant start, Instant end) {
        String routeId = routeBook.find(RouteKey.of(opp))
                .map(ArbitrageRoute::getId)
                .orElse("manual-" + opp.getId());
        return ExecutionSummary.builder()
                .routeId(routeId)
                .opportunityId(opp.getId())
                .asset(opp.getAsset())
                .startTime(start)
                .endTime(end)
                .legs(List.copyOf(legs))
                .expectedProfit(opp.getProfitAmount())
                .executionTimeMs(Duration.between(start, end).toMillis());
    }

    /**
     * Awaits one leg for whatever remains of the attempt's time budget. Adapter
     * exceptions and timeouts come back as failed results.
     */
    private TradeResult runLeg(ExchangeAdapter adapter, String asset, BigDecimal amount, TradeSide side,
            Instant deadline) {
        long remainingMs = Duration.between(clock.instant(), deadline).toMillis();
        if (remainingMs <= 0) {
            return TradeResult.failed(asset, side, DEADLINE_EXCEEDED, clock.instant());
        }

        Future<TradeResult> call = tradeExecutor.submit(() -> adapter.executeTrade(asset, amount, side));
        try {
            TradeResult result = call.get(remainingMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                return TradeResult.failed(asset, side, "Adapter returned no result", clock.instant());
            }
            return result;
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("{} leg on {} did not finish within {} ms", side, adapter.exchange().getName(), remainingMs);
            return TradeResult.failed(asset, side, DEADLINE_EXCEEDED, clock.instant());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("{} leg on {} threw: {}", side, adapter.exchange().getName(), cause.toString());
            return TradeResult.failed(asset, side, "Exchange unavailable: " + cause.getMessage(), clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return TradeResult.failed(asset, side, "Interrupted while awaiting fill", clock.instant());
        }
    }

    private void revalidate(ArbitrageOpportunity opp, VenueKind buyKind, VenueKind sellKind, Instant now) {
        BigDecimal buyPrice = freshPrice(opp.getBuyExchange(), opp, now);
        BigDecimal sellPrice = freshPrice(opp.getSellExchange(), opp, now);

        FeeModel.Spread spread = feeModel.spread(buyPrice, buyKind, sellPrice, sellKind);
        if (spread == null || spread.getNetProfitPercentage().compareTo(properties.getMinProfitPercentage()) < 0) {
            String pct = spread == null ? "n/a" : spread.getNetProfitPercentage().setScale(2, RoundingMode.HALF_UP)
                    + "%";
            throw reject(FailureReason.NO_LONGER_PROFITABLE, opp.getId(),
                    "Opportunity #" + opp.getId() + " no longer profitable (" + pct + ")");
        }
        log.debug("[EXECUTION] Revalidated #{}: net {}%", opp.getId(), spread.getNetProfitPercentage());
    }

    private BigDecimal freshPrice(String exchange, ArbitrageOpportunity opp, Instant now) {
        Instant freshAfter = now.minus(properties.effectivePriceStaleness());
        return priceCache.get(exchange, opp.getAsset())
                .filter(sample -> !sample.getSampledAt().isBefore(freshAfter))
                .map(PriceSample::getPrice)
                .orElseThrow(() -> reject(FailureReason.PRICE_UNAVAILABLE, opp.getId(),
                        "No current " + opp.getAsset() + " price from " + exchange));
    }

    private ExchangeAdapter adapterFor(String exchange, long opportunityId) {
        return registry.find(exchange)
                .orElseThrow(() -> reject(FailureReason.NOT_FOUND, opportunityId,
                        "Exchange " + exchange + " is not registered"));
    }

    private void deactivate(long opportunityId) {
        store.compareAndSetStatus(opportunityId, ArbitrageOpportunity.Status.EXECUTING,
                ArbitrageOpportunity.Status.INACTIVE);
    }

    private static ExecutionSummary.LegExecution toLeg(TradeResult result, String exchange, TradeSide side,
            BigDecimal expectedPrice) {
        return ExecutionSummary.LegExecution.builder()
                .exchange(exchange)
                .side(side)
                .expectedPrice(expectedPrice)
                .actualPrice(result.getPrice())
                .amount(result.getAmount())
                .fee(result.getFee())
                .success(result.isSuccess())
                .txId(result.getTxId())
                .error(result.getError())
                .build();
    }

    private static ArbitrageExecutionException reject(FailureReason reason, long opportunityId, String message) {
        log.warn("[EXECUTION] Rejected #{}: {} - {}", opportunityId, reason, message);
        return new ArbitrageExecutionException(reason, opportunityId, message);
    }
}
