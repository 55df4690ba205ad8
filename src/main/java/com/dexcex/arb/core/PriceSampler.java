package com.dexcex.arb.core;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.Exchange;
import com.dexcex.arb.domain.PriceSample;
import com.dexcex.arb.infra.ExchangeRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Fans out one price request per exchange and waits for all of them. A failing
 * exchange is logged and flagged; its previous cache entries stay in place.
 */
@Slf4j
@Service
public class PriceSampler {

    private final ExchangeRegistry registry;
    private final PriceCache cache;
    private final ArbitrageProperties properties;
    private final Executor samplingExecutor;
    private final Clock clock;

    public PriceSampler(ExchangeRegistry registry, PriceCache cache, ArbitrageProperties properties,
            @Qualifier("samplingExecutor") Executor samplingExecutor, Clock clock) {
        this.registry = registry;
        this.cache = cache;
        this.properties = properties;
        this.samplingExecutor = samplingExecutor;
        this.clock = clock;
    }

    /**
     * @return number of exchanges sampled successfully
     */
    public int sampleAll() {
        List<String> assets = List.copyOf(properties.getAssets());
        long timeoutMs = properties.getMonitoring().getSamplingTimeout().toMillis();

        List<CompletableFuture<Boolean>> calls = registry.adapters().stream()
                .map(adapter -> CompletableFuture
                        .supplyAsync(() -> adapter.getPrices(assets), samplingExecutor)
                        .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                        .handle((prices, error) -> record(adapter.exchange(), prices, error)))
                .toList();

        CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).join();

        int succeeded = (int) calls.stream().filter(CompletableFuture::join).count();
        log.debug("Sampled {}/{} exchanges", succeeded, calls.size());
        return succeeded;
    }

    private boolean record(Exchange exchange, Map<String, BigDecimal> prices, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            log.warn("Price sampling failed for {}: {}", exchange.getName(), cause.toString());
            exchange.markError();
            return false;
        }

        if (prices == null) {
            log.warn("Price sampling for {} returned nothing", exchange.getName());
            exchange.markError();
            return false;
        }

        Instant now = clock.instant();
        prices.forEach((asset, price) -> {
            if (price == null || price.signum() <= 0) {
                log.debug("Ignoring non-positive price {} for {} on {}", price, asset, exchange.getName());
                return;
            }
            cache.update(PriceSample.builder()
                    .exchange(exchange.getName())
                    .venueKind(exchange.getKind())
                    .asset(asset)
                    .price(price)
                    .sampledAt(now)
                    .build());
        });
        exchange.markConnected();
        return true;
    }
}
