package com.dexcex.arb.core;

import com.dexcex.arb.MutableClock;
import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.Exchange;
import com.dexcex.arb.domain.PriceSample;
import com.dexcex.arb.domain.VenueKind;
import com.dexcex.arb.infra.ExchangeRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PriceSamplerTest {

    private static final Instant START = Instant.parse("2024-05-01T12:00:00Z");

    private ArbitrageProperties properties;
    private PriceCache cache;
    private MutableClock clock;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        properties = new ArbitrageProperties();
        properties.setAssets(List.of("ETH", "BTC"));
        cache = new PriceCache();
        clock = new MutableClock(START);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void writesEveryPositivePrice() {
        ExchangeAdapter binance = adapter("Binance", VenueKind.CEX);
        when(binance.getPrices(any())).thenReturn(Map.of("ETH", new BigDecimal("3245.10"),
                "BTC", new BigDecimal("65800")));

        int sampled = sampler(binance).sampleAll();

        assertEquals(1, sampled);
        PriceSample eth = cache.get("Binance", "ETH").orElseThrow();
        assertEquals(0, new BigDecimal("3245.10").compareTo(eth.getPrice()));
        assertEquals(VenueKind.CEX, eth.getVenueKind());
        assertEquals(START, eth.getSampledAt());
        assertEquals(Exchange.ConnectionStatus.CONNECTED, binance.exchange().getConnectionStatus());
    }

    @Test
    void nonPositivePricesAreDropped() {
        ExchangeAdapter curve = adapter("Curve", VenueKind.DEX);
        Map<String, BigDecimal> prices = new HashMap<>();
        prices.put("ETH", BigDecimal.ZERO);
        prices.put("BTC", new BigDecimal("-1"));
        when(curve.getPrices(any())).thenReturn(prices);

        sampler(curve).sampleAll();

        assertTrue(cache.getAll().isEmpty());
    }

    @Test
    void failingExchangeDoesNotAffectOthers() {
        ExchangeAdapter healthy = adapter("Kraken", VenueKind.CEX);
        ExchangeAdapter broken = adapter("Jupiter", VenueKind.DEX);
        when(healthy.getPrices(any())).thenReturn(Map.of("ETH", new BigDecimal("3240")));
        when(broken.getPrices(any()))
                .thenReturn(Map.of("ETH", new BigDecimal("3230")))
                .thenThrow(new IllegalStateException("503 from upstream"));
        PriceSampler sampler = sampler(healthy, broken);

        assertEquals(2, sampler.sampleAll());
        clock.advance(Duration.ofSeconds(5));
        assertEquals(1, sampler.sampleAll());

        assertEquals(Exchange.ConnectionStatus.ERROR, broken.exchange().getConnectionStatus());
        assertEquals(Exchange.ConnectionStatus.CONNECTED, healthy.exchange().getConnectionStatus());
        // the last good sample stays, with its original timestamp
        assertEquals(START, cache.get("Jupiter", "ETH").orElseThrow().getSampledAt());
        assertEquals(START.plusSeconds(5), cache.get("Kraken", "ETH").orElseThrow().getSampledAt());
    }

    @Test
    void slowExchangeTimesOut() {
        properties.getMonitoring().setSamplingTimeout(Duration.ofMillis(100));
        CountDownLatch never = new CountDownLatch(1);
        ExchangeAdapter slow = adapter("Bybit", VenueKind.CEX);
        ExchangeAdapter fast = adapter("OKX", VenueKind.CEX);
        when(slow.getPrices(any())).thenAnswer(invocation -> {
            never.await();
            return Map.of();
        });
        when(fast.getPrices(any())).thenReturn(Map.of("ETH", new BigDecimal("3241")));

        int sampled = sampler(slow, fast).sampleAll();

        assertEquals(1, sampled);
        assertEquals(Exchange.ConnectionStatus.ERROR, slow.exchange().getConnectionStatus());
        assertTrue(cache.get("OKX", "ETH").isPresent());
        assertTrue(cache.get("Bybit", "ETH").isEmpty());
    }

    private PriceSampler sampler(ExchangeAdapter... adapters) {
        return new PriceSampler(new ExchangeRegistry(List.of(adapters)), cache, properties, executor, clock);
    }

    private static ExchangeAdapter adapter(String name, VenueKind kind) {
        ExchangeAdapter adapter = mock(ExchangeAdapter.class);
        when(adapter.exchange()).thenReturn(Exchange.builder().name(name).kind(kind).build());
        return adapter;
    }
}
