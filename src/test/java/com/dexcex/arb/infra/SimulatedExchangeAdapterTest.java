package com.dexcex.arb.infra;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.domain.Exchange;
import com.dexcex.arb.domain.TradeResult;
import com.dexcex.arb.domain.TradeSide;
import com.dexcex.arb.domain.VenueKind;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedExchangeAdapterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void sameSeedReplaysSamePrices() {
        SimulatedExchangeAdapter first = adapter(0.0, 1.0, 7L);
        SimulatedExchangeAdapter second = adapter(0.0, 1.0, 7L);
        List<String> assets = List.of("BTC", "ETH", "SOL");

        for (int i = 0; i < 5; i++) {
            assertEquals(first.getPrices(assets), second.getPrices(assets));
        }
    }

    @Test
    void pricesStayNearReference() {
        SimulatedExchangeAdapter adapter = adapter(0.0, 1.0, 42L);

        for (int i = 0; i < 50; i++) {
            Map<String, BigDecimal> prices = adapter.getPrices(SimulatedExchangeAdapter.REFERENCE_PRICES.keySet());
            prices.forEach((asset, price) -> {
                BigDecimal reference = SimulatedExchangeAdapter.REFERENCE_PRICES.get(asset);
                BigDecimal deviation = price.subtract(reference).abs().divide(reference, 8, RoundingMode.HALF_UP);
                assertTrue(deviation.compareTo(new BigDecimal("0.0026")) <= 0, asset + " drifted to " + price);
            });
        }
    }

    @Test
    void unknownAssetIsNotQuoted() {
        Map<String, BigDecimal> prices = adapter(0.0, 1.0, 42L).getPrices(List.of("ETH", "DOGE"));

        assertTrue(prices.containsKey("ETH"));
        assertFalse(prices.containsKey("DOGE"));
    }

    @Test
    void smallBuyFillsWithSlippageAndFee() {
        TradeResult result = adapter(0.0, 1.0, 42L).executeTrade("ETH", BigDecimal.ONE, TradeSide.BUY);

        assertTrue(result.isSuccess());
        // 3245.89 * 1.0005
        assertClose("3247.512945", result.getPrice());
        assertClose("3.24751295", result.getFee());
        assertTrue(result.getTxId().startsWith("tx-"));
    }

    @Test
    void sellFillsBelowReference() {
        TradeResult result = adapter(0.0, 1.0, 42L).executeTrade("ETH", new BigDecimal("20"), TradeSide.SELL);

        assertTrue(result.isSuccess());
        // large order: 0.2% slippage
        assertClose("3239.39822", result.getPrice());
    }

    @Test
    void zeroSuccessRateAlwaysFails() {
        SimulatedExchangeAdapter adapter = adapter(0.0, 0.0, 42L);

        for (int i = 0; i < 10; i++) {
            TradeResult result = adapter.executeTrade("BTC", BigDecimal.ONE, TradeSide.BUY);
            assertFalse(result.isSuccess());
            assertNotNull(result.getError());
        }
    }

    @Test
    void unlistedAssetFails() {
        TradeResult result = adapter(0.0, 1.0, 42L).executeTrade("DOGE", BigDecimal.ONE, TradeSide.BUY);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("DOGE"));
    }

    private static void assertClose(String expected, BigDecimal actual) {
        assertTrue(new BigDecimal(expected).subtract(actual).abs().compareTo(new BigDecimal("0.000001")) < 0,
                "expected " + expected + " but was " + actual);
    }

    private static SimulatedExchangeAdapter adapter(double bias, double successRate, long seed) {
        ArbitrageProperties.Simulation simulation = new ArbitrageProperties.Simulation();
        simulation.setMinLatency(Duration.ZERO);
        simulation.setMaxLatency(Duration.ZERO);
        simulation.setSuccessRate(successRate);
        Exchange exchange = Exchange.builder().name("SimX").kind(VenueKind.CEX).build();
        return new SimulatedExchangeAdapter(exchange, new BigDecimal("0.001"), bias, simulation, new Random(seed),
                CLOCK);
    }
}
