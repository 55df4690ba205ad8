package com.dexcex.arb.infra;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.core.ExchangeAdapter;
import com.dexcex.arb.domain.Exchange;
import com.dexcex.arb.domain.TradeResult;
import com.dexcex.arb.domain.TradeSide;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Stand-in venue that quotes around fixed reference prices. Every random draw
 * comes from the injected {@link Random}, so a seeded instance replays the same
 * sequence for the same call order.
 */
@Slf4j
public class SimulatedExchangeAdapter implements ExchangeAdapter {

    static final Map<String, BigDecimal> REFERENCE_PRICES = Map.of(
            "BTC", new BigDecimal("65842.50"),
            "ETH", new BigDecimal("3245.89"),
            "SOL", new BigDecimal("103.47"),
            "MATIC", new BigDecimal("0.87"),
            "AVAX", new BigDecimal("34.25"),
            "BNB", new BigDecimal("603.12"),
            "ARB", new BigDecimal("1.23"));

    private static final double MAX_JITTER = 0.0025;
    private static final BigDecimal LARGE_ORDER = BigDecimal.TEN;
    private static final double LARGE_ORDER_SLIPPAGE = 0.002;
    private static final double SMALL_ORDER_SLIPPAGE = 0.0005;

    private final Exchange exchange;
    private final BigDecimal feeRate;
    private final double priceBias;
    private final ArbitrageProperties.Simulation simulation;
    private final Random random;
    private final Clock clock;

    public SimulatedExchangeAdapter(Exchange exchange, BigDecimal feeRate, double priceBias,
            ArbitrageProperties.Simulation simulation, Random random, Clock clock) {
        this.exchange = exchange;
        this.feeRate = feeRate;
        this.priceBias = priceBias;
        this.simulation = simulation;
        this.random = random;
        this.clock = clock;
    }

    @Override
    public Exchange exchange() {
        return exchange;
    }

    @Override
    public Map<String, BigDecimal> getPrices(Collection<String> assets) {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        for (String asset : assets) {
            BigDecimal reference = REFERENCE_PRICES.get(asset);
            if (reference == null) {
                continue;
            }
            double jitter = (random.nextDouble() * 2 - 1) * MAX_JITTER;
            prices.put(asset, scale(reference, (1 + jitter) * (1 + priceBias)));
        }
        return prices;
    }

    @Override
    public TradeResult executeTrade(String asset, BigDecimal amount, TradeSide side) {
        try {
            Thread.sleep(nextLatencyMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TradeResult.failed(asset, side, "Interrupted before fill", clock.instant());
        }

        BigDecimal reference = REFERENCE_PRICES.get(asset);
        if (reference == null) {
            return TradeResult.failed(asset, side, asset + " is not listed on " + exchange.getName(), clock.instant());
        }

        if (random.nextDouble() >= simulation.getSuccessRate()) {
            log.debug("[SIMULATION] {} {} {} on {} rejected", side, amount, asset, exchange.getName());
            return TradeResult.failed(asset, side, "Simulated trade execution failure due to market conditions",
                    clock.instant());
        }

        double slippage = amount.compareTo(LARGE_ORDER) > 0 ? LARGE_ORDER_SLIPPAGE : SMALL_ORDER_SLIPPAGE;
        double direction = side == TradeSide.BUY ? 1 + slippage : 1 - slippage;
        BigDecimal price = scale(reference, (1 + priceBias) * direction);
        BigDecimal fee = amount.multiply(price).multiply(feeRate).setScale(8, RoundingMode.HALF_UP);

        return TradeResult.builder()
                .success(true)
                .txId("tx-" + clock.millis() + "-" + Long.toHexString(random.nextLong() & Long.MAX_VALUE))
                .asset(asset)
                .side(side)
                .amount(amount)
                .price(price)
                .fee(fee)
                .timestamp(clock.instant())
                .build();
    }

    private long nextLatencyMillis() {
        long min = simulation.getMinLatency().toMillis();
        long max = simulation.getMaxLatency().toMillis();
        if (max <= min) {
            return min;
        }
        return min + (long) (random.nextDouble() * (max - min));
    }

    private static BigDecimal scale(BigDecimal value, double factor) {
        return value.multiply(BigDecimal.valueOf(factor)).setScale(8, RoundingMode.HALF_UP);
    }
}
