package com.dexcex.arb.config;

import com.dexcex.arb.domain.VenueKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "arbitrage")
public class ArbitrageProperties {

    private List<String> assets = new ArrayList<>(List.of("BTC", "ETH", "SOL", "MATIC", "AVAX", "BNB", "ARB"));
    private List<ExchangeProperties> exchanges = new ArrayList<>();

    private VenueRates fees = new VenueRates(new BigDecimal("0.003"), new BigDecimal("0.001"));
    private VenueRates gasCost = new VenueRates(new BigDecimal("15"), BigDecimal.ZERO);

    private BigDecimal minProfitPercentage = new BigDecimal("0.25");
    private BigDecimal profitTolerance = new BigDecimal("0.1"); // percentage points
    private BigDecimal tradeAmount = BigDecimal.ONE;

    private int maxConcurrentExecutions = 3;
    private Duration maxExecutionTime = Duration.ofSeconds(10);
    private Duration routeTtl = Duration.ofMinutes(5);
    private Duration priceStaleness; // null -> 2 x monitoring interval
    private int recentExecutions = 5;

    private Monitoring monitoring = new Monitoring();
    private Simulation simulation = new Simulation();

    public Duration effectivePriceStaleness() {
        return priceStaleness != null ? priceStaleness : monitoring.getInterval().multipliedBy(2);
    }

    @Data
    public static class ExchangeProperties {
        private String name;
        private VenueKind kind = VenueKind.CEX;
        private String apiUrl;
        private AdapterType adapter = AdapterType.SIMULATED;
        private double priceBias;

        // HTTP adapter only
        private String tickerPath = "/ticker/price?symbol={symbol}";
        private String pricePointer = "/price";
        private String quoteCurrency = "USDT";
    }

    @Data
    public static class VenueRates {
        private BigDecimal dex;
        private BigDecimal cex;

        public VenueRates() {
        }

        public VenueRates(BigDecimal dex, BigDecimal cex) {
            this.dex = dex;
            this.cex = cex;
        }

        public BigDecimal forKind(VenueKind kind) {
            return kind == VenueKind.DEX ? dex : cex;
        }
    }

    @Data
    public static class Monitoring {
        private Duration interval = Duration.ofSeconds(5);
        private Duration samplingTimeout = Duration.ofSeconds(3);
        private boolean autoStart = true;
    }

    @Data
    public static class Simulation {
        private long seed = 42L;
        private Duration minLatency = Duration.ofMillis(500);
        private Duration maxLatency = Duration.ofMillis(1500);
        private double successRate = 0.98;
    }

    public enum AdapterType {
        SIMULATED,
        HTTP // quote-only public ticker, paper fills
    }
}
