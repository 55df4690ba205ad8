package com.dexcex.arb.infra;

import com.dexcex.arb.config.ArbitrageProperties;
import com.dexcex.arb.core.ExchangeAdapter;
import com.dexcex.arb.domain.Exchange;
import com.dexcex.arb.domain.TradeResult;
import com.dexcex.arb.domain.TradeSide;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Reads live prices from a public REST ticker. Trades are paper fills at the
 * freshly fetched quote; no order ever reaches the venue.
 */
@Slf4j
public class HttpTickerExchangeAdapter implements ExchangeAdapter {

    private final Exchange exchange;
    private final ArbitrageProperties.ExchangeProperties config;
    private final ExchangeApiClient apiClient;
    private final BigDecimal feeRate;
    private final Clock clock;

    public HttpTickerExchangeAdapter(Exchange exchange, ArbitrageProperties.ExchangeProperties config,
            ExchangeApiClient apiClient, BigDecimal feeRate, Clock clock) {
        this.exchange = exchange;
        this.config = config;
        this.apiClient = apiClient;
        this.feeRate = feeRate;
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
            BigDecimal price = fetchQuote(asset);
            if (price != null) {
                prices.put(asset, price);
            }
        }
        return prices;
    }

    @Override
    public TradeResult executeTrade(String asset, BigDecimal amount, TradeSide side) {
        BigDecimal quote;
        try {
            quote = fetchQuote(asset);
        } catch (ExchangeApiClient.ExchangeApiException e) {
            return TradeResult.failed(asset, side, e.getMessage(), clock.instant());
        }
        if (quote == null) {
            return TradeResult.failed(asset, side, "No quote for " + asset + " on " + exchange.getName(),
                    clock.instant());
        }

        log.info("[PAPER] {} {} {} on {} @ {}", side, amount, asset, exchange.getName(), quote);
        return TradeResult.builder()
                .success(true)
                .txId("paper-" + UUID.randomUUID())
                .asset(asset)
                .side(side)
                .amount(amount)
                .price(quote)
                .fee(amount.multiply(quote).multiply(feeRate).setScale(8, RoundingMode.HALF_UP))
                .timestamp(clock.instant())
                .build();
    }

    private BigDecimal fetchQuote(String asset) {
        String symbol = asset + config.getQuoteCurrency();
        String url = exchange.getApiUrl() + config.getTickerPath().replace("{symbol}", symbol);

        JsonNode priceNode = apiClient.getJson(url).at(config.getPricePointer());
        if (priceNode.isMissingNode() || priceNode.isNull()) {
            log.debug("{} returned no price for {}", exchange.getName(), symbol);
            return null;
        }
        try {
            BigDecimal price = new BigDecimal(priceNode.asText());
            return price.signum() > 0 ? price : null;
        } catch (NumberFormatException e) {
            log.warn("{} returned unparseable price '{}' for {}", exchange.getName(), priceNode.asText(), symbol);
            return null;
        }
    }
}
