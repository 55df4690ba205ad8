package com.dexcex.arb.core;

import com.dexcex.arb.domain.Exchange;
import com.dexcex.arb.domain.TradeResult;
import com.dexcex.arb.domain.TradeSide;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

/**
 * Price oracle and trade venue for a single exchange.
 * <p>
 * {@link #getPrices} may throw; callers isolate the failure to this exchange.
 * {@link #executeTrade} reports failures through {@link TradeResult#isSuccess()}
 * and may block for hundreds of milliseconds or more.
 */
public interface ExchangeAdapter {

    Exchange exchange();

    /**
     * @return positive prices keyed by asset; assets the venue does not list are omitted
     */
    Map<String, BigDecimal> getPrices(Collection<String> assets);

    TradeResult executeTrade(String asset, BigDecimal amount, TradeSide side);
}
