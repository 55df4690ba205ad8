package com.dexcex.arb.infra;

import com.dexcex.arb.core.ExchangeAdapter;
import com.dexcex.arb.domain.Exchange;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adapters by exchange name, in registration order. Fixed after construction.
 */
public class ExchangeRegistry {

    private final Map<String, ExchangeAdapter> adapters = new LinkedHashMap<>();

    public ExchangeRegistry(List<? extends ExchangeAdapter> adapters) {
        for (ExchangeAdapter adapter : adapters) {
            String name = adapter.exchange().getName();
            if (this.adapters.putIfAbsent(name, adapter) != null) {
                throw new IllegalArgumentException("Duplicate exchange: " + name);
            }
        }
    }

    public Collection<ExchangeAdapter> adapters() {
        return adapters.values();
    }

    public Optional<ExchangeAdapter> find(String exchangeName) {
        return Optional.ofNullable(adapters.get(exchangeName));
    }

    public Optional<Exchange> exchange(String exchangeName) {
        return find(exchangeName).map(ExchangeAdapter::exchange);
    }

    public int size() {
        return adapters.size();
    }
}
