package com.dexcex.arb.core;

import com.dexcex.arb.domain.PriceSample;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest sample per (exchange, asset). Entries are overwritten, never expired;
 * readers decide what is too old.
 */
@Component
public class PriceCache {

    private final ConcurrentHashMap<Key, PriceSample> cache = new ConcurrentHashMap<>();

    public void update(PriceSample sample) {
        cache.put(new Key(sample.getExchange(), sample.getAsset()), sample);
    }

    public Optional<PriceSample> get(String exchange, String asset) {
        return Optional.ofNullable(cache.get(new Key(exchange, asset)));
    }

    public List<PriceSample> getByAsset(String asset) {
        return cache.values().stream()
                .filter(s -> asset.equals(s.getAsset()))
                .toList();
    }

    public Collection<PriceSample> getAll() {
        return cache.values();
    }

    public void clear() {
        cache.clear();
    }

    private record Key(String exchange, String asset) {
    }
}
