package com.dexcex.arb.infra;

import com.dexcex.arb.core.OpportunityStore;
import com.dexcex.arb.domain.ArbitrageOpportunity;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

@Component
public class InMemoryOpportunityStore implements OpportunityStore {

    private final ConcurrentHashMap<Long, ArbitrageOpportunity> opportunities = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(1);

    @Override
    public Optional<ArbitrageOpportunity> getOpportunity(long id) {
        return Optional.ofNullable(opportunities.get(id)).map(this::copy);
    }

    @Override
    public List<ArbitrageOpportunity> listOpportunities() {
        return opportunities.values().stream()
                .sorted(Comparator.comparingLong(ArbitrageOpportunity::getId).reversed())
                .map(this::copy)
                .toList();
    }

    @Override
    public ArbitrageOpportunity createOpportunity(ArbitrageOpportunity data) {
        long id = sequence.getAndIncrement();
        ArbitrageOpportunity stored = data.toBuilder().id(id).build();
        opportunities.put(id, stored);
        return copy(stored);
    }

    @Override
    public Optional<ArbitrageOpportunity> updateOpportunity(long id, UnaryOperator<ArbitrageOpportunity> patch) {
        ArbitrageOpportunity updated = opportunities.computeIfPresent(id,
                (key, existing) -> patch.apply(copy(existing)).toBuilder().id(key).build());
        return Optional.ofNullable(updated).map(this::copy);
    }

    @Override
    public boolean compareAndSetStatus(long id, ArbitrageOpportunity.Status expected,
            ArbitrageOpportunity.Status next) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        opportunities.computeIfPresent(id, (key, existing) -> {
            if (existing.getStatus() != expected) {
                return existing;
            }
            swapped.set(true);
            return existing.toBuilder().status(next).build();
        });
        return swapped.get();
    }

    // Callers never hold a reference to the stored instance
    private ArbitrageOpportunity copy(ArbitrageOpportunity opp) {
        return opp.toBuilder().build();
    }
}
