package com.dexcex.arb.core;

import com.dexcex.arb.domain.ArbitrageOpportunity;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence collaborator for opportunities. Implementations must apply
 * {@link #updateOpportunity} and {@link #compareAndSetStatus} atomically per id.
 */
public interface OpportunityStore {

    Optional<ArbitrageOpportunity> getOpportunity(long id);

    List<ArbitrageOpportunity> listOpportunities();

    /**
     * Stores a new opportunity; the id on {@code data} is ignored and a fresh one assigned.
     */
    ArbitrageOpportunity createOpportunity(ArbitrageOpportunity data);

    Optional<ArbitrageOpportunity> updateOpportunity(long id, UnaryOperator<ArbitrageOpportunity> patch);

    boolean compareAndSetStatus(long id, ArbitrageOpportunity.Status expected, ArbitrageOpportunity.Status next);
}
