package com.dexcex.arb.core;

import com.dexcex.arb.domain.ExecutionSummary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only log of execution attempts, oldest first.
 */
@Component
public class ExecutionHistory {

    private final CopyOnWriteArrayList<ExecutionSummary> summaries = new CopyOnWriteArrayList<>();

    public void append(ExecutionSummary summary) {
        summaries.add(summary);
    }

    public List<ExecutionSummary> snapshot() {
        return List.copyOf(summaries);
    }

    public int size() {
        return summaries.size();
    }
}
