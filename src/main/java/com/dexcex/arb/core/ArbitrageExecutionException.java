package com.dexcex.arb.core;

import com.dexcex.arb.domain.ExecutionSummary;
import com.dexcex.arb.domain.FailureReason;
import lombok.Getter;

/**
 * Typed failure of {@link ExecutionEngine#execute(long)}. Leg failures carry the
 * summary that was recorded for the attempt.
 */
@Getter
public class ArbitrageExecutionException extends RuntimeException {

    private final FailureReason reason;
    private final long opportunityId;
    private final transient ExecutionSummary summary;

    public ArbitrageExecutionException(FailureReason reason, long opportunityId, String message) {
        this(reason, opportunityId, message, null);
    }

    public ArbitrageExecutionException(FailureReason reason, long opportunityId, String message,
            ExecutionSummary summary) {
        super(message);
        this.reason = reason;
        this.opportunityId = opportunityId;
        this.summary = summary;
    }
}
