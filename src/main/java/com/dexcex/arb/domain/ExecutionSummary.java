package com.dexcex.arb.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Record of one execution attempt, successful or not. Written once by the
 * execution engine and only read afterwards.
 */
@Data
@Builder
public class ExecutionSummary {
    private String routeId;
    private long opportunityId;
    private String asset;
    private boolean success;
    private Instant startTime;
    private Instant endTime;
    private List<LegExecution> legs;

    private BigDecimal expectedProfit;
    private BigDecimal actualProfit;
    private BigDecimal actualProfitPercentage;
    private BigDecimal profitDifference;
    private BigDecimal gasCost;
    private BigDecimal netProfit;
    private long executionTimeMs;

    private FailureReason failureReason;
    private String failureMessage;

    @Data
    @Builder
    public static class LegExecution {
        private String exchange;
        private TradeSide side;
        private BigDecimal expectedPrice;
        private BigDecimal actualPrice;
        private BigDecimal amount;
        private BigDecimal fee;
        private boolean success;
        private String txId;
        private String error;
    }
}
