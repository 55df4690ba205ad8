package com.dexcex.arb.domain;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class PerformanceMetrics {
    private int totalExecutions;
    private int successfulExecutions;
    private int failedExecutions;
    private BigDecimal successRate; // percent, 0-100
    private BigDecimal totalProfit;
    private BigDecimal averageProfit;
    private long averageExecutionTimeMs;
    private Map<String, BigDecimal> profitByAsset;
    private BigDecimal profitExpectationAccuracy; // percent
    private List<ExecutionSummary> recentExecutions;

    private int monitoredExchanges;
    private List<String> monitoredAssets;
    private int activeRoutes;
}
