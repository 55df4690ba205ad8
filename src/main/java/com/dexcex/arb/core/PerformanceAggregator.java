package com.dexcex.arb.core;

import com.dexcex.arb.domain.ExecutionSummary;
import com.dexcex.arb.domain.PerformanceMetrics;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-side statistics over the execution history. Profit figures count successful
 * executions only; an empty history yields all-zero metrics.
 */
@Component
public class PerformanceAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public PerformanceMetrics aggregate(List<ExecutionSummary> history, int recentWindow) {
        int total = history.size();
        List<ExecutionSummary> successful = history.stream().filter(ExecutionSummary::isSuccess).toList();
        int succeeded = successful.size();

        BigDecimal totalProfit = successful.stream()
                .map(ExecutionSummary::getNetProfit)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        Map<String, BigDecimal> profitByAsset = new TreeMap<>();
        for (ExecutionSummary summary : successful) {
            profitByAsset.merge(summary.getAsset(), summary.getNetProfit(), BigDecimal::add);
        }

        long averageMs = total == 0 ? 0
                : Math.round(history.stream().mapToLong(ExecutionSummary::getExecutionTimeMs).average().orElse(0));

        List<ExecutionSummary> recent = history.subList(Math.max(0, total - Math.max(0, recentWindow)), total);

        return PerformanceMetrics.builder()
                .totalExecutions(total)
                .successfulExecutions(succeeded)
                .failedExecutions(total - succeeded)
                .successRate(ratio(BigDecimal.valueOf(succeeded).multiply(HUNDRED), total))
                .totalProfit(totalProfit.setScale(2, RoundingMode.HALF_UP))
                .averageProfit(ratio(totalProfit, succeeded))
                .averageExecutionTimeMs(averageMs)
                .profitByAsset(profitByAsset)
                .profitExpectationAccuracy(expectationAccuracy(successful))
                .recentExecutions(List.copyOf(recent))
                .build();
    }

    /**
     * 100 minus the mean absolute percentage by which actual profit missed the
     * expected profit.
     */
    private BigDecimal expectationAccuracy(List<ExecutionSummary> successful) {
        List<BigDecimal> deviations = successful.stream()
                .filter(s -> s.getExpectedProfit() != null && s.getExpectedProfit().signum() != 0)
                .map(s -> s.getProfitDifference().multiply(HUNDRED)
                        .divide(s.getExpectedProfit(), 8, RoundingMode.HALF_UP))
                .toList();
        if (deviations.isEmpty()) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal mean = deviations.stream().reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(BigDecimal.valueOf(deviations.size()), 8, RoundingMode.HALF_UP);
        return HUNDRED.subtract(mean.abs()).setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal ratio(BigDecimal numerator, int denominator) {
        if (denominator == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return numerator.divide(BigDecimal.valueOf(denominator), 2, RoundingMode.HALF_UP);
    }
}
