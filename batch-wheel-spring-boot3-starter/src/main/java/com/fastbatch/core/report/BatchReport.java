package com.fastbatch.core.report;

import com.fastbatch.core.cost.CostLedger;
import com.fastbatch.core.perf.PerformanceMetrics;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * 批次结束时的汇总
 */
@Getter
@ToString
@AllArgsConstructor
@JsonPropertyOrder({"totalDurationMs", "throughputPerSec", "successRate", "retryRate",
        "p50", "p95", "p99", "cumulativeCost"})
public final class BatchReport {

    private final long totalDurationMs;
    private final double throughputPerSec;
    private final double successRate;
    private final double retryRate;
    private final long p50;
    private final long p95;
    private final long p99;
    private final BigDecimal cumulativeCost;

    public static BatchReport of(PerformanceMetrics m, CostLedger ledger) {
        return new BatchReport(m.getTotalDurationMs(), m.getThroughputPerSec(), m.getSuccessRate(),
                m.getRetryRate(), m.getP50(), m.getP95(), m.getP99(), ledger.getCumulativeCost());
    }

    @JsonIgnore
    public double getCumulativeCostAsDouble() {
        return cumulativeCost.doubleValue();
    }
}
