package com.fastbatch.core.perf;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public final class BenchmarkResult {

    private final String name;
    /** 可为 null */
    private final PerformanceMetrics baseline;
    private final PerformanceMetrics optimized;
    /** 倍数, 如 2.5 */
    private final double speedup;
    /** 百分比 */
    private final double throughputIncrease;
    /** 百分比 */
    private final double durationReduction;
}
