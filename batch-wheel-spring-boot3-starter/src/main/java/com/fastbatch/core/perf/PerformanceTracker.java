package com.fastbatch.core.perf;

import com.fastbatch.core.time.TimeSource;
import com.fastbatch.model.TaskAttempt;
import com.fastbatch.model.enums.AttemptOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 任务耗时与结果采样, 按需计算吞吐/成功率/重试率/分位数
 * 写入加锁, 读取不修改样本
 */
public class PerformanceTracker {

    private final TimeSource time;

    private final List<Long> durations = new ArrayList<>();

    private final List<BenchmarkResult> benchmarkHistory = new ArrayList<>();

    private int errors;

    private long retries;

    private long attempts;

    private long timeouts;

    /** 各批次登记的任务数之和, 跨批次复用时作为比率分母 */
    private int expectedTotal;

    /** -1 表示未开始 */
    private long startedAt = -1;

    public PerformanceTracker() {
        this(TimeSource.SYSTEM);
    }

    public PerformanceTracker(TimeSource time) {
        this.time = time;
    }

    /**
     * 记录开始时间, 已开始则忽略（复用跨批次时保留历史）
     */
    public synchronized void start() {
        if (startedAt < 0) {
            startedAt = time.nowMillis();
        }
    }

    /**
     * 清空样本并重新计时
     */
    public synchronized void reset() {
        durations.clear();
        errors = 0;
        retries = 0;
        attempts = 0;
        timeouts = 0;
        expectedTotal = 0;
        startedAt = time.nowMillis();
    }

    /**
     * 登记一个批次的任务数, 返回累计值
     */
    public synchronized int expect(int taskCount) {
        if (taskCount < 0) {
            throw new IllegalArgumentException("taskCount must be >= 0");
        }
        expectedTotal += taskCount;
        return expectedTotal;
    }

    public synchronized int getExpectedTotal() {
        return expectedTotal;
    }

    /**
     * 以累计登记数为分母
     */
    public PerformanceMetrics getMetrics(int concurrency) {
        return getMetrics(getExpectedTotal(), concurrency);
    }

    public synchronized void recordTask(long durationMs, int retriesUsed, boolean failed) {
        durations.add(Math.max(0, durationMs));
        retries += retriesUsed;
        if (failed) {
            errors++;
        }
    }

    public synchronized void recordAttempt(TaskAttempt attempt) {
        attempts++;
        if (attempt.getOutcome() == AttemptOutcome.TIMEOUT) {
            timeouts++;
        }
    }

    public PerformanceMetrics getMetrics(int totalExpected, int concurrency) {
        long[] sorted;
        int errs;
        long rts, atts, tos, started;
        synchronized (this) {
            sorted = durations.stream().mapToLong(Long::longValue).toArray();
            errs = errors;
            rts = retries;
            atts = attempts;
            tos = timeouts;
            started = startedAt;
        }
        Arrays.sort(sorted);

        long totalDuration = started < 0 ? 0 : Math.max(0, time.nowMillis() - started);
        int completed = sorted.length;
        // 样本多于分母时（复用未登记）按样本数算, 比率不超过1
        int denominator = Math.max(totalExpected, completed);
        double average = completed > 0 ? (double) Arrays.stream(sorted).sum() / completed : 0;

        return PerformanceMetrics.builder()
                .timestamp(Instant.now())
                .batchSize(totalExpected)
                .concurrency(concurrency)
                .totalDurationMs(totalDuration)
                .averageDurationMs(average)
                .throughputPerSec(totalDuration > 0 ? completed / (totalDuration / 1000.0) : 0)
                .successRate(denominator > 0 ? (double) (completed - errs) / denominator : 0)
                .errorRate(denominator > 0 ? (double) errs / denominator : 0)
                .retryRate(completed > 0 ? (double) rts / completed : 0)
                .p50(percentile(sorted, 50))
                .p95(percentile(sorted, 95))
                .p99(percentile(sorted, 99))
                .attempts(atts)
                .timeouts(tos)
                .build();
    }

    /**
     * 最近秩分位数, sorted 须升序
     */
    public static long percentile(long[] sorted, double percentile) {
        if (sorted.length == 0) {
            return 0;
        }
        int index = (int) Math.ceil((percentile / 100.0) * sorted.length) - 1;
        return sorted[Math.min(sorted.length - 1, Math.max(0, index))];
    }

    /**
     * 与基线对比, 结果保留在历史中
     */
    public synchronized BenchmarkResult createBenchmark(String name, PerformanceMetrics optimized,
                                                        PerformanceMetrics baseline) {
        double speedup = 1, throughputIncrease = 0, durationReduction = 0;
        if (baseline != null) {
            speedup = ratio(baseline.getAverageDurationMs(), optimized.getAverageDurationMs(), 1);
            throughputIncrease = baseline.getThroughputPerSec() > 0
                    ? (optimized.getThroughputPerSec() - baseline.getThroughputPerSec()) / baseline.getThroughputPerSec() * 100
                    : 0;
            durationReduction = baseline.getTotalDurationMs() > 0
                    ? (double) (baseline.getTotalDurationMs() - optimized.getTotalDurationMs()) / baseline.getTotalDurationMs() * 100
                    : 0;
        }
        BenchmarkResult result = new BenchmarkResult(name, baseline, optimized, speedup, throughputIncrease, durationReduction);
        benchmarkHistory.add(result);
        return result;
    }

    public synchronized List<BenchmarkResult> getBenchmarkHistory() {
        return List.copyOf(benchmarkHistory);
    }

    /**
     * 文本报表
     */
    public String generateReport(PerformanceMetrics m) {
        String rule = "=".repeat(80);
        List<String> lines = new ArrayList<>();
        lines.add(rule);
        lines.add("PERFORMANCE REPORT");
        lines.add(rule);
        lines.add("");
        lines.add(String.format("Batch Size:       %d", m.getBatchSize()));
        lines.add(String.format("Concurrency:      %d", m.getConcurrency()));
        lines.add("");
        lines.add("Duration Metrics:");
        lines.add(String.format("  Total:          %.2fs", m.getTotalDurationMs() / 1000.0));
        lines.add(String.format("  Average/Task:   %.0fms", m.getAverageDurationMs()));
        lines.add(String.format("  P50 (median):   %dms", m.getP50()));
        lines.add(String.format("  P95:            %dms", m.getP95()));
        lines.add(String.format("  P99:            %dms", m.getP99()));
        lines.add("");
        lines.add("Throughput:");
        lines.add(String.format("  Tasks/second:   %.2f", m.getThroughputPerSec()));
        lines.add("");
        lines.add("Quality Metrics:");
        lines.add(String.format("  Success Rate:   %.1f%%", m.getSuccessRate() * 100));
        lines.add(String.format("  Error Rate:     %.1f%%", m.getErrorRate() * 100));
        lines.add(String.format("  Avg Retries:    %.2f", m.getRetryRate()));
        lines.add(String.format("  Timeouts:       %d/%d attempts", m.getTimeouts(), m.getAttempts()));
        lines.add("");
        List<BenchmarkResult> history = getBenchmarkHistory();
        if (!history.isEmpty()) {
            lines.add("Benchmark Comparisons:");
            for (BenchmarkResult b : history) {
                lines.add(String.format("  %s:", b.getName()));
                lines.add(String.format("    Speedup:      %.2fx", b.getSpeedup()));
                lines.add(String.format("    Throughput:   %+.1f%%", b.getThroughputIncrease()));
                lines.add(String.format("    Duration:     -%.1f%%", b.getDurationReduction()));
            }
            lines.add("");
        }
        lines.add(rule);
        return String.join("\n", lines);
    }

    private static double ratio(double a, double b, double fallback) {
        return b > 0 ? a / b : fallback;
    }
}
