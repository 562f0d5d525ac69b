package com.fastbatch.core.cost;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 成本台账: 每个完成的任务追加一条, 累计值恒等于条目之和
 */
public class CostLedger {

    private static final Logger log = LoggerFactory.getLogger(CostLedger.class);

    public static final long DEFAULT_AUXILIARY_UNITS_PER_TASK = 1600;

    private static final long TIPS_TOTAL_UNITS_THRESHOLD = 100_000;

    private final UnitPriceTable priceTable;

    private final long auxiliaryUnitsPerTask;

    private final List<CostLedgerEntry> entries = new ArrayList<>();

    public CostLedger() {
        this(new PriceTableRegistry().resolve(PriceTableRegistry.STANDARD), DEFAULT_AUXILIARY_UNITS_PER_TASK);
    }

    public CostLedger(UnitPriceTable priceTable, long auxiliaryUnitsPerTask) {
        this.priceTable = priceTable;
        this.auxiliaryUnitsPerTask = Math.max(0, auxiliaryUnitsPerTask);
    }

    public CostLedgerEntry trackUsage(UnitUsage usage) {
        CostLedgerEntry entry = new CostLedgerEntry(usage, priceTable.price(usage));
        synchronized (this) {
            entries.add(entry);
        }
        return entry;
    }

    /**
     * 预估整批成本, 每任务按 avgInputUnits / avgOutputUnits 加固定附加单位计
     */
    public CostBreakdown estimateBatchCost(int count, long avgInputUnits, long avgOutputUnits) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        UnitUsage single = UnitUsage.of(avgInputUnits, avgOutputUnits, auxiliaryUnitsPerTask);
        return priceTable.price(single).times(count);
    }

    public synchronized BigDecimal getCumulativeCost() {
        BigDecimal sum = BigDecimal.ZERO;
        for (CostLedgerEntry e : entries) {
            sum = sum.add(e.getEstimatedCost());
        }
        return sum;
    }

    public synchronized CostBreakdown getCumulativeBreakdown() {
        CostBreakdown sum = CostBreakdown.zero(priceTable.getCurrency());
        for (CostLedgerEntry e : entries) {
            sum = sum.plus(e.getBreakdown());
        }
        return sum;
    }

    public synchronized UnitUsage getCumulativeUsage() {
        UnitUsage sum = UnitUsage.ZERO;
        for (CostLedgerEntry e : entries) {
            sum = sum.plus(e.getUnitsConsumed());
        }
        return sum;
    }

    public synchronized List<CostLedgerEntry> entries() {
        return List.copyOf(entries);
    }

    public synchronized void reset() {
        entries.clear();
    }

    public UnitPriceTable getPriceTable() {
        return priceTable;
    }

    public List<String> getOptimizationTips() {
        UnitUsage usage = getCumulativeUsage();
        List<String> tips = new ArrayList<>();
        if (usage.getOutputUnits() > usage.getInputUnits() * 2) {
            tips.add("Consider lowering the output unit cap to reduce output costs");
        }
        if (PriceTableRegistry.PREMIUM.equalsIgnoreCase(priceTable.getName())) {
            tips.add("Consider the standard or economy price table for 80-95% cost reduction");
        }
        if (usage.getTotalUnits() > TIPS_TOTAL_UNITS_THRESHOLD) {
            tips.add("Cache repeated inputs to cut input unit costs");
        }
        return tips;
    }

    public static String formatCost(BigDecimal cost) {
        return "$" + cost.setScale(4, RoundingMode.HALF_UP).toPlainString();
    }

    public void logSummary(String batchId) {
        UnitUsage usage = getCumulativeUsage();
        CostBreakdown cost = getCumulativeBreakdown();
        log.info("[Cost] batchId={} table={} units(in={}, out={}, aux={}, total={}) cost(in={}, out={}, aux={}, total={}) tips={}",
                batchId, priceTable.getName(),
                usage.getInputUnits(), usage.getOutputUnits(), usage.getAuxiliaryUnits(), usage.getTotalUnits(),
                formatCost(cost.getInputCost()), formatCost(cost.getOutputCost()),
                formatCost(cost.getAuxiliaryCost()), formatCost(cost.getTotalCost()),
                getOptimizationTips());
    }
}
