package com.fastbatch.core.cost;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@ToString
@AllArgsConstructor
public final class CostLedgerEntry {

    private final UnitUsage unitsConsumed;
    private final CostBreakdown breakdown;

    public BigDecimal getEstimatedCost() {
        return breakdown.getTotalCost();
    }
}
