package com.fastbatch.core.cost;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public final class CostBreakdown {

    private final BigDecimal inputCost;
    private final BigDecimal outputCost;
    private final BigDecimal auxiliaryCost;
    private final String currency;

    public static CostBreakdown zero(String currency) {
        return new CostBreakdown(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, currency);
    }

    public BigDecimal getTotalCost() {
        return inputCost.add(outputCost).add(auxiliaryCost);
    }

    public CostBreakdown plus(CostBreakdown other) {
        return new CostBreakdown(inputCost.add(other.inputCost),
                outputCost.add(other.outputCost),
                auxiliaryCost.add(other.auxiliaryCost),
                currency);
    }

    public CostBreakdown times(long count) {
        BigDecimal n = BigDecimal.valueOf(count);
        return new CostBreakdown(inputCost.multiply(n), outputCost.multiply(n), auxiliaryCost.multiply(n), currency);
    }
}
