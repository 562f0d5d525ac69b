package com.fastbatch.core.cost;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 每百万单位单价
 */
@Getter
@ToString
public final class UnitPriceTable {

    private static final int PER_MILLION_SHIFT = 6;

    private final String name;
    private final BigDecimal inputPerMillion;
    private final BigDecimal outputPerMillion;
    private final BigDecimal auxiliaryPerMillion;
    private final String currency;

    public UnitPriceTable(String name, BigDecimal inputPerMillion, BigDecimal outputPerMillion,
                          BigDecimal auxiliaryPerMillion, String currency) {
        this.name = Objects.requireNonNull(name, "name");
        this.inputPerMillion = Objects.requireNonNull(inputPerMillion, "inputPerMillion");
        this.outputPerMillion = Objects.requireNonNull(outputPerMillion, "outputPerMillion");
        this.auxiliaryPerMillion = Objects.requireNonNull(auxiliaryPerMillion, "auxiliaryPerMillion");
        this.currency = currency == null ? "USD" : currency;
    }

    public static UnitPriceTable usd(String name, String input, String output, String auxiliary) {
        return new UnitPriceTable(name, new BigDecimal(input), new BigDecimal(output), new BigDecimal(auxiliary), "USD");
    }

    /**
     * 精确计价, 不做舍入
     */
    public CostBreakdown price(UnitUsage usage) {
        return new CostBreakdown(
                cost(usage.getInputUnits(), inputPerMillion),
                cost(usage.getOutputUnits(), outputPerMillion),
                cost(usage.getAuxiliaryUnits(), auxiliaryPerMillion),
                currency);
    }

    private static BigDecimal cost(long units, BigDecimal perMillion) {
        return BigDecimal.valueOf(units).multiply(perMillion).movePointLeft(PER_MILLION_SHIFT);
    }
}
