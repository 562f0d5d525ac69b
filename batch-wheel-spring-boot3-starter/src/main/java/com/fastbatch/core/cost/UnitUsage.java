package com.fastbatch.core.cost;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 单任务资源用量（输入/输出/附加单位）
 */
@Getter
@ToString
@EqualsAndHashCode
public final class UnitUsage {

    public static final UnitUsage ZERO = new UnitUsage(0, 0, 0);

    private final long inputUnits;
    private final long outputUnits;
    /** 图片等按固定单位计的附加消耗 */
    private final long auxiliaryUnits;

    private UnitUsage(long inputUnits, long outputUnits, long auxiliaryUnits) {
        if (inputUnits < 0 || outputUnits < 0 || auxiliaryUnits < 0) {
            throw new IllegalArgumentException("units must be >= 0");
        }
        this.inputUnits = inputUnits;
        this.outputUnits = outputUnits;
        this.auxiliaryUnits = auxiliaryUnits;
    }

    public static UnitUsage of(long inputUnits, long outputUnits, long auxiliaryUnits) {
        return new UnitUsage(inputUnits, outputUnits, auxiliaryUnits);
    }

    public long getTotalUnits() {
        return inputUnits + outputUnits + auxiliaryUnits;
    }

    public UnitUsage plus(UnitUsage other) {
        return new UnitUsage(inputUnits + other.inputUnits,
                outputUnits + other.outputUnits,
                auxiliaryUnits + other.auxiliaryUnits);
    }
}
