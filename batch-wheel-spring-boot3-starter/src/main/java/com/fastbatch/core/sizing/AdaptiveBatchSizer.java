package com.fastbatch.core.sizing;

import com.fastbatch.exception.BatchConfigurationException;
import lombok.Getter;

/**
 * 根据剩余任务数选择下一批大小
 */
@Getter
public class AdaptiveBatchSizer {

    private final int min;
    private final int max;
    private final int optimal;

    public AdaptiveBatchSizer(int min, int max, int optimal) {
        if (min < 1 || max < min || optimal < 1) {
            throw new BatchConfigurationException(
                    "invalid sizer bounds min=" + min + " max=" + max + " optimal=" + optimal);
        }
        this.min = min;
        this.max = max;
        this.optimal = optimal;
    }

    public int next(int available) {
        return chooseBatchSize(available, min, max, optimal);
    }

    /**
     * 不足 min 时全部取走; 达到 max 时取 optimal; 其余取 min(available, optimal)
     */
    public static int chooseBatchSize(int available, int min, int max, int optimal) {
        if (available <= min) {
            return available;
        }
        if (available >= max) {
            return optimal;
        }
        return Math.min(available, optimal);
    }
}
