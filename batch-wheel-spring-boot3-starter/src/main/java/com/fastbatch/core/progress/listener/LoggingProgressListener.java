package com.fastbatch.core.progress.listener;

import com.fastbatch.core.spi.progress.ProgressListener;
import com.fastbatch.model.ProgressSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志进度, 未指定监听器时默认启用
 */
public class LoggingProgressListener implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void onProgress(ProgressSnapshot s) {
        double pct = s.getTotal() == 0 ? 100.0 : s.getCompleted() * 100.0 / s.getTotal();
        log.info("[Progress] batchId={} {}/{} ({}%) ok={} failed={} rate={}/s avg={}ms eta={}s",
                s.getBatchId(), s.getCompleted(), s.getTotal(), String.format("%.1f", pct),
                s.getSucceeded(), s.getFailed(),
                String.format("%.2f", s.getThroughputPerSec()),
                String.format("%.0f", s.getAverageDurationMs()),
                etaSeconds(s));
    }

    /**
     * 按当前吞吐估算剩余秒数, 无法估算时为 -1
     */
    static long etaSeconds(ProgressSnapshot s) {
        int remaining = s.getTotal() - s.getCompleted();
        if (remaining <= 0) {
            return 0;
        }
        if (s.getThroughputPerSec() <= 0) {
            return -1;
        }
        return (long) Math.ceil(remaining / s.getThroughputPerSec());
    }
}
