package com.fastbatch.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 批处理指标的注册表
 * 容器中的注册表展开（含嵌套 composite）去重后挂到同一个 composite 上;
 * 一个都没有时挂内存 SimpleMeterRegistry, 指标仍可在进程内读取
 */
public class BatchMeterRegistryProvider {

    private static final Logger log = LoggerFactory.getLogger(BatchMeterRegistryProvider.class);

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    private final List<MeterRegistry> bound;

    public BatchMeterRegistryProvider(List<MeterRegistry> discovered) {
        Set<MeterRegistry> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<MeterRegistry> leaves = new ArrayList<>();
        if (discovered != null) {
            discovered.forEach(r -> flatten(r, seen, leaves));
        }
        if (leaves.isEmpty()) {
            leaves.add(new SimpleMeterRegistry());
        }
        leaves.forEach(composite::add);
        this.bound = List.copyOf(leaves);
        log.info("[Batch-Metrics] bound registries={}",
                bound.stream().map(r -> r.getClass().getSimpleName()).toList());
    }

    private static void flatten(MeterRegistry r, Set<MeterRegistry> seen, List<MeterRegistry> out) {
        if (r == null || !seen.add(r)) {
            return;
        }
        if (r instanceof CompositeMeterRegistry c) {
            c.getRegistries().forEach(child -> flatten(child, seen, out));
        } else {
            out.add(r);
        }
    }

    public MeterRegistry getRegistry() {
        return composite;
    }

    /** 实际挂载的叶子注册表 */
    public List<MeterRegistry> getBoundRegistries() {
        return bound;
    }
}
