package com.fastbatch.core.failure;

import com.fastbatch.core.spi.failure.FailureCaseHandler;
import com.fastbatch.core.spi.failure.FailureDecider;
import com.fastbatch.model.ctx.TaskContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 按异常类型路由到处理器
 * 先在整条 cause 链上找具体处理器（外层优先, 同层取继承距离最近, 距离相同取先注册者）,
 * 都未命中才交给兜底处理器（exceptionType 为 Throwable）
 */
public class RouterFailureDecider implements FailureDecider {

    /** cause 链最大展开深度 */
    private static final int MAX_CAUSE_DEPTH = 16;

    private final List<FailureCaseHandler<?>> specific;

    private final List<FailureCaseHandler<?>> catchAll;

    /** 没有任何处理器命中时的决策 */
    private final Decision fallback;

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers) {
        this(handlers, Decision.of(Outcome.RETRY, Category.UNKNOWN).withCode("UNHANDLED"));
    }

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers, Decision fallback) {
        List<FailureCaseHandler<?>> s = new ArrayList<>();
        List<FailureCaseHandler<?>> c = new ArrayList<>();
        for (FailureCaseHandler<?> h : handlers) {
            (h.exceptionType() == Throwable.class ? c : s).add(h);
        }
        this.specific = List.copyOf(s);
        this.catchAll = List.copyOf(c);
        this.fallback = fallback;
    }

    @Override
    public Decision decide(Throwable t, TaskContext ctx) {
        List<Throwable> chain = causeChain(t);
        for (Throwable e : chain) {
            FailureCaseHandler<?> h = nearest(specific, e);
            if (h != null) {
                return invoke(h, e, ctx);
            }
        }
        FailureCaseHandler<?> h = nearest(catchAll, t);
        return h != null ? invoke(h, t, ctx) : fallback;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Decision invoke(FailureCaseHandler h, Throwable e, TaskContext ctx) {
        return h.execute(e, ctx);
    }

    private static FailureCaseHandler<?> nearest(List<FailureCaseHandler<?>> candidates, Throwable e) {
        FailureCaseHandler<?> best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (FailureCaseHandler<?> h : candidates) {
            if (!h.supports(e)) {
                continue;
            }
            int d = distance(e.getClass(), h.exceptionType());
            // 严格小于: 距离相同保留先注册的
            if (best == null || d < bestDistance) {
                best = h;
                bestDistance = d;
            }
        }
        return best;
    }

    /**
     * from 沿父类走到 to 的步数, 接口或不可达时为 Integer.MAX_VALUE
     */
    static int distance(Class<?> from, Class<?> to) {
        int d = 0;
        for (Class<?> c = from; c != null; c = c.getSuperclass(), d++) {
            if (c.equals(to)) {
                return d;
            }
        }
        return Integer.MAX_VALUE;
    }

    private static List<Throwable> causeChain(Throwable t) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable e = t; e != null && chain.size() < MAX_CAUSE_DEPTH && seen.add(e); e = e.getCause()) {
            chain.add(e);
        }
        return chain;
    }
}
