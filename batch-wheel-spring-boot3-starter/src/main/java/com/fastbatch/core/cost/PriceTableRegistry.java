package com.fastbatch.core.cost;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单价表注册中心, 内置 standard / premium / economy
 */
public class PriceTableRegistry {

    private static final Logger log = LoggerFactory.getLogger(PriceTableRegistry.class);

    public static final String STANDARD = "standard";
    public static final String PREMIUM = "premium";
    public static final String ECONOMY = "economy";

    private final Map<String, UnitPriceTable> tables = new ConcurrentHashMap<>();

    public PriceTableRegistry() {
        register(UnitPriceTable.usd(STANDARD, "3.00", "15.00", "3.00"));
        register(UnitPriceTable.usd(PREMIUM, "15.00", "75.00", "15.00"));
        register(UnitPriceTable.usd(ECONOMY, "0.25", "1.25", "0.25"));
    }

    public void register(UnitPriceTable table) {
        tables.put(table.getName().toLowerCase(), table);
    }

    /**
     * 未知名称回退 standard
     */
    public UnitPriceTable resolve(String name) {
        if (name != null) {
            UnitPriceTable t = tables.get(name.trim().toLowerCase());
            if (t != null) {
                return t;
            }
            log.warn("[Cost] unknown price table={}, fallback to {}", name, STANDARD);
        }
        return tables.get(STANDARD);
    }

    public Set<String> names() {
        return new TreeSet<>(tables.keySet());
    }
}
