package io.groupstream.grouping;

import io.groupstream.config.impl.ServiceConfig;
import io.groupstream.grouping.impl.StaticGroupingStrategy;
import io.groupstream.grouping.impl.UnsLevelGroupingStrategy;
import io.groupstream.grouping.type.GroupingStrategy;
import io.groupstream.metadata.KsqlClient;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiFunction;

/**
 * Fixed table of grouping strategies, selected by {@code groupingStrategy}.
 */
public final class GroupingStrategies {
    private static final Map<String, BiFunction<ServiceConfig, KsqlClient, GroupingStrategy>> REGISTERED = new TreeMap<>(Map.of(
            "uns", (cfg, ksql) -> new UnsLevelGroupingStrategy(ksql, cfg),
            "static", (cfg, ksql) -> new StaticGroupingStrategy(cfg.getStaticGroups())
    ));

    private GroupingStrategies() {
    }

    public static GroupingStrategy create(final ServiceConfig cfg, final KsqlClient ksql) {
        final var factory = REGISTERED.get(cfg.getGroupingStrategy());
        if (factory == null) {
            throw new IllegalArgumentException("Unknown grouping strategy '" + cfg.getGroupingStrategy()
                    + "', expected one of " + REGISTERED.keySet());
        }
        return factory.apply(cfg, ksql);
    }
}
