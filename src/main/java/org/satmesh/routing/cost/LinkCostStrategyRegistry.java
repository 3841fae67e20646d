package org.satmesh.routing.cost;

import org.satmesh.routing.core.MeshRoutingException;
import org.satmesh.routing.core.SatelliteMesh;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Resolves the configured link-cost strategy id.
 * <p>
 * The built-in strategies are always present and never shadowed. Ids are matched
 * case-insensitively, so {@code "unit"} and {@code "UNIT"} name the same strategy.
 * Extra strategies are attached with {@link #with(LinkCostStrategy)}, which leaves the
 * receiver untouched.
 * </p>
 */
public final class LinkCostStrategyRegistry {
    public static final String STRATEGY_COMPOSITE = "COMPOSITE";
    public static final String STRATEGY_INVERSE_QUALITY = "INVERSE_QUALITY";
    public static final String STRATEGY_UNIT = "UNIT";

    private static final LinkCostStrategyRegistry DEFAULT = new LinkCostStrategyRegistry(Map.of());

    /**
     * Stateless strategies shipped with the mesh.
     */
    enum BuiltIn {
        COMPOSITE(new CompositeLinkCostStrategy()),
        INVERSE_QUALITY(new InverseQualityLinkCostStrategy()),
        UNIT(new UnitLinkCostStrategy());

        private final LinkCostStrategy strategy;

        BuiltIn(LinkCostStrategy strategy) {
            this.strategy = strategy;
        }

        static LinkCostStrategy lookup(String key) {
            for (BuiltIn builtIn : values()) {
                if (builtIn.name().equals(key)) {
                    return builtIn.strategy;
                }
            }
            return null;
        }
    }

    private final Map<String, LinkCostStrategy> extras;

    private LinkCostStrategyRegistry(Map<String, LinkCostStrategy> extras) {
        this.extras = extras;
    }

    /**
     * Returns the registry holding only the built-in strategies.
     */
    public static LinkCostStrategyRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Returns a registry that also resolves {@code strategy} under its own id.
     *
     * @throws IllegalArgumentException when the id is blank, names a built-in, or is already attached.
     */
    public LinkCostStrategyRegistry with(LinkCostStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy");
        String key = key(Objects.requireNonNull(strategy.id(), "strategy.id"));
        if (key.isEmpty()) {
            throw new IllegalArgumentException("strategy.id must be non-blank");
        }
        if (BuiltIn.lookup(key) != null || extras.containsKey(key)) {
            throw new IllegalArgumentException("link cost strategy id already registered: " + strategy.id());
        }
        Map<String, LinkCostStrategy> next = new TreeMap<>(extras);
        next.put(key, strategy);
        return new LinkCostStrategyRegistry(Map.copyOf(next));
    }

    /**
     * Returns strategy by id, or null when not registered.
     */
    public LinkCostStrategy strategy(String strategyId) {
        if (strategyId == null) {
            return null;
        }
        String key = key(strategyId);
        LinkCostStrategy builtIn = BuiltIn.lookup(key);
        return builtIn != null ? builtIn : extras.get(key);
    }

    /**
     * Resolves a strategy id, failing with a reason code when it is unknown.
     *
     * @param strategyId configured strategy id.
     * @return registered strategy.
     * @throws MeshRoutingException with {@link SatelliteMesh#REASON_UNKNOWN_COST_STRATEGY}.
     */
    public LinkCostStrategy require(String strategyId) {
        LinkCostStrategy strategy = strategy(strategyId);
        if (strategy == null) {
            throw new MeshRoutingException(
                    SatelliteMesh.REASON_UNKNOWN_COST_STRATEGY,
                    "unknown link cost strategy id: " + strategyId + ", known: " + strategyIds()
            );
        }
        return strategy;
    }

    /**
     * Returns the sorted set of resolvable ids in canonical (upper-case) form.
     */
    public Set<String> strategyIds() {
        Set<String> ids = new TreeSet<>(extras.keySet());
        for (BuiltIn builtIn : BuiltIn.values()) {
            ids.add(builtIn.name());
        }
        return Collections.unmodifiableSet(ids);
    }

    private static String key(String id) {
        return id.trim().toUpperCase(Locale.ROOT);
    }
}
