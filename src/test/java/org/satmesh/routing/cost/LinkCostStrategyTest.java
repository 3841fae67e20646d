package org.satmesh.routing.cost;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.satmesh.routing.core.MeshRoutingException;
import org.satmesh.routing.core.SatelliteMesh;
import org.satmesh.routing.neighbor.NeighborInfo;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Link Cost Strategy Tests")
class LinkCostStrategyTest {

    private static NeighborInfo neighbor(double quality, double signal, double bandwidth) {
        return NeighborInfo.builder()
                .neighborId("N")
                .quality(quality)
                .startTime(0L)
                .endTime(1_000L)
                .signalStrength(signal)
                .bandwidthAvailable(bandwidth)
                .active(true)
                .build();
    }

    @Test
    @DisplayName("Composite cost follows the weighted formula and clamps at 1.0")
    void testCompositeFormula() {
        LinkCostStrategy composite = new CompositeLinkCostStrategy();

        // 0.5/0.9 + 0.3*0.6 + 0.2/101 < 1.0
        assertEquals(1.0d, composite.cost(neighbor(0.9d, -60.0d, 100.0d)), 1e-12);

        double expected = 0.5d / 0.3d + 0.3d * 0.6d + 0.2d / 101.0d;
        assertEquals(expected, composite.cost(neighbor(0.3d, -60.0d, 100.0d)), 1e-12);

        double weakSignal = 0.5d / 0.5d + 0.3d * 0.95d + 0.2d / 1.0d;
        assertEquals(weakSignal, composite.cost(neighbor(0.5d, -95.0d, 0.0d)), 1e-12);
    }

    @Test
    @DisplayName("Zero quality makes the link unusable")
    void testZeroQuality() {
        NeighborInfo dead = neighbor(0.0d, -60.0d, 100.0d);
        assertEquals(Double.POSITIVE_INFINITY, new CompositeLinkCostStrategy().cost(dead));
        assertEquals(Double.POSITIVE_INFINITY, new InverseQualityLinkCostStrategy().cost(dead));
        assertEquals(1.0d, new UnitLinkCostStrategy().cost(dead));
    }

    @Test
    @DisplayName("Inverse-quality and unit strategies")
    void testAlternativeStrategies() {
        assertEquals(2.0d, new InverseQualityLinkCostStrategy().cost(neighbor(0.5d, -60.0d, 100.0d)), 1e-12);
        assertEquals(1.0d, new InverseQualityLinkCostStrategy().cost(neighbor(1.0d, -60.0d, 100.0d)), 1e-12);
        assertEquals(1.0d, new UnitLinkCostStrategy().cost(neighbor(0.1d, -120.0d, 0.0d)));
    }

    @Test
    @DisplayName("Registry resolves built-in strategies by id")
    void testRegistryBuiltIns() {
        LinkCostStrategyRegistry registry = LinkCostStrategyRegistry.defaultRegistry();
        assertEquals(
                Set.of(
                        LinkCostStrategyRegistry.STRATEGY_COMPOSITE,
                        LinkCostStrategyRegistry.STRATEGY_INVERSE_QUALITY,
                        LinkCostStrategyRegistry.STRATEGY_UNIT
                ),
                registry.strategyIds()
        );
        assertInstanceOf(CompositeLinkCostStrategy.class, registry.require(LinkCostStrategyRegistry.STRATEGY_COMPOSITE));
        assertNull(registry.strategy("MISSING"));

        MeshRoutingException ex = assertThrows(MeshRoutingException.class, () -> registry.require("MISSING"));
        assertEquals(SatelliteMesh.REASON_UNKNOWN_COST_STRATEGY, ex.getReasonCode());
    }

    @Test
    @DisplayName("Registry accepts custom strategies")
    void testRegistryCustomStrategy() {
        LinkCostStrategy flat = new LinkCostStrategy() {
            @Override
            public String id() {
                return "FLAT_TWO";
            }

            @Override
            public double cost(NeighborInfo neighbor) {
                return 2.0d;
            }
        };
        LinkCostStrategyRegistry base = LinkCostStrategyRegistry.defaultRegistry();
        LinkCostStrategyRegistry registry = base.with(flat);
        assertSame(flat, registry.require("FLAT_TWO"));
        assertSame(flat, registry.require(" flat_two "));
        assertNotNull(registry.strategy(LinkCostStrategyRegistry.STRATEGY_UNIT));
        assertNull(base.strategy("FLAT_TWO"));
        assertTrue(registry.strategyIds().contains("FLAT_TWO"));
        assertThrows(IllegalArgumentException.class, () -> registry.with(flat));
    }

    @Test
    @DisplayName("Registry never lets a custom strategy shadow a built-in")
    void testRegistryRejectsBuiltInShadowing() {
        LinkCostStrategy fakeUnit = new LinkCostStrategy() {
            @Override
            public String id() {
                return "unit";
            }

            @Override
            public double cost(NeighborInfo neighbor) {
                return 5.0d;
            }
        };
        LinkCostStrategyRegistry registry = LinkCostStrategyRegistry.defaultRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.with(fakeUnit));
        assertInstanceOf(UnitLinkCostStrategy.class, registry.require("unit"));
        assertInstanceOf(InverseQualityLinkCostStrategy.class, registry.require("Inverse_Quality"));
    }
}
