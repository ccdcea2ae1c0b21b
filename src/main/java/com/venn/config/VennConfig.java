package com.venn.config;

import com.venn.geometry.CircleRegion;
import com.venn.geometry.RegionLayout;
import com.venn.view.SetVisualizer;

import java.util.List;

/**
 * Root configuration for the set visualizer.
 *
 * @param name              Configuration name
 * @param defaultExpression Formula shown at startup and after a reset
 * @param grid              Sample grid
 * @param regions           Regions in definition order
 */
public record VennConfig(
        String name,
        String defaultExpression,
        GridConfig grid,
        List<RegionConfig> regions
) {
    /**
     * Build a region layout from this configuration.
     */
    public RegionLayout createLayout() {
        List<CircleRegion> circles = regions.stream()
                .map(RegionConfig::toRegion)
                .toList();
        return new RegionLayout(grid.toGrid(), circles);
    }

    /**
     * Default grid, the A/B/C circles and "A U B".
     */
    public static VennConfig defaults() {
        return new VennConfig("default", SetVisualizer.DEFAULT_EXPRESSION,
                GridConfig.defaults(), RegionConfig.defaults());
    }
}
