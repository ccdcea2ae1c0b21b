package com.venn.config;

import com.venn.geometry.PointGrid;

/**
 * Configuration for the sample point grid.
 *
 * @param size Samples per axis
 * @param min  Lowest coordinate on both axes
 * @param max  Highest coordinate on both axes
 */
public record GridConfig(
        int size,
        double min,
        double max
) {
    public static GridConfig defaults() {
        return new GridConfig(PointGrid.DEFAULT_SIZE, PointGrid.DEFAULT_MIN, PointGrid.DEFAULT_MAX);
    }

    public PointGrid toGrid() {
        return PointGrid.linspace(min, max, size);
    }
}
