package com.venn.config;

import com.venn.geometry.CircleRegion;
import com.venn.geometry.Point;

import java.util.List;

/**
 * Configuration for one circular region.
 *
 * @param name   Set name (single uppercase letter other than U)
 * @param x      Center x
 * @param y      Center y
 * @param radius Radius
 * @param color  Display color name
 */
public record RegionConfig(
        String name,
        double x,
        double y,
        double radius,
        String color
) {
    public CircleRegion toRegion() {
        return new CircleRegion(name, new Point(x, y), radius, color);
    }

    /**
     * The three overlapping circles A, B and C.
     */
    public static List<RegionConfig> defaults() {
        return List.of(
                new RegionConfig("A", -2, 0, 1.5, "darkred"),
                new RegionConfig("B", 2, 0, 1.5, "darkblue"),
                new RegionConfig("C", 0, 2, 1.5, "darkgreen")
        );
    }
}
