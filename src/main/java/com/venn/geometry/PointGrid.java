package com.venn.geometry;

import com.venn.membership.MembershipVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Square grid of sample points, the universe the sets are defined over.
 * Point {@code i} lies in row {@code i / side} and column {@code i % side};
 * x varies along a row, y increases from row to row.
 */
public final class PointGrid {

    public static final int DEFAULT_SIZE = 100;
    public static final double DEFAULT_MIN = -4.8;
    public static final double DEFAULT_MAX = 4.8;

    private final int side;
    private final double min;
    private final double max;
    private final List<Point> points;

    private PointGrid(int side, double min, double max, List<Point> points) {
        this.side = side;
        this.min = min;
        this.max = max;
        this.points = points;
    }

    /**
     * Sample {@code side} evenly spaced values on each axis, endpoints included.
     *
     * @param min  Lowest coordinate
     * @param max  Highest coordinate
     * @param side Samples per axis
     * @return Grid of {@code side * side} points
     */
    public static PointGrid linspace(double min, double max, int side) {
        if (side < 1) {
            throw new IllegalArgumentException("Grid size must be at least 1: " + side);
        }
        if (!(min < max)) {
            throw new IllegalArgumentException("Grid range is empty: [" + min + ", " + max + "]");
        }
        int count;
        try {
            count = Math.multiplyExact(side, side);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Grid size too large: " + side, e);
        }
        double[] axis = axis(min, max, side);
        List<Point> points = new ArrayList<>(count);
        for (double y : axis) {
            for (double x : axis) {
                points.add(new Point(x, y));
            }
        }
        return new PointGrid(side, min, max, Collections.unmodifiableList(points));
    }

    public static PointGrid defaults() {
        return linspace(DEFAULT_MIN, DEFAULT_MAX, DEFAULT_SIZE);
    }

    private static double[] axis(double min, double max, int count) {
        double[] values = new double[count];
        if (count == 1) {
            values[0] = min;
            return values;
        }
        double step = (max - min) / (count - 1);
        for (int i = 0; i < count; i++) {
            values[i] = min + i * step;
        }
        values[count - 1] = max;
        return values;
    }

    /**
     * Number of points, the universe size.
     */
    public int size() {
        return points.size();
    }

    /**
     * Samples per axis.
     */
    public int side() {
        return side;
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }

    public Point point(int index) {
        return points.get(index);
    }

    public List<Point> points() {
        return points;
    }

    /**
     * Points whose membership bit is set, in grid order.
     */
    public List<Point> select(MembershipVector vector) {
        if (vector.size() != size()) {
            throw new IllegalArgumentException("Vector size " + vector.size()
                    + " does not match grid size " + size());
        }
        List<Point> selected = new ArrayList<>(vector.cardinality());
        for (int index : vector.indices()) {
            selected.add(points.get(index));
        }
        return selected;
    }

    @Override
    public String toString() {
        return "PointGrid{side=" + side + ", range=[" + min + ", " + max + "]}";
    }
}
