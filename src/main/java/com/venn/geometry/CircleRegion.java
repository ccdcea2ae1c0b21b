package com.venn.geometry;

import com.venn.membership.MembershipVector;

import java.util.BitSet;
import java.util.List;

/**
 * A named circular region. Points on the boundary are inside.
 *
 * @param name   Set name the region defines
 * @param center Center point
 * @param radius Radius, positive
 * @param color  Display color name
 */
public record CircleRegion(String name, Point center, double radius, String color) {

    public CircleRegion {
        if (!(radius > 0)) {
            throw new IllegalArgumentException("Radius of region " + name + " must be positive: " + radius);
        }
    }

    public boolean contains(Point point) {
        return point.distanceSquared(center) <= radius * radius;
    }

    /**
     * Membership of every grid point in this region.
     */
    public MembershipVector membership(PointGrid grid) {
        List<Point> points = grid.points();
        BitSet bits = new BitSet(points.size());
        for (int i = 0; i < points.size(); i++) {
            if (contains(points.get(i))) {
                bits.set(i);
            }
        }
        return MembershipVector.fromBitSet(bits, points.size());
    }

    public CircleRegion movedTo(Point newCenter) {
        return new CircleRegion(name, newCenter, radius, color);
    }
}
