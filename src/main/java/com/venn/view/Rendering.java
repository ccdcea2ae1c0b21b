package com.venn.view;

import com.venn.geometry.Point;
import com.venn.membership.MembershipVector;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * What the presentation layer should draw for one formula.
 *
 * @param expression     Formula as entered
 * @param result         Membership of every grid point in the result
 * @param points         Result points, in grid order
 * @param visibleRegions Regions to draw, in layout order
 * @param error          Error message when the formula was rejected, otherwise null
 */
public record Rendering(String expression,
                        MembershipVector result,
                        List<Point> points,
                        Set<String> visibleRegions,
                        String error) {

    public int pointCount() {
        return points.size();
    }

    public boolean isValid() {
        return error == null;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
