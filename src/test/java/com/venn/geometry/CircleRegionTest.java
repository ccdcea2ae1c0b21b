package com.venn.geometry;

import com.venn.membership.MembershipVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CircleRegion.
 */
class CircleRegionTest {

    private final CircleRegion unit = new CircleRegion("A", new Point(0, 0), 1, "red");

    @Test
    @DisplayName("Points on the boundary are inside")
    void boundaryIsInside() {
        assertTrue(unit.contains(new Point(1, 0)));
        assertTrue(unit.contains(new Point(0, -1)));
        assertTrue(unit.contains(new Point(0.5, 0.5)));
        assertFalse(unit.contains(new Point(1.01, 0)));
        assertFalse(unit.contains(new Point(0.8, 0.8)));
    }

    @Test
    @DisplayName("Membership marks the grid points inside the circle")
    void membershipOverGrid() {
        PointGrid grid = PointGrid.linspace(-1, 1, 3);

        MembershipVector membership = unit.membership(grid);

        assertEquals(MembershipVector.of(
                false, true, false,
                true, true, true,
                false, true, false), membership);
    }

    @Test
    @DisplayName("Moving keeps name, radius and color")
    void movedToKeepsShape() {
        CircleRegion moved = unit.movedTo(new Point(3, 4));

        assertEquals(new CircleRegion("A", new Point(3, 4), 1, "red"), moved);
        assertTrue(moved.contains(new Point(3, 5)));
        assertFalse(moved.contains(new Point(0, 0)));
    }

    @Test
    @DisplayName("Should reject non-positive radius")
    void shouldRejectNonPositiveRadius() {
        assertThrows(IllegalArgumentException.class, () -> new CircleRegion("A", new Point(0, 0), 0, "red"));
        assertThrows(IllegalArgumentException.class, () -> new CircleRegion("A", new Point(0, 0), -1, "red"));
    }
}
