package com.venn.geometry;

import com.venn.membership.MembershipVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PointGrid.
 */
class PointGridTest {

    @Test
    @DisplayName("Should sample both axes with endpoints included, x varying fastest")
    void shouldSampleRowMajor() {
        PointGrid grid = PointGrid.linspace(-1, 1, 3);

        assertEquals(9, grid.size());
        assertEquals(3, grid.side());
        assertEquals(List.of(
                new Point(-1, -1), new Point(0, -1), new Point(1, -1),
                new Point(-1, 0), new Point(0, 0), new Point(1, 0),
                new Point(-1, 1), new Point(0, 1), new Point(1, 1)), grid.points());
    }

    @Test
    @DisplayName("Default grid is 100x100 over [-4.8, 4.8]")
    void defaultGrid() {
        PointGrid grid = PointGrid.defaults();

        assertEquals(10_000, grid.size());
        assertEquals(new Point(-4.8, -4.8), grid.point(0));
        assertEquals(new Point(4.8, 4.8), grid.point(9_999));
        assertEquals(new Point(4.8, -4.8), grid.point(99));
    }

    @Test
    @DisplayName("Single sample sits at the lower bound")
    void singleSample() {
        PointGrid grid = PointGrid.linspace(2, 3, 1);

        assertEquals(List.of(new Point(2, 2)), grid.points());
    }

    @Test
    @DisplayName("Should reject empty grids and ranges")
    void shouldRejectInvalidGrid() {
        assertThrows(IllegalArgumentException.class, () -> PointGrid.linspace(0, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> PointGrid.linspace(1, 1, 5));
        assertThrows(IllegalArgumentException.class, () -> PointGrid.linspace(2, 1, 5));
        assertThrows(IllegalArgumentException.class, () -> PointGrid.linspace(0, 1, 50_000));
    }

    @Test
    @DisplayName("Should select the points of a membership vector")
    void shouldSelectMembers() {
        PointGrid grid = PointGrid.linspace(0, 1, 2);

        List<Point> selected = grid.select(MembershipVector.of(false, true, true, false));

        assertEquals(List.of(new Point(1, 0), new Point(0, 1)), selected);
        assertThrows(IllegalArgumentException.class, () -> grid.select(MembershipVector.allTrue(3)));
    }
}
