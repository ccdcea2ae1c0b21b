package com.venn.geometry;

import com.venn.membership.MembershipMap;
import com.venn.membership.MembershipVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RegionLayout.
 */
class RegionLayoutTest {

    private RegionLayout layout;

    @BeforeEach
    void setUp() {
        layout = RegionLayout.defaults();
    }

    @Test
    @DisplayName("Default layout holds A, B and C over the default grid")
    void defaultLayout() {
        MembershipMap map = layout.membershipMap();

        assertEquals(List.of("A", "B", "C"), List.copyOf(layout.names()));
        assertEquals(10_000, map.universeSize());
        assertEquals(List.of("A", "B", "C"), List.copyOf(map.names()));
        assertEquals(new Point(-2, 0), layout.region("A").orElseThrow().center());
    }

    @Test
    @DisplayName("A and B start apart, A and C overlap")
    void defaultOverlaps() {
        MembershipMap map = layout.membershipMap();
        MembershipVector a = map.get("A").orElseThrow();
        MembershipVector b = map.get("B").orElseThrow();
        MembershipVector c = map.get("C").orElseThrow();

        assertFalse(a.isEmpty());
        assertTrue(a.and(b).isEmpty());
        assertFalse(a.and(c).isEmpty());
    }

    @Test
    @DisplayName("Moving a region changes later maps but not earlier ones")
    void moveProducesNewSnapshot() {
        MembershipMap before = layout.membershipMap();

        layout.move("A", new Point(2, 0));
        MembershipMap after = layout.membershipMap();

        assertEquals(after.get("B").orElseThrow(), after.get("A").orElseThrow());
        assertTrue(before.get("A").orElseThrow().and(before.get("B").orElseThrow()).isEmpty());
    }

    @Test
    @DisplayName("Should find the first region containing a point")
    void regionAt() {
        assertEquals("A", layout.regionAt(new Point(-2, 0)).orElseThrow().name());
        assertEquals("C", layout.regionAt(new Point(0, 3)).orElseThrow().name());
        assertTrue(layout.regionAt(new Point(4, 4)).isEmpty());

        layout.move("B", new Point(-2, 0));
        assertEquals("A", layout.regionAt(new Point(-2, 0)).orElseThrow().name());
    }

    @Test
    @DisplayName("Dragging moves the region under the pointer by the pointer offset")
    void dragFromMovesByOffset() {
        CircleRegion moved = layout.dragFrom(new Point(-2.5, 0.5), new Point(-1.5, 1.5)).orElseThrow();

        assertEquals("A", moved.name());
        assertEquals(new Point(-1, 1), moved.center());
        assertEquals(moved, layout.region("A").orElseThrow());
        assertTrue(layout.dragFrom(new Point(4, 4), new Point(0, 0)).isEmpty());
    }

    @Test
    @DisplayName("Drags interleaved with resets always move from the current center")
    void dragFromIsAtomicWithReset() throws Exception {
        Point home = new Point(-2, 0);
        Point away = new Point(8, 0);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 2_000; i++) {
                if (i % 2 == 0) {
                    futures.add(pool.submit(() -> layout.dragFrom(home, away)));
                } else {
                    futures.add(pool.submit(() -> layout.reset()));
                }
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
                Point center = layout.region("A").orElseThrow().center();
                assertTrue(center.equals(home) || center.equals(new Point(8, 0)), "A at " + center);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Reset puts every region back")
    void resetRestoresHome() {
        layout.move("A", new Point(1, 1));
        layout.move("C", new Point(-3, -3));

        layout.reset();

        assertEquals(new Point(-2, 0), layout.region("A").orElseThrow().center());
        assertEquals(new Point(0, 2), layout.region("C").orElseThrow().center());
    }

    @Test
    @DisplayName("Should reject unknown, invalid and duplicate region names")
    void shouldRejectBadNames() {
        PointGrid grid = PointGrid.linspace(0, 1, 2);
        CircleRegion union = new CircleRegion("U", new Point(0, 0), 1, "red");
        CircleRegion a = new CircleRegion("A", new Point(0, 0), 1, "red");

        assertThrows(IllegalArgumentException.class, () -> layout.move("Z", new Point(0, 0)));
        assertThrows(IllegalArgumentException.class, () -> new RegionLayout(grid, List.of(union)));
        assertThrows(IllegalArgumentException.class, () -> new RegionLayout(grid, List.of(a, a)));
    }
}
