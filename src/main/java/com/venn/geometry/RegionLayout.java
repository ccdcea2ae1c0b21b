package com.venn.geometry;

import com.venn.membership.MembershipMap;
import com.venn.membership.MembershipProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named circular regions over a point grid.
 * Regions can be moved (dragged) and reset to the positions they were created with.
 * <p>
 * Membership maps are snapshots: moving a region afterwards does not change a map
 * already handed out.
 */
public class RegionLayout implements MembershipProvider {

    private static final Logger log = LoggerFactory.getLogger(RegionLayout.class);

    private final PointGrid grid;
    private final Map<String, CircleRegion> home;
    private final Map<String, CircleRegion> current;

    public RegionLayout(PointGrid grid, List<CircleRegion> regions) {
        this.grid = grid;
        this.home = new LinkedHashMap<>();
        for (CircleRegion region : regions) {
            if (!MembershipMap.isValidSetName(region.name())) {
                throw new IllegalArgumentException("Invalid region name '" + region.name()
                        + "': expected a single uppercase letter other than U");
            }
            if (home.putIfAbsent(region.name(), region) != null) {
                throw new IllegalArgumentException("Duplicate region name: " + region.name());
            }
        }
        this.current = new LinkedHashMap<>(home);
    }

    /**
     * Layout with three overlapping circles A, B and C on the default grid.
     */
    public static RegionLayout defaults() {
        return new RegionLayout(PointGrid.defaults(), List.of(
                new CircleRegion("A", new Point(-2, 0), 1.5, "darkred"),
                new CircleRegion("B", new Point(2, 0), 1.5, "darkblue"),
                new CircleRegion("C", new Point(0, 2), 1.5, "darkgreen")
        ));
    }

    public PointGrid grid() {
        return grid;
    }

    public synchronized Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(current.keySet()));
    }

    public synchronized Optional<CircleRegion> region(String name) {
        return Optional.ofNullable(current.get(name));
    }

    /**
     * Current regions in definition order.
     */
    public synchronized List<CircleRegion> regions() {
        return new ArrayList<>(current.values());
    }

    /**
     * First region, in definition order, that contains the point.
     */
    public synchronized Optional<CircleRegion> regionAt(Point point) {
        for (CircleRegion region : current.values()) {
            if (region.contains(point)) {
                return Optional.of(region);
            }
        }
        return Optional.empty();
    }

    /**
     * Move a region to a new center.
     *
     * @return The moved region
     * @throws IllegalArgumentException if no region has that name
     */
    public synchronized CircleRegion move(String name, Point center) {
        CircleRegion region = current.get(name);
        if (region == null) {
            throw new IllegalArgumentException("Unknown region: " + name);
        }
        CircleRegion moved = region.movedTo(center);
        current.put(name, moved);
        log.debug("Moved region {} to ({}, {})", name, center.x(), center.y());
        return moved;
    }

    /**
     * Move the first region under {@code from} by the offset from {@code from} to {@code to}.
     * Finding and moving the region happen under one lock.
     *
     * @return The moved region, or empty if no region is under {@code from}
     */
    public synchronized Optional<CircleRegion> dragFrom(Point from, Point to) {
        Optional<CircleRegion> grabbed = regionAt(from);
        if (grabbed.isEmpty()) {
            return Optional.empty();
        }
        CircleRegion region = grabbed.get();
        Point center = region.center().translate(to.x() - from.x(), to.y() - from.y());
        return Optional.of(move(region.name(), center));
    }

    /**
     * Put every region back where it started.
     */
    public synchronized void reset() {
        current.clear();
        current.putAll(home);
        log.debug("Reset {} regions", home.size());
    }

    @Override
    public MembershipMap membershipMap() {
        List<CircleRegion> snapshot = regions();
        MembershipMap.Builder builder = MembershipMap.builder(grid.size());
        for (CircleRegion region : snapshot) {
            builder.put(region.name(), region.membership(grid));
        }
        return builder.build();
    }
}
