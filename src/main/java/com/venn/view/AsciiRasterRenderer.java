package com.venn.view;

import com.venn.geometry.PointGrid;
import com.venn.membership.MembershipVector;

/**
 * Draws a result vector as a text raster, one line per grid row.
 * The top line is the row with the highest y.
 */
public final class AsciiRasterRenderer {

    public static final char SELECTED = '#';
    public static final char EMPTY = '.';

    private AsciiRasterRenderer() {
    }

    public static String render(PointGrid grid, MembershipVector vector) {
        if (vector.size() != grid.size()) {
            throw new IllegalArgumentException("Vector size " + vector.size()
                    + " does not match grid size " + grid.size());
        }
        int side = grid.side();
        StringBuilder sb = new StringBuilder(grid.size() + side);
        for (int row = side - 1; row >= 0; row--) {
            for (int col = 0; col < side; col++) {
                sb.append(vector.get(row * side + col) ? SELECTED : EMPTY);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
