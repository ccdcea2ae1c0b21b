package com.venn.view;

import com.venn.exception.SetExpressionException;
import com.venn.expression.SetExpressionEvaluator;
import com.venn.expression.SetExpressionTokenizer;
import com.venn.geometry.Point;
import com.venn.geometry.RegionLayout;
import com.venn.membership.MembershipMap;
import com.venn.membership.MembershipVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Headless model of the set visualizer: the current formula, the draggable
 * regions and the result of evaluating one against the other.
 * <p>
 * A rejected formula is logged and rendered with no points; the error message
 * travels with the rendering.
 */
public class SetVisualizer {

    private static final Logger log = LoggerFactory.getLogger(SetVisualizer.class);

    public static final String DEFAULT_EXPRESSION = "A U B";

    private final RegionLayout layout;
    private final SetExpressionEvaluator evaluator;
    private final String defaultExpression;
    private volatile String currentExpression;

    public SetVisualizer(RegionLayout layout, SetExpressionEvaluator evaluator, String defaultExpression) {
        this.layout = layout;
        this.evaluator = evaluator;
        this.defaultExpression = defaultExpression == null ? "" : defaultExpression;
        this.currentExpression = this.defaultExpression;
    }

    public RegionLayout getLayout() {
        return layout;
    }

    public String getCurrentExpression() {
        return currentExpression;
    }

    public String getDefaultExpression() {
        return defaultExpression;
    }

    /**
     * Make {@code expression} the current formula and render it.
     */
    public Rendering update(String expression) {
        currentExpression = expression == null ? "" : expression;
        return render(currentExpression);
    }

    /**
     * Render the current formula again, e.g. after a region moved.
     */
    public Rendering refresh() {
        return render(currentExpression);
    }

    /**
     * Drag the region under {@code from} so that it follows the pointer to {@code to}.
     *
     * @return New rendering, or empty if no region is under {@code from}
     */
    public Optional<Rendering> drag(Point from, Point to) {
        if (layout.dragFrom(from, to).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(refresh());
    }

    /**
     * Put regions back and restore the default formula.
     */
    public Rendering reset() {
        layout.reset();
        log.info("Visualizer reset to default expression '{}'", defaultExpression);
        return update(defaultExpression);
    }

    /**
     * Title line for a rendering.
     */
    public static String title(Rendering rendering) {
        if (rendering.expression().isBlank()) {
            return "Set operations";
        }
        String title = "Formula: " + rendering.expression();
        if (rendering.pointCount() > 0) {
            title += " | Points: " + rendering.pointCount();
        }
        return title;
    }

    private Rendering render(String expression) {
        MembershipMap membership = layout.membershipMap();

        if (expression.isBlank()) {
            return new Rendering(expression, MembershipVector.allFalse(membership.universeSize()),
                    List.of(), layout.names(), null);
        }

        Set<String> visible = new LinkedHashSet<>(layout.names());
        visible.retainAll(SetExpressionTokenizer.referencedSets(expression));

        MembershipVector result;
        String error = null;
        try {
            result = evaluator.evaluate(expression, membership);
        } catch (SetExpressionException e) {
            log.warn("Rejected formula '{}': {}", expression, e.getMessage());
            result = MembershipVector.allFalse(membership.universeSize());
            error = e.getMessage();
        }

        List<Point> points = layout.grid().select(result);
        log.debug("Formula '{}' selects {} of {} points", expression, points.size(), membership.universeSize());
        return new Rendering(expression, result, points, Collections.unmodifiableSet(visible), error);
    }
}
