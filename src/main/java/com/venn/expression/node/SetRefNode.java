package com.venn.expression.node;

import com.venn.exception.SetExpressionException;
import com.venn.exception.SetExpressionException.ErrorKind;
import com.venn.expression.SetOperator;
import com.venn.membership.MembershipMap;
import com.venn.membership.MembershipVector;

/**
 * Reference to a named set. Resolved when evaluated, so one tree can be
 * evaluated against many maps.
 */
public class SetRefNode implements SetNode {

    private final String name;
    private final String source;
    private final int position;

    /**
     * @param name     Set name
     * @param source   Formula the reference was parsed from, used in error messages
     * @param position Position of the reference in the formula
     */
    public SetRefNode(String name, String source, int position) {
        this.name = name;
        this.source = source;
        this.position = position;
    }

    public String getName() {
        return name;
    }

    @Override
    public MembershipVector evaluate(MembershipMap membership) {
        return membership.get(name)
                .orElseThrow(() -> new SetExpressionException(ErrorKind.UNKNOWN_SET, source,
                        position, name, "Unknown set '" + name + "'"));
    }

    @Override
    public SetOperator getOperator() {
        return SetOperator.SET_REF;
    }

    @Override
    public String toString() {
        return name;
    }
}
