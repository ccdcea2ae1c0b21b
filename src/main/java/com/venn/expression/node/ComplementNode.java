package com.venn.expression.node;

import com.venn.expression.SetOperator;
import com.venn.membership.MembershipMap;
import com.venn.membership.MembershipVector;

/**
 * Complement relative to the universe. Written postfix, e.g. {@code A.}.
 */
public class ComplementNode implements SetNode {

    private final SetNode operand;

    public ComplementNode(SetNode operand) {
        this.operand = operand;
    }

    public SetNode getOperand() {
        return operand;
    }

    @Override
    public MembershipVector evaluate(MembershipMap membership) {
        MembershipVector universal = MembershipVector.allTrue(membership.universeSize());
        return universal.andNot(operand.evaluate(membership));
    }

    @Override
    public SetOperator getOperator() {
        return SetOperator.COMPLEMENT;
    }

    @Override
    public String toString() {
        if (operand instanceof ComplementNode) {
            return "(" + operand + ").";
        }
        return operand + ".";
    }
}
