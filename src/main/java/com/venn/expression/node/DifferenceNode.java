package com.venn.expression.node;

import com.venn.expression.SetOperator;
import com.venn.membership.MembershipVector;

/**
 * Difference - members of the left operand that are not in the right one.
 */
public class DifferenceNode extends BinarySetNode {

    public DifferenceNode(SetNode left, SetNode right) {
        super(left, right);
    }

    @Override
    protected MembershipVector combine(MembershipVector left, MembershipVector right) {
        return left.andNot(right);
    }

    @Override
    public SetOperator getOperator() {
        return SetOperator.DIFFERENCE;
    }
}
