package com.venn.expression.node;

import com.venn.expression.SetOperator;
import com.venn.membership.MembershipVector;

/**
 * Intersection - members of both operands.
 */
public class IntersectionNode extends BinarySetNode {

    public IntersectionNode(SetNode left, SetNode right) {
        super(left, right);
    }

    @Override
    protected MembershipVector combine(MembershipVector left, MembershipVector right) {
        return left.and(right);
    }

    @Override
    public SetOperator getOperator() {
        return SetOperator.INTERSECTION;
    }
}
