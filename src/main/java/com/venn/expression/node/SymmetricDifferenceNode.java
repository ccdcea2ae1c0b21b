package com.venn.expression.node;

import com.venn.expression.SetOperator;
import com.venn.membership.MembershipVector;

/**
 * Symmetric difference - members of exactly one operand.
 */
public class SymmetricDifferenceNode extends BinarySetNode {

    public SymmetricDifferenceNode(SetNode left, SetNode right) {
        super(left, right);
    }

    @Override
    protected MembershipVector combine(MembershipVector left, MembershipVector right) {
        return left.xor(right);
    }

    @Override
    public SetOperator getOperator() {
        return SetOperator.SYMMETRIC_DIFFERENCE;
    }
}
