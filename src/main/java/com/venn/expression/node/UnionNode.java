package com.venn.expression.node;

import com.venn.expression.SetOperator;
import com.venn.membership.MembershipVector;

/**
 * Union - members of either operand.
 */
public class UnionNode extends BinarySetNode {

    public UnionNode(SetNode left, SetNode right) {
        super(left, right);
    }

    @Override
    protected MembershipVector combine(MembershipVector left, MembershipVector right) {
        return left.or(right);
    }

    @Override
    public SetOperator getOperator() {
        return SetOperator.UNION;
    }
}
