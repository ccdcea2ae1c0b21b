package com.venn.expression.node;

import com.venn.membership.MembershipMap;
import com.venn.membership.MembershipVector;

/**
 * Base class for infix operations. Left operand is evaluated first.
 */
public abstract class BinarySetNode implements SetNode {

    private final SetNode left;
    private final SetNode right;

    protected BinarySetNode(SetNode left, SetNode right) {
        this.left = left;
        this.right = right;
    }

    public SetNode getLeft() {
        return left;
    }

    public SetNode getRight() {
        return right;
    }

    @Override
    public MembershipVector evaluate(MembershipMap membership) {
        MembershipVector l = left.evaluate(membership);
        MembershipVector r = right.evaluate(membership);
        return combine(l, r);
    }

    protected abstract MembershipVector combine(MembershipVector left, MembershipVector right);

    @Override
    public String toString() {
        return "(" + left + " " + getOperator().getSymbol() + " " + right + ")";
    }
}
