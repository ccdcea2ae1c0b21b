package com.venn.expression.node;

import com.venn.expression.SetOperator;
import com.venn.membership.MembershipMap;
import com.venn.membership.MembershipVector;

/**
 * Result of a blank formula - no members.
 */
public class EmptySetNode implements SetNode {

    @Override
    public MembershipVector evaluate(MembershipMap membership) {
        return MembershipVector.allFalse(membership.universeSize());
    }

    @Override
    public SetOperator getOperator() {
        return SetOperator.EMPTY;
    }

    @Override
    public String toString() {
        return "";
    }
}
