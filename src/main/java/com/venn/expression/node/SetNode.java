package com.venn.expression.node;

import com.venn.expression.SetOperator;
import com.venn.membership.MembershipMap;
import com.venn.membership.MembershipVector;

/**
 * A parsed set expression that can be evaluated against any membership map.
 */
public interface SetNode {

    /**
     * Evaluate this expression over the map's universe.
     *
     * @param membership Membership vectors of the named sets
     * @return Fresh result vector
     * @throws com.venn.exception.SetExpressionException if a referenced set is missing from the map
     */
    MembershipVector evaluate(MembershipMap membership);

    /**
     * Get the operation at the root of this expression.
     */
    SetOperator getOperator();
}
