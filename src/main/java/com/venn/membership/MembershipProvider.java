package com.venn.membership;

/**
 * Supplies the membership vectors for the named sets of the current universe.
 * Implementations rebuild the map whenever the underlying regions change.
 */
public interface MembershipProvider {

    /**
     * Compute a membership map for the current state of the regions.
     *
     * @return Immutable snapshot; later region changes do not affect it
     */
    MembershipMap membershipMap();
}
