package com.venn.membership;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MembershipVector.
 */
class MembershipVectorTest {

    private final MembershipVector a = MembershipVector.of(true, true, false, false);
    private final MembershipVector b = MembershipVector.of(true, false, true, false);

    @Test
    @DisplayName("Should combine vectors elementwise")
    void shouldCombineElementwise() {
        assertEquals(MembershipVector.of(true, true, true, false), a.or(b));
        assertEquals(MembershipVector.of(true, false, false, false), a.and(b));
        assertEquals(MembershipVector.of(false, true, true, false), a.xor(b));
        assertEquals(MembershipVector.of(false, true, false, false), a.andNot(b));
        assertEquals(MembershipVector.of(false, false, true, true), a.complement());
    }

    @Test
    @DisplayName("Operations leave their operands untouched")
    void operationsDoNotMutate() {
        a.or(b);
        a.complement();
        b.andNot(a);

        assertEquals(MembershipVector.of(true, true, false, false), a);
        assertEquals(MembershipVector.of(true, false, true, false), b);
    }

    @Test
    @DisplayName("Should reject operands of different sizes")
    void shouldRejectSizeMismatch() {
        MembershipVector shorter = MembershipVector.of(true, false);

        assertThrows(IllegalArgumentException.class, () -> a.or(shorter));
        assertThrows(IllegalArgumentException.class, () -> a.andNot(shorter));
    }

    @Test
    @DisplayName("Complement stays within the universe")
    void complementStaysWithinUniverse() {
        MembershipVector all = MembershipVector.allFalse(5).complement();

        assertEquals(MembershipVector.allTrue(5), all);
        assertEquals(5, all.cardinality());
        assertTrue(all.complement().isEmpty());
    }

    @Test
    @DisplayName("Should drop bits beyond the declared size")
    void fromBitSetTruncates() {
        BitSet bits = new BitSet();
        bits.set(1);
        bits.set(7);

        MembershipVector vector = MembershipVector.fromBitSet(bits, 4);

        assertEquals(4, vector.size());
        assertEquals(1, vector.cardinality());
        assertArrayEquals(new int[]{1}, vector.indices());
    }

    @Test
    @DisplayName("Should expose members as indices and as an array")
    void shouldExposeMembers() {
        assertArrayEquals(new int[]{0, 2}, b.indices());
        assertArrayEquals(new boolean[]{true, false, true, false}, b.toArray());
        assertEquals("[1010]", b.toString());
    }

    @Test
    @DisplayName("Should reject indices outside the universe")
    void shouldRejectOutOfRangeIndex() {
        assertThrows(IndexOutOfBoundsException.class, () -> a.get(4));
        assertThrows(IndexOutOfBoundsException.class, () -> a.get(-1));
    }

    @Test
    @DisplayName("Vectors with the same members but different sizes are not equal")
    void equalityIncludesSize() {
        assertNotEquals(MembershipVector.allFalse(3), MembershipVector.allFalse(4));
        assertEquals(MembershipVector.of(false, true).hashCode(), MembershipVector.of(false, true).hashCode());
    }
}
