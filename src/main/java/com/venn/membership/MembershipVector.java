package com.venn.membership;

import java.util.BitSet;
import java.util.Objects;

/**
 * Immutable boolean vector over a fixed-size universe.
 * Bit {@code i} is set when element {@code i} of the universe belongs to the set.
 */
public final class MembershipVector {

    private final BitSet bits;
    private final int size;

    private MembershipVector(BitSet bits, int size) {
        this.bits = bits;
        this.size = size;
    }

    public static MembershipVector allFalse(int size) {
        checkSize(size);
        return new MembershipVector(new BitSet(size), size);
    }

    public static MembershipVector allTrue(int size) {
        checkSize(size);
        BitSet bits = new BitSet(size);
        bits.set(0, size);
        return new MembershipVector(bits, size);
    }

    public static MembershipVector of(boolean... values) {
        BitSet bits = new BitSet(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i]) {
                bits.set(i);
            }
        }
        return new MembershipVector(bits, values.length);
    }

    /**
     * Create a vector from a bit set. Bits at or beyond {@code size} are ignored.
     */
    public static MembershipVector fromBitSet(BitSet source, int size) {
        checkSize(size);
        Objects.requireNonNull(source, "source");
        BitSet bits = source.get(0, size);
        return new MembershipVector(bits, size);
    }

    public int size() {
        return size;
    }

    public boolean get(int index) {
        Objects.checkIndex(index, size);
        return bits.get(index);
    }

    /**
     * Number of members.
     */
    public int cardinality() {
        return bits.cardinality();
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    public MembershipVector or(MembershipVector other) {
        BitSet result = copyFor(other);
        result.or(other.bits);
        return new MembershipVector(result, size);
    }

    public MembershipVector and(MembershipVector other) {
        BitSet result = copyFor(other);
        result.and(other.bits);
        return new MembershipVector(result, size);
    }

    public MembershipVector xor(MembershipVector other) {
        BitSet result = copyFor(other);
        result.xor(other.bits);
        return new MembershipVector(result, size);
    }

    /**
     * Members of this vector that are not members of {@code other}.
     */
    public MembershipVector andNot(MembershipVector other) {
        BitSet result = copyFor(other);
        result.andNot(other.bits);
        return new MembershipVector(result, size);
    }

    public MembershipVector complement() {
        BitSet result = (BitSet) bits.clone();
        result.flip(0, size);
        return new MembershipVector(result, size);
    }

    /**
     * Indices of the members, ascending.
     */
    public int[] indices() {
        return bits.stream().toArray();
    }

    public boolean[] toArray() {
        boolean[] values = new boolean[size];
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            values[i] = true;
        }
        return values;
    }

    private BitSet copyFor(MembershipVector other) {
        Objects.requireNonNull(other, "other");
        if (other.size != size) {
            throw new IllegalArgumentException("Vector size mismatch: " + size + " vs " + other.size);
        }
        return (BitSet) bits.clone();
    }

    private static void checkSize(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Vector size must be non-negative: " + size);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MembershipVector that)) return false;
        return size == that.size && bits.equals(that.bits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(size, bits);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(size + 2);
        sb.append('[');
        for (int i = 0; i < size; i++) {
            sb.append(bits.get(i) ? '1' : '0');
        }
        return sb.append(']').toString();
    }
}
