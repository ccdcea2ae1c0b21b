package com.venn.membership;

import com.venn.expression.ExpressionConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from set name to membership vector.
 * Every vector has exactly {@link #universeSize()} entries.
 * <p>
 * Set names are a single uppercase ASCII letter other than {@code U},
 * which is the union operator.
 */
public final class MembershipMap {

    private final int universeSize;
    private final Map<String, MembershipVector> vectors;

    private MembershipMap(int universeSize, Map<String, MembershipVector> vectors) {
        this.universeSize = universeSize;
        this.vectors = Collections.unmodifiableMap(vectors);
    }

    public static Builder builder(int universeSize) {
        return new Builder(universeSize);
    }

    public int universeSize() {
        return universeSize;
    }

    public Optional<MembershipVector> get(String name) {
        return Optional.ofNullable(vectors.get(name));
    }

    public boolean contains(String name) {
        return vectors.containsKey(name);
    }

    public Set<String> names() {
        return vectors.keySet();
    }

    public int size() {
        return vectors.size();
    }

    /**
     * Check whether a name can be used as a set reference.
     * Accepts exactly the names the tokenizer reads as set references.
     */
    public static boolean isValidSetName(String name) {
        return name != null && name.length() == 1 && ExpressionConfig.isSetName(name.charAt(0));
    }

    @Override
    public String toString() {
        return "MembershipMap{universeSize=" + universeSize + ", sets=" + vectors.keySet() + "}";
    }

    /**
     * Builder for MembershipMap.
     */
    public static final class Builder {
        private final int universeSize;
        private final Map<String, MembershipVector> vectors = new LinkedHashMap<>();

        private Builder(int universeSize) {
            if (universeSize < 0) {
                throw new IllegalArgumentException("Universe size must be non-negative: " + universeSize);
            }
            this.universeSize = universeSize;
        }

        public Builder put(String name, MembershipVector vector) {
            if (!isValidSetName(name)) {
                throw new IllegalArgumentException("Invalid set name '" + name
                        + "': expected a single uppercase letter other than U");
            }
            if (vector == null) {
                throw new IllegalArgumentException("Membership vector for set " + name + " is null");
            }
            if (vector.size() != universeSize) {
                throw new IllegalArgumentException("Membership vector for set " + name + " has size "
                        + vector.size() + ", universe size is " + universeSize);
            }
            if (vectors.putIfAbsent(name, vector) != null) {
                throw new IllegalArgumentException("Duplicate set name: " + name);
            }
            return this;
        }

        public Builder put(String name, boolean... values) {
            return put(name, MembershipVector.of(values));
        }

        public MembershipMap build() {
            return new MembershipMap(universeSize, new LinkedHashMap<>(vectors));
        }
    }
}
