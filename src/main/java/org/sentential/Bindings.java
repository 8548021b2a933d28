package org.sentential;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable assignment of boolean values to variable labels.
 *
 * Iteration order follows insertion order, lookups don't depend on it.
 */
public final class Bindings {

    private static final Bindings EMPTY = new Bindings(ImmutableMap.<Character, Boolean>of());

    private final ImmutableMap<Character, Boolean> values;

    private Bindings(ImmutableMap<Character, Boolean> values) {
        this.values = values;
    }

    public static Bindings empty() {
        return EMPTY;
    }

    public static Bindings of(Map<Character, Boolean> values) {
        return new Bindings(ImmutableMap.copyOf(values));
    }

    /**
     * Pairs each name with the value at the same position.
     */
    public static Bindings zip(List<Character> names, List<Boolean> values) {
        Preconditions.checkArgument(names.size() == values.size(),
                "Expected %s values for %s but got %s", names.size(), names, values.size());
        Builder builder = builder();
        for (int i = 0; i < names.size(); i++) {
            builder.bind(names.get(i), values.get(i));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(char label) {
        return values.containsKey(label);
    }

    /**
     * @return the bound value, or null when the label is unbound
     */
    public Boolean get(char label) {
        return values.get(label);
    }

    public Set<Character> labels() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    public Map<Character, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Bindings && ((Bindings) o).values.equals(values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "{" + Joiner.on(", ").withKeyValueSeparator(": ").join(values) + "}";
    }

    public static final class Builder {

        private final ImmutableMap.Builder<Character, Boolean> values = ImmutableMap.builder();

        private Builder() {
        }

        public Builder bind(char label, boolean value) {
            values.put(label, value);
            return this;
        }

        /**
         * @throws IllegalArgumentException if a label was bound twice
         */
        public Bindings build() {
            return new Bindings(values.build());
        }
    }
}
