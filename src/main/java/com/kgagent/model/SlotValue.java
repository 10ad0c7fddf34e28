package com.kgagent.model;

import java.util.List;
import java.util.Objects;

/**
 * A single slot binding: either a scalar string or an ordered list of strings.
 * Instances are immutable.
 */
public final class SlotValue {

    private final String scalar;
    private final List<String> list;

    private SlotValue(String scalar, List<String> list) {
        this.scalar = scalar;
        this.list = list;
    }

    public static SlotValue of(String value) {
        return new SlotValue(Objects.requireNonNull(value, "value"), null);
    }

    public static SlotValue of(List<String> values) {
        return new SlotValue(null, List.copyOf(values));
    }

    public static SlotValue of(int value) {
        return of(String.valueOf(value));
    }

    public boolean isList() {
        return list != null;
    }

    /**
     * @return the scalar value, or the first list element for list slots (null when the list is empty).
     */
    public String asString() {
        if (list == null) {
            return scalar;
        }
        return list.isEmpty() ? null : list.get(0);
    }

    /**
     * @return the list value, or a singleton list for scalar slots.
     */
    public List<String> asList() {
        return list != null ? list : List.of(scalar);
    }

    public boolean isBlank() {
        return isList() ? list.stream().allMatch(v -> v == null || v.isBlank()) : scalar.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SlotValue other)) {
            return false;
        }
        return Objects.equals(scalar, other.scalar) && Objects.equals(list, other.list);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scalar, list);
    }

    @Override
    public String toString() {
        return isList() ? list.toString() : scalar;
    }
}
