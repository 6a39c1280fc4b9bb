package com.plcmodel.core.locator;

import java.util.List;

/**
 * Result of a strategy cascade: the accepted tier and what it found.
 *
 * @param tier accepted tier, null when no tier was accepted
 * @param items located items, empty when no tier was accepted
 * @param <T> type of located items
 */
public record Located<T>(LocatorTier tier, List<T> items) {

    public Located {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static <T> Located<T> none() {
        return new Located<>(null, List.of());
    }

    public boolean isFound() {
        return tier != null;
    }
}
