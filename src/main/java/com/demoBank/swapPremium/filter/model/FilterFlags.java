package com.demoBank.swapPremium.filter.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which filter criteria are enabled. Immutable; the "with"/"without" methods return copies.
 */
public final class FilterFlags {

    private final EnumSet<FilterKey> enabled;

    private FilterFlags(EnumSet<FilterKey> enabled) {
        this.enabled = enabled;
    }

    public static FilterFlags allEnabled() {
        return new FilterFlags(EnumSet.allOf(FilterKey.class));
    }

    public static FilterFlags noneEnabled() {
        return new FilterFlags(EnumSet.noneOf(FilterKey.class));
    }

    /**
     * Date range, product type and purchase type only: the filters that define the market
     * a lender's share is measured against.
     */
    public static FilterFlags marketBaseline() {
        return new FilterFlags(EnumSet.of(FilterKey.DATE_RANGE, FilterKey.PRODUCT_TYPE, FilterKey.PURCHASE_TYPE));
    }

    /**
     * Flags from a toggle map; keys missing from the map are enabled.
     */
    public static FilterFlags of(Map<FilterKey, Boolean> toggles) {
        EnumSet<FilterKey> enabled = EnumSet.allOf(FilterKey.class);
        toggles.forEach((key, on) -> {
            if (!Boolean.TRUE.equals(on)) {
                enabled.remove(key);
            }
        });
        return new FilterFlags(enabled);
    }

    public FilterFlags without(FilterKey key) {
        EnumSet<FilterKey> copy = EnumSet.copyOf(enabled);
        copy.remove(key);
        return new FilterFlags(copy);
    }

    public FilterFlags with(FilterKey key) {
        EnumSet<FilterKey> copy = EnumSet.copyOf(enabled);
        copy.add(key);
        return new FilterFlags(copy);
    }

    /**
     * Keys enabled in both this and {@code other}.
     */
    public FilterFlags intersect(FilterFlags other) {
        EnumSet<FilterKey> copy = EnumSet.copyOf(enabled);
        copy.retainAll(other.enabled);
        return new FilterFlags(copy);
    }

    public boolean isEnabled(FilterKey key) {
        return enabled.contains(key);
    }

    @JsonValue
    public Set<FilterKey> enabledKeys() {
        return Collections.unmodifiableSet(enabled);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FilterFlags && enabled.equals(((FilterFlags) o).enabled));
    }

    @Override
    public int hashCode() {
        return enabled.hashCode();
    }

    @Override
    public String toString() {
        return "FilterFlags" + enabled;
    }
}
