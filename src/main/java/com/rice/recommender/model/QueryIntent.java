package com.rice.recommender.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.*;

/**
 * Structured facets extracted from one user utterance.
 *
 * <p>A category that is absent is unconstrained; a present category always holds at
 * least one canonical value. {@link FacetCategory#TIME_CONSTRAINT} is present exactly
 * when a {@link TimeBound} was detected and its values are the labels that produced
 * the bound (e.g. {@code quick}, {@code max:30}). Instances are immutable.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class QueryIntent {
    private static final QueryIntent UNCONSTRAINED = new QueryIntent(new EnumMap<>(FacetCategory.class), null);

    private final Map<FacetCategory, Set<String>> facets;
    private final TimeBound timeBound;

    private QueryIntent(EnumMap<FacetCategory, Set<String>> facets, TimeBound timeBound) {
        this.facets = Collections.unmodifiableMap(facets);
        this.timeBound = timeBound;
    }

    public static QueryIntent unconstrained() {
        return UNCONSTRAINED;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Requested values for the category, empty when unconstrained. */
    public Set<String> values(FacetCategory category) {
        return facets.getOrDefault(category, Set.of());
    }

    public boolean isConstrained(FacetCategory category) {
        return facets.containsKey(category);
    }

    @JsonIgnore
    public Set<FacetCategory> constrainedCategories() {
        return facets.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(facets.keySet()));
    }

    public boolean isUnconstrained() {
        return facets.isEmpty();
    }

    public TimeBound getTimeBound() {
        return timeBound;
    }

    /** JSON view keyed by {@link FacetCategory#key()}. */
    public Map<String, List<String>> getFacets() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<FacetCategory, Set<String>> e : facets.entrySet()) {
            out.put(e.getKey().key(), new ArrayList<>(e.getValue()));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryIntent that)) return false;
        return facets.equals(that.facets) && Objects.equals(timeBound, that.timeBound);
    }

    @Override
    public int hashCode() {
        return Objects.hash(facets, timeBound);
    }

    @Override
    public String toString() {
        if (isUnconstrained()) return "QueryIntent{unconstrained}";
        StringBuilder sb = new StringBuilder("QueryIntent{");
        boolean first = true;
        for (Map.Entry<FacetCategory, Set<String>> e : facets.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey().key()).append('=').append(e.getValue());
            first = false;
        }
        if (timeBound != null) sb.append(", time=").append(timeBound);
        return sb.append('}').toString();
    }

    public static final class Builder {
        private final EnumMap<FacetCategory, LinkedHashSet<String>> facets = new EnumMap<>(FacetCategory.class);
        private TimeBound timeBound;

        private Builder() {}

        /**
         * Adds a canonical value. Time constraints must go through {@link #addTime}.
         */
        public Builder add(FacetCategory category, String value) {
            if (category == FacetCategory.TIME_CONSTRAINT) {
                throw new IllegalArgumentException("time constraints need a bound, use addTime()");
            }
            if (value == null || value.isBlank()) return this;
            facets.computeIfAbsent(category, c -> new LinkedHashSet<>()).add(value);
            return this;
        }

        public Builder addTime(String label, TimeBound bound) {
            Objects.requireNonNull(bound, "bound");
            facets.computeIfAbsent(FacetCategory.TIME_CONSTRAINT, c -> new LinkedHashSet<>()).add(label);
            timeBound = timeBound == null ? bound : timeBound.intersect(bound);
            return this;
        }

        public boolean has(FacetCategory category) {
            return facets.containsKey(category);
        }

        public QueryIntent build() {
            if (facets.isEmpty()) return UNCONSTRAINED;
            EnumMap<FacetCategory, Set<String>> frozen = new EnumMap<>(FacetCategory.class);
            for (Map.Entry<FacetCategory, LinkedHashSet<String>> e : facets.entrySet()) {
                frozen.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(e.getValue())));
            }
            return new QueryIntent(frozen, timeBound);
        }
    }
}
