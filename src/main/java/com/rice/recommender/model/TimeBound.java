package com.rice.recommender.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Cooking time window in minutes. Either side may be open.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TimeBound {
    private final Integer maxMinutes;
    private final Integer minMinutes;

    private TimeBound(Integer maxMinutes, Integer minMinutes) {
        this.maxMinutes = maxMinutes;
        this.minMinutes = minMinutes;
    }

    public static TimeBound atMost(int minutes) {
        return new TimeBound(minutes, null);
    }

    public static TimeBound atLeast(int minutes) {
        return new TimeBound(null, minutes);
    }

    public Integer getMaxMinutes() { return maxMinutes; }

    public Integer getMinMinutes() { return minMinutes; }

    public boolean satisfiedBy(int minutes) {
        if (maxMinutes != null && minutes > maxMinutes) return false;
        return minMinutes == null || minutes >= minMinutes;
    }

    /**
     * Intersection of two windows: the tighter ceiling and the tighter floor.
     * The result may be empty (floor above ceiling), in which case nothing satisfies it.
     */
    public TimeBound intersect(TimeBound other) {
        if (other == null) return this;
        Integer max = maxMinutes == null ? other.maxMinutes
                : other.maxMinutes == null ? maxMinutes : Math.min(maxMinutes, other.maxMinutes);
        Integer min = minMinutes == null ? other.minMinutes
                : other.minMinutes == null ? minMinutes : Math.max(minMinutes, other.minMinutes);
        return new TimeBound(max, min);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeBound that)) return false;
        return Objects.equals(maxMinutes, that.maxMinutes) && Objects.equals(minMinutes, that.minMinutes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxMinutes, minMinutes);
    }

    @Override
    public String toString() {
        if (maxMinutes != null && minMinutes != null) return minMinutes + ".." + maxMinutes + " min";
        if (maxMinutes != null) return "<=" + maxMinutes + " min";
        return ">=" + minMinutes + " min";
    }
}
