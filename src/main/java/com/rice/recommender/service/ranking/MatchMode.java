package com.rice.recommender.service.ranking;

/** How constrained categories combine into the hard filter. */
public enum MatchMode {
    /** A recipe must match every constrained category. */
    ALL,
    /** A recipe must match at least one constrained category; the score orders them. */
    ANY
}
