package org.pixelmorph.engine;

/**
 * Solver selector for static source/target solves.
 */
public enum AssignmentAlgorithm {
    /** Kuhn-Munkres optimal matching. */
    EXACT,
    /** Randomized pairwise-swap local search. */
    LOCAL_SEARCH
}
