package org.pixelmorph.assignment;

import java.util.Arrays;
import java.util.Objects;

/**
 * Terminal state of one solver invocation.
 *
 * <p>The assignment is copied on the way in and on every read, so solvers may keep mutating
 * their working arrays after returning an outcome.</p>
 *
 * @param status whether the solve completed or acknowledged a cancellation.
 * @param assignment final permutation ({@code assignment[target] = source}); empty when cancelled.
 * @param totalCost summed cost of {@code assignment}; {@code 0} when cancelled.
 * @param iterations roots augmented (exact) or generations run (local search) before returning.
 */
public record SolveOutcome(Status status, int[] assignment, long totalCost, int iterations) {

    /**
     * Solver outcome.
     */
    public enum Status {
        DONE,
        CANCELLED
    }

    public SolveOutcome {
        Objects.requireNonNull(status, "status");
        assignment = Objects.requireNonNull(assignment, "assignment").clone();
    }

    public static SolveOutcome done(int[] assignment, long totalCost, int iterations) {
        return new SolveOutcome(Status.DONE, assignment, totalCost, iterations);
    }

    public static SolveOutcome cancelled(int iterations) {
        return new SolveOutcome(Status.CANCELLED, new int[0], 0L, iterations);
    }

    public boolean done() {
        return status == Status.DONE;
    }

    @Override
    public int[] assignment() {
        return assignment.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SolveOutcome)) {
            return false;
        }
        SolveOutcome other = (SolveOutcome) o;
        return status == other.status
                && totalCost == other.totalCost
                && iterations == other.iterations
                && Arrays.equals(assignment, other.assignment);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(status, totalCost, iterations);
        return 31 * result + Arrays.hashCode(assignment);
    }

    @Override
    public String toString() {
        return "SolveOutcome{" + status + ", n=" + assignment.length + ", totalCost=" + totalCost
                + ", iterations=" + iterations + "}";
    }
}
