package org.pixelmorph.assignment;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Helpers for assignment arrays ({@code assignment[targetIndex] = sourceIndex}).
 */
@UtilityClass
public class Assignments {

    /**
     * Returns the identity permutation of length {@code n}.
     */
    public int[] identity(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0");
        }
        int[] out = new int[n];
        for (int i = 0; i < n; i++) {
            out[i] = i;
        }
        return out;
    }

    /**
     * Returns whether {@code assignment} uses every index in {@code [0, length)} exactly once.
     */
    public boolean isPermutation(int[] assignment) {
        Objects.requireNonNull(assignment, "assignment");
        boolean[] seen = new boolean[assignment.length];
        for (int source : assignment) {
            if (source < 0 || source >= assignment.length || seen[source]) {
                return false;
            }
            seen[source] = true;
        }
        return true;
    }

    /**
     * Validates a permutation of the expected length and returns it.
     *
     * @throws IllegalArgumentException when the array is not a bijection on {@code [0, expectedLength)}.
     */
    public int[] requirePermutation(int[] assignment, int expectedLength) {
        Objects.requireNonNull(assignment, "assignment");
        if (assignment.length != expectedLength) {
            throw new IllegalArgumentException(
                    "assignment length " + assignment.length + " does not match grid size " + expectedLength
            );
        }
        if (!isPermutation(assignment)) {
            throw new IllegalArgumentException("assignment is not a permutation of [0, " + expectedLength + ")");
        }
        return assignment;
    }
}
