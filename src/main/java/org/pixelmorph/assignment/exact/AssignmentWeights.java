package org.pixelmorph.assignment.exact;

/**
 * Dense bipartite weight matrix maximized by {@link KuhnMunkresMatcher}.
 *
 * <p>Rows are target cells, columns are source pixels. Implementations compute entries on
 * demand; callers must tolerate repeated lookups of the same cell.</p>
 */
public interface AssignmentWeights {
    int rows();

    int columns();

    /**
     * Weight of matching row {@code row} with column {@code column}; higher is better.
     */
    long at(int row, int column);
}
