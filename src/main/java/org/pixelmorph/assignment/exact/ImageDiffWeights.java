package org.pixelmorph.assignment.exact;

import org.pixelmorph.cost.CostModel;
import org.pixelmorph.grid.PixelGrid;

import java.util.Objects;

/**
 * Negated pixel cost between target cells (rows) and source pixels (columns).
 */
public final class ImageDiffWeights implements AssignmentWeights {
    private final PixelGrid source;
    private final CostModel costModel;

    public ImageDiffWeights(PixelGrid source, CostModel costModel) {
        this.source = Objects.requireNonNull(source, "source");
        this.costModel = Objects.requireNonNull(costModel, "costModel");
        if (source.sideLength() != costModel.target().sideLength()) {
            throw new IllegalArgumentException(
                    "source side " + source.sideLength() + " does not match target side "
                            + costModel.target().sideLength()
            );
        }
    }

    @Override
    public int rows() {
        return costModel.target().size();
    }

    @Override
    public int columns() {
        return source.size();
    }

    @Override
    public long at(int row, int column) {
        return -costModel.costOf(column, source.rgb(column), row);
    }
}
