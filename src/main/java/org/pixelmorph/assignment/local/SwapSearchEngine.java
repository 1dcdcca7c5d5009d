package org.pixelmorph.assignment.local;

import org.pixelmorph.assignment.Assignments;
import org.pixelmorph.cost.CostModel;

import java.util.Objects;
import java.util.SplittableRandom;

/**
 * Randomized pairwise-swap optimizer over one permutation.
 *
 * <p>The engine owns the permutation and a per-position cache of the cost currently paid
 * at each position. One generation draws a fixed number of proposals:</p>
 * <ol>
 * <li>position {@code a} uniformly at random;</li>
 * <li>partner {@code b} offset from {@code a} by a uniform amount in
 * {@code [-r(a), r(a)]} per axis, clamped to the grid;</li>
 * <li>the proposal is skipped unless {@code b}'s own radius also reaches {@code a};</li>
 * <li>the swap is kept iff the two positions' cost improvements sum to a strictly
 * positive value.</li>
 * </ol>
 * <p>
 * Cached costs include the {@link CostAugmentation} contribution that was in force when the
 * entry was written. Both batch and drawing solvers run on this engine with different
 * radius, color, and augmentation inputs.
 * </p>
 */
public final class SwapSearchEngine {
    private final CostModel costModel;
    private final int sideLength;
    private final int[] assignment;
    private final long[] cachedCost;
    private final SplittableRandom random;

    /**
     * Creates an engine positioned at {@code initialAssignment} (copied).
     *
     * @throws IllegalArgumentException when the initial assignment is not a permutation of the grid.
     */
    public SwapSearchEngine(CostModel costModel, int[] initialAssignment, long seed) {
        this.costModel = Objects.requireNonNull(costModel, "costModel");
        this.sideLength = costModel.target().sideLength();
        this.assignment = Assignments.requirePermutation(
                Objects.requireNonNull(initialAssignment, "initialAssignment"),
                costModel.target().size()
        ).clone();
        this.cachedCost = new long[assignment.length];
        this.random = new SplittableRandom(seed);
    }

    /**
     * Fills the cost cache for the current permutation, adding {@code baseline} to every entry.
     */
    public void initializeCosts(SourceColors colors, long baseline) {
        Objects.requireNonNull(colors, "colors");
        for (int position = 0; position < assignment.length; position++) {
            int source = assignment[position];
            cachedCost[position] = costModel.costOf(source, colors.rgb(source), position) + baseline;
        }
    }

    /**
     * Runs one generation of swap proposals.
     *
     * @param proposals number of proposals to draw.
     * @param radius swap-radius policy.
     * @param colors source color lookup for this generation.
     * @param augmentation extra cost term for each moved pixel.
     * @return number of accepted swaps.
     */
    public int runGeneration(long proposals, SwapRadius radius, SourceColors colors, CostAugmentation augmentation) {
        Objects.requireNonNull(radius, "radius");
        Objects.requireNonNull(colors, "colors");
        Objects.requireNonNull(augmentation, "augmentation");
        int cells = assignment.length;
        int maxCoord = sideLength - 1;
        int swapsMade = 0;
        for (long proposal = 0; proposal < proposals; proposal++) {
            int apos = random.nextInt(cells);
            int ax = apos % sideLength;
            int ay = apos / sideLength;

            int maxDistA = radius.maxDistance(apos);
            int bx = clamp(ax + random.nextInt(2 * maxDistA + 1) - maxDistA, maxCoord);
            int by = clamp(ay + random.nextInt(2 * maxDistA + 1) - maxDistA, maxCoord);
            int bpos = by * sideLength + bx;

            int maxDistB = radius.maxDistance(bpos);
            if (Math.abs(bx - ax) > maxDistB || Math.abs(by - ay) > maxDistB) {
                continue;
            }

            int sourceA = assignment[apos];
            int sourceB = assignment[bpos];
            long aOnB = costModel.costOf(sourceA, colors.rgb(sourceA), bpos)
                    + augmentation.contribution(bpos, apos, assignment);
            long bOnA = costModel.costOf(sourceB, colors.rgb(sourceB), apos)
                    + augmentation.contribution(apos, bpos, assignment);

            long improvementA = cachedCost[apos] - bOnA;
            long improvementB = cachedCost[bpos] - aOnB;
            if (improvementA + improvementB > 0) {
                assignment[apos] = sourceB;
                assignment[bpos] = sourceA;
                cachedCost[apos] = bOnA;
                cachedCost[bpos] = aOnB;
                swapsMade++;
            }
        }
        return swapsMade;
    }

    /**
     * Copy of the current permutation.
     */
    public int[] assignment() {
        return assignment.clone();
    }

    /**
     * Sum of cached per-position costs.
     */
    public long totalCachedCost() {
        long total = 0L;
        for (long cost : cachedCost) {
            total += cost;
        }
        return total;
    }

    private static int clamp(int value, int max) {
        if (value < 0) {
            return 0;
        }
        return Math.min(value, max);
    }
}
