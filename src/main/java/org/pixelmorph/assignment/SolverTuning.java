package org.pixelmorph.assignment;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Work-shaping knobs shared by the solvers.
 *
 * <p>{@link #defaults()} reads deterministic system properties and falls back to built-in
 * values when a property is absent, blank, malformed, or out of range.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SolverTuning {
    public static final int DEFAULT_SWAPS_PER_PIXEL = 4;
    public static final long DEFAULT_SEED = 12345L;
    public static final int DEFAULT_REPORT_EVERY_ROOTS = 100;

    static final String PROP_SWAPS_PER_PIXEL = "pixelmorph.solver.swapsPerPixel";
    static final String PROP_SEED = "pixelmorph.solver.seed";
    static final String PROP_REPORT_EVERY_ROOTS = "pixelmorph.exact.reportEveryRoots";

    /** Swap proposals per grid cell in one local-search generation. */
    private final int swapsPerPixel;
    /** Seed of the local-search random stream. */
    private final long seed;
    /** Exact-matcher roots between progress reports and cancellation checks. */
    private final int reportEveryRoots;

    private SolverTuning(int swapsPerPixel, long seed, int reportEveryRoots) {
        if (swapsPerPixel <= 0) {
            throw new IllegalArgumentException("swapsPerPixel must be > 0");
        }
        if (reportEveryRoots <= 0) {
            throw new IllegalArgumentException("reportEveryRoots must be > 0");
        }
        this.swapsPerPixel = swapsPerPixel;
        this.seed = seed;
        this.reportEveryRoots = reportEveryRoots;
    }

    /**
     * Creates tuning with explicit values.
     */
    public static SolverTuning of(int swapsPerPixel, long seed, int reportEveryRoots) {
        return new SolverTuning(swapsPerPixel, seed, reportEveryRoots);
    }

    /**
     * Loads tuning from system properties.
     */
    public static SolverTuning defaults() {
        return new SolverTuning(
                readPositiveInt(PROP_SWAPS_PER_PIXEL, DEFAULT_SWAPS_PER_PIXEL),
                readLong(PROP_SEED, DEFAULT_SEED),
                readPositiveInt(PROP_REPORT_EVERY_ROOTS, DEFAULT_REPORT_EVERY_ROOTS)
        );
    }

    /**
     * Swap proposals for one generation over {@code cells} grid cells.
     */
    public long swapsPerGeneration(int cells) {
        return (long) swapsPerPixel * cells;
    }

    private static int readPositiveInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static long readLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    @Override
    public String toString() {
        return "SolverTuning{swapsPerPixel=" + swapsPerPixel
                + ", seed=" + seed
                + ", reportEveryRoots=" + reportEveryRoots + "}";
    }
}
