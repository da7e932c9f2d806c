package com.tazifor.elevations.service;

import com.tazifor.elevations.model.RequestShape;

/**
 * Per-request bounds on resolution and cell count.
 *
 * @param minResolution lowest accepted H3 resolution, inclusive
 * @param maxResolution highest accepted H3 resolution, inclusive; also the default
 * @param cellLimit maximum cells for cell-id and coordinate requests
 * @param polygonCellLimitMultiplier polygon requests may cover {@code cellLimit} times this many cells
 */
public record ResolutionLimits(int minResolution,
                               int maxResolution,
                               int cellLimit,
                               int polygonCellLimitMultiplier) {

    public static final int DEFAULT_MIN_RESOLUTION = 8;
    public static final int DEFAULT_MAX_RESOLUTION = 12;
    public static final int DEFAULT_CELL_LIMIT = 15;
    public static final int DEFAULT_POLYGON_CELL_LIMIT_MULTIPLIER = 100;

    public ResolutionLimits {
        if (minResolution < 0 || maxResolution > 15 || minResolution > maxResolution) {
            throw new IllegalArgumentException(
                "Resolution bounds must satisfy 0 <= min <= max <= 15, got: " + minResolution + ".." + maxResolution);
        }
        if (cellLimit < 1 || polygonCellLimitMultiplier < 1) {
            throw new IllegalArgumentException("Cell limit and polygon multiplier must be positive");
        }
    }

    public static ResolutionLimits defaults() {
        return new ResolutionLimits(DEFAULT_MIN_RESOLUTION, DEFAULT_MAX_RESOLUTION,
            DEFAULT_CELL_LIMIT, DEFAULT_POLYGON_CELL_LIMIT_MULTIPLIER);
    }

    public boolean acceptsResolution(int resolution) {
        return resolution >= minResolution && resolution <= maxResolution;
    }

    public int cellLimitFor(RequestShape.Kind kind) {
        return kind == RequestShape.Kind.POLYGON ? cellLimit * polygonCellLimitMultiplier : cellLimit;
    }
}
