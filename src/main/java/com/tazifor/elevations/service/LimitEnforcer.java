package com.tazifor.elevations.service;

import com.tazifor.elevations.geo.model.CellId;
import com.tazifor.elevations.geo.spi.CellCodec;
import com.tazifor.elevations.model.RequestError;
import com.tazifor.elevations.model.RequestShape;
import com.tazifor.elevations.model.RequestedCells;
import com.tazifor.elevations.model.Validated;
import org.springframework.stereotype.Component;

/**
 * Rejects requests that are too fine-grained or too large.
 *
 * FAIL FAST: every check runs before any store access. The resolution check
 * also runs before coordinates are encoded or polygons filled, so an
 * out-of-range polygon never gets polyfilled.
 *
 * POLYGON PRE-CHECK:
 * Polyfill work grows with the polygon's bounding box. Before filling, the
 * bounding box is converted to an approximate cell count and the request is
 * rejected when that count exceeds the polygon limit by more than
 * {@link #COVERAGE_ESTIMATE_SLACK}. The slack keeps triangles and other shapes
 * that fill a fraction of their box from being rejected early; the exact
 * count is still checked after the fill.
 */
@Component
public class LimitEnforcer {

    static final int COVERAGE_ESTIMATE_SLACK = 4;

    private final ResolutionLimits limits;
    private final CellCodec codec;

    public LimitEnforcer(ResolutionLimits limits, CellCodec codec) {
        this.limits = limits;
        this.codec = codec;
    }

    /**
     * Checks the requested resolution. Cell lists carry their resolution in each
     * id; ids that are not valid cells are left to the input resolver.
     */
    public Validated<RequestShape> checkResolution(RequestShape shape) {
        return shape.dispatch(new RequestShape.Handler<Validated<RequestShape>>() {
            @Override
            public Validated<RequestShape> onCells(RequestShape.CellList cells) {
                for (CellId cell : cells.cells()) {
                    if (codec.validate(cell.value())) {
                        int resolution = codec.resolutionOf(cell);
                        if (!limits.acceptsResolution(resolution)) {
                            return outOfRange(resolution, "cell " + cell);
                        }
                    }
                }
                return Validated.ok(shape);
            }

            @Override
            public Validated<RequestShape> onCoordinates(RequestShape.CoordinateList coordinates) {
                return check(coordinates.resolution());
            }

            @Override
            public Validated<RequestShape> onPolygon(RequestShape.PolygonArea polygon) {
                return check(polygon.resolution());
            }

            private Validated<RequestShape> check(int resolution) {
                return limits.acceptsResolution(resolution) ? Validated.ok(shape) : outOfRange(resolution, "request");
            }
        });
    }

    /**
     * Rejects polygons whose bounding box alone needs far more cells than the
     * polygon limit allows. Other shapes pass through.
     */
    public Validated<RequestShape> checkEstimatedCoverage(RequestShape shape) {
        if (!(shape instanceof RequestShape.PolygonArea area)) {
            return Validated.ok(shape);
        }
        int limit = limits.cellLimitFor(RequestShape.Kind.POLYGON);
        double estimate = codec.estimatedCellCount(area.polygon(), area.resolution());
        if (estimate > (double) limit * COVERAGE_ESTIMATE_SLACK) {
            return Validated.rejected(RequestError.Kind.CELL_LIMIT_EXCEEDED,
                "Polygon would cover roughly " + Math.round(estimate) + " cells at resolution "
                    + area.resolution() + "; the limit for polygon requests is " + limit);
        }
        return Validated.ok(shape);
    }

    /**
     * Checks the number of distinct cells against the limit for the request shape.
     */
    public Validated<RequestedCells> checkCardinality(RequestedCells requested) {
        int limit = limits.cellLimitFor(requested.kind());
        if (requested.size() > limit) {
            return Validated.rejected(RequestError.Kind.CELL_LIMIT_EXCEEDED,
                "Request covers " + requested.size() + " cells; the limit for "
                    + requested.kind().name().toLowerCase() + " requests is " + limit);
        }
        return Validated.ok(requested);
    }

    private <T> Validated<T> outOfRange(int resolution, String subject) {
        return Validated.rejected(RequestError.Kind.RESOLUTION_OUT_OF_RANGE,
            "Resolution " + resolution + " of " + subject + " is outside the supported range "
                + limits.minResolution() + ".." + limits.maxResolution());
    }
}
