package com.tazifor.elevations.service;

import com.tazifor.elevations.geo.model.CellId;
import com.tazifor.elevations.geo.model.Coordinate;
import com.tazifor.elevations.geo.spi.CellCodec;
import com.tazifor.elevations.geo.spi.CoverageTooLargeException;
import com.tazifor.elevations.model.RequestError;
import com.tazifor.elevations.model.RequestShape;
import com.tazifor.elevations.model.RequestedCells;
import com.tazifor.elevations.model.Validated;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@link RequestShape} into the canonical set of requested cells.
 *
 * <ul>
 *   <li>cell lists: every id must pass the structural check; one bad id rejects the request</li>
 *   <li>coordinates: each point is encoded at the request resolution and remembered
 *       so the response can be keyed by the caller's coordinates</li>
 *   <li>polygons: polyfilled at the request resolution; no covered cell is a caller error</li>
 * </ul>
 *
 * Duplicates collapse. For coordinates that share a cell, the last one wins.
 */
@Component
public class InputResolver implements RequestShape.Handler<Validated<RequestedCells>> {

    private final CellCodec codec;

    public InputResolver(CellCodec codec) {
        this.codec = codec;
    }

    public Validated<RequestedCells> resolve(RequestShape shape) {
        return shape.dispatch(this);
    }

    @Override
    public Validated<RequestedCells> onCells(RequestShape.CellList shape) {
        Set<CellId> cells = new LinkedHashSet<>();
        for (CellId cell : shape.cells()) {
            if (!codec.validate(cell.value())) {
                return Validated.rejected(RequestError.Kind.INVALID_CELL_IDENTIFIER,
                    "Invalid H3 cell: " + cell);
            }
            cells.add(cell);
        }
        return Validated.ok(RequestedCells.ofCells(RequestShape.Kind.CELLS, cells));
    }

    @Override
    public Validated<RequestedCells> onCoordinates(RequestShape.CoordinateList shape) {
        Map<CellId, Coordinate> origins = new LinkedHashMap<>();
        for (Coordinate point : shape.coordinates()) {
            origins.put(codec.fromCoordinate(point.lat(), point.lng(), shape.resolution()), point);
        }
        return Validated.ok(RequestedCells.ofCoordinates(origins));
    }

    @Override
    public Validated<RequestedCells> onPolygon(RequestShape.PolygonArea shape) {
        Set<CellId> cells;
        try {
            cells = codec.cellsCoveringPolygon(shape.polygon(), shape.resolution());
        } catch (CoverageTooLargeException e) {
            return Validated.rejected(RequestError.Kind.CELL_LIMIT_EXCEEDED,
                "Polygon is too large to cover at resolution " + shape.resolution());
        }
        if (cells.isEmpty()) {
            return Validated.rejected(RequestError.Kind.EMPTY_COVERAGE,
                "Polygon covers no H3 cell centers at resolution " + shape.resolution()
                    + "; use a larger polygon or a higher resolution");
        }
        return Validated.ok(RequestedCells.ofCells(RequestShape.Kind.POLYGON, cells));
    }
}
