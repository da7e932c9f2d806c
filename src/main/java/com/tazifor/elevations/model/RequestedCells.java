package com.tazifor.elevations.model;

import com.tazifor.elevations.geo.model.CellId;
import com.tazifor.elevations.geo.model.Coordinate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The canonical set of cells one request asks for, in request order.
 * <p>
 * Coordinate requests also carry the cell → coordinate mapping used to key
 * the response by the caller's own coordinates. When two coordinates fall in
 * the same cell the mapping keeps the last one.
 * </p>
 */
public record RequestedCells(RequestShape.Kind kind,
                             Set<CellId> cells,
                             Map<CellId, Coordinate> originCoordinates) {

    public RequestedCells {
        cells = Collections.unmodifiableSet(new LinkedHashSet<>(cells));
        originCoordinates = originCoordinates == null
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(originCoordinates));
    }

    public static RequestedCells ofCells(RequestShape.Kind kind, Set<CellId> cells) {
        return new RequestedCells(kind, cells, null);
    }

    public static RequestedCells ofCoordinates(Map<CellId, Coordinate> originCoordinates) {
        return new RequestedCells(RequestShape.Kind.COORDINATES, originCoordinates.keySet(), originCoordinates);
    }

    public int size() { return cells.size(); }

    public boolean isCoordinateAddressed() { return originCoordinates != null; }

    public Optional<Coordinate> originOf(CellId cell) {
        return originCoordinates == null ? Optional.empty() : Optional.ofNullable(originCoordinates.get(cell));
    }
}
