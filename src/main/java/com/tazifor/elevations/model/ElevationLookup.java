package com.tazifor.elevations.model;

import com.tazifor.elevations.geo.model.CellId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Availability partition of one request: every requested cell is either
 * available with an elevation or unavailable, never both.
 */
public record ElevationLookup(RequestedCells requested,
                              Map<CellId, Double> available,
                              Set<CellId> unavailable) {

    public ElevationLookup {
        available = Collections.unmodifiableMap(new LinkedHashMap<>(available));
        unavailable = Collections.unmodifiableSet(new LinkedHashSet<>(unavailable));
    }

    /**
     * Splits {@code requested} using the elevations the store returned. Cells the
     * store returned but were not requested are ignored.
     */
    public static ElevationLookup partition(RequestedCells requested, Map<CellId, Double> found) {
        Map<CellId, Double> available = new LinkedHashMap<>();
        Set<CellId> unavailable = new LinkedHashSet<>();
        for (CellId cell : requested.cells()) {
            Double elevation = found.get(cell);
            if (elevation != null) {
                available.put(cell, elevation);
            } else {
                unavailable.add(cell);
            }
        }
        return new ElevationLookup(requested, available, unavailable);
    }

    public boolean isComplete() { return unavailable.isEmpty(); }
}
