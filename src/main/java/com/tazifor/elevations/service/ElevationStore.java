package com.tazifor.elevations.service;

import com.tazifor.elevations.geo.model.CellId;

import java.util.Map;
import java.util.Set;

/**
 * Batch point lookup against the elevation store.
 */
public interface ElevationStore {

    /**
     * Looks up elevations for the given cells.
     * <p>
     * Cells the store does not know yet are simply absent from the result; that
     * is never an error.
     * </p>
     *
     * @param cells cells to look up
     * @return elevation in meters per known cell
     * @throws ElevationStoreException if the store cannot be read or times out
     */
    Map<CellId, Double> lookup(Set<CellId> cells);
}
