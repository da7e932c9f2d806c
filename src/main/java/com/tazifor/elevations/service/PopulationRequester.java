package com.tazifor.elevations.service;

import com.tazifor.elevations.geo.model.CellId;

import java.util.Set;

/**
 * Fire-and-forget trigger for the job that computes and stores missing elevations.
 * <p>
 * Implementations must not wait for the job. Delivery is best effort; a lost
 * request is recovered when the cell is asked for again after its dedup entry
 * expires.
 * </p>
 */
public interface PopulationRequester {

    void requestPopulation(Set<CellId> cells);
}
