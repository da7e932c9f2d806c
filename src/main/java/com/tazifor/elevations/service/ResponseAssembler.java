package com.tazifor.elevations.service;

import com.tazifor.elevations.geo.model.CellId;
import com.tazifor.elevations.geo.model.Coordinate;
import com.tazifor.elevations.model.ElevationLookup;
import com.tazifor.elevations.model.ElevationResponse;
import com.tazifor.elevations.model.RequestedCells;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the caller-facing envelope from an {@link ElevationLookup}.
 *
 * Lookups are keyed on cells internally. For coordinate requests the keys are
 * mapped back to the coordinates the caller sent, since a cell's center is not
 * the point that was asked for.
 */
public class ResponseAssembler {

    private final int estimatedWaitSeconds;
    private final double waitSecondsPerCell;

    /**
     * @param estimatedWaitSeconds base wait reported whenever something is pending
     * @param waitSecondsPerCell extra wait per pending cell, 0 for a flat estimate
     */
    public ResponseAssembler(int estimatedWaitSeconds, double waitSecondsPerCell) {
        if (estimatedWaitSeconds < 0 || waitSecondsPerCell < 0) {
            throw new IllegalArgumentException("Wait time settings must not be negative");
        }
        this.estimatedWaitSeconds = estimatedWaitSeconds;
        this.waitSecondsPerCell = waitSecondsPerCell;
    }

    public ElevationResponse assemble(ElevationLookup lookup) {
        RequestedCells requested = lookup.requested();

        Map<String, Double> elevations = new LinkedHashMap<>();
        lookup.available().forEach((cell, elevation) -> elevations.put(keyOf(requested, cell), elevation));

        ElevationResponse.ElevationResponseBuilder response = ElevationResponse.builder().elevations(elevations);
        if (lookup.unavailable().isEmpty()) {
            return response.build();
        }

        List<Object> pending = new ArrayList<>(lookup.unavailable().size());
        for (CellId cell : lookup.unavailable()) {
            pending.add(pendingEntryOf(requested, cell));
        }
        return response
            .pending(pending)
            .estimatedWaitTime(estimatedWaitTime(pending.size()))
            .build();
    }

    int estimatedWaitTime(int pendingCells) {
        return estimatedWaitSeconds + (int) Math.ceil(waitSecondsPerCell * pendingCells);
    }

    private static String keyOf(RequestedCells requested, CellId cell) {
        return requested.originOf(cell).map(Coordinate::toKey).orElseGet(cell::toString);
    }

    private static Object pendingEntryOf(RequestedCells requested, CellId cell) {
        return requested.originOf(cell).<Object>map(Coordinate::toPair).orElseGet(cell::toString);
    }
}
