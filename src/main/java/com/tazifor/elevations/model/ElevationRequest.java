package com.tazifor.elevations.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Elevation request payload.
 *
 * Exactly one of {@code cells}, {@code coordinates} or {@code polygon} is
 * expected. Which one is present decides how the request is addressed and
 * how the response is keyed.
 *
 * <pre>
 * {"cells": [630949280220400639, ...]}
 * {"coordinates": [[54.53097, 5.96836], ...], "resolution": 12}
 * {"polygon": [[54.53, 5.96], [54.53, 5.98], [54.54, 5.97]], "resolution": 10}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ElevationRequest {

    /**
     * H3 cell indexes as unsigned 64-bit integers (JSON numbers or decimal strings)
     */
    private List<String> cells;

    /**
     * [lat, lng] pairs; decimals are kept verbatim for the response keys
     */
    private List<List<BigDecimal>> coordinates;

    /**
     * Polygon vertices as [lat, lng] pairs, implicitly closed
     */
    private List<List<BigDecimal>> polygon;

    /**
     * H3 resolution for coordinates and polygons; defaults to the maximum.
     * Must be a JSON integer.
     */
    @JsonDeserialize(using = WholeNumberDeserializer.class)
    private Integer resolution;
}
