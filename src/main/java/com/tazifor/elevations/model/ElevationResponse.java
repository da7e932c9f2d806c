package com.tazifor.elevations.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Elevation response envelope.
 *
 * Keys follow the caller's addressing mode: the cell id as a string for
 * cell and polygon requests, the literal {@code "[lat, lng]"} for
 * coordinate requests.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElevationResponse {

    /**
     * Resolved elevations in meters
     */
    private Map<String, Double> elevations;

    /**
     * Cells (strings) or coordinates ([lat, lng] arrays) not yet in the store.
     * Null when everything resolved.
     */
    private List<Object> pending;

    /**
     * Seconds the caller should wait before asking again for the pending keys
     */
    @JsonProperty("estimated_wait_time")
    private Integer estimatedWaitTime;

    public boolean hasPending() {
        return pending != null && !pending.isEmpty();
    }
}
