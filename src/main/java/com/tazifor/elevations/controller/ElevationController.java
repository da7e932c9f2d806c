package com.tazifor.elevations.controller;

import com.tazifor.elevations.model.ElevationLookup;
import com.tazifor.elevations.model.ElevationRequest;
import com.tazifor.elevations.model.ElevationResponse;
import com.tazifor.elevations.model.RequestError;
import com.tazifor.elevations.model.Validated;
import com.tazifor.elevations.service.ElevationResolutionEngine;
import com.tazifor.elevations.service.PopulationDedupCache;
import com.tazifor.elevations.service.ResponseAssembler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * ElevationController - H3 cell elevation endpoint
 *
 * ENDPOINTS:
 * - POST /api/elevations - elevations by cells, coordinates or polygon
 * - GET /api/health - liveness plus population cache size
 *
 * STATUS CODES:
 * - 200 every requested cell resolved
 * - 202 some cells are pending population; retry after estimated_wait_time
 * - 400 caller error, body {"error": KIND, "message": ...}
 * - 503 the elevation store could not be read
 */
@RestController
@RequestMapping("/api")
public class ElevationController {

    private final ElevationResolutionEngine engine;
    private final ResponseAssembler responseAssembler;
    private final PopulationDedupCache populationCache;

    public ElevationController(ElevationResolutionEngine engine,
                               ResponseAssembler responseAssembler,
                               PopulationDedupCache populationCache) {
        this.engine = engine;
        this.responseAssembler = responseAssembler;
        this.populationCache = populationCache;
    }

    @PostMapping("/elevations")
    public ResponseEntity<?> getElevations(@RequestBody ElevationRequest request) {
        long startTime = System.nanoTime();

        Validated<ElevationLookup> lookup = engine.resolve(request);
        if (!lookup.isOk()) {
            RequestError error = lookup.error();
            return ResponseEntity.badRequest()
                .body(Map.of("error", error.kind().name(), "message", error.message()));
        }

        ElevationResponse response = responseAssembler.assemble(lookup.value());
        long latencyMs = (System.nanoTime() - startTime) / 1_000_000;

        return ResponseEntity.status(response.hasPending() ? HttpStatus.ACCEPTED : HttpStatus.OK)
            .header("X-Processing-Time-Ms", String.valueOf(latencyMs))
            .body(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "elevations-api",
            "pendingPopulationEntries", populationCache.size()
        ));
    }
}
