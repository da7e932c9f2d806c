package com.tazifor.elevations.service;

import com.tazifor.elevations.geo.model.CellId;
import com.tazifor.elevations.model.ElevationLookup;
import com.tazifor.elevations.model.ElevationRequest;
import com.tazifor.elevations.model.RequestedCells;
import com.tazifor.elevations.model.Validated;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * ElevationResolutionEngine - one request from payload to availability partition
 *
 * FLOW:
 * Parse shape → Check resolution → Estimate polygon size → Resolve cells → Check cardinality
 *             → Store lookup → Unavailable − still pending → Mark + request population
 *
 * Any caller error short-circuits before the store lookup, so nothing is read
 * and nothing is recorded in the dedup cache.
 *
 * Cells still pending from an earlier request are reported as unavailable to
 * the caller but are not sent for population again until their entry expires.
 */
@Slf4j
@Service
public class ElevationResolutionEngine {

    private final RequestShapes requestShapes;
    private final LimitEnforcer limitEnforcer;
    private final InputResolver inputResolver;
    private final ElevationStore elevationStore;
    private final PopulationDedupCache populationCache;
    private final PopulationRequester populationRequester;

    public ElevationResolutionEngine(RequestShapes requestShapes,
                                     LimitEnforcer limitEnforcer,
                                     InputResolver inputResolver,
                                     ElevationStore elevationStore,
                                     PopulationDedupCache populationCache,
                                     PopulationRequester populationRequester) {
        this.requestShapes = requestShapes;
        this.limitEnforcer = limitEnforcer;
        this.inputResolver = inputResolver;
        this.elevationStore = elevationStore;
        this.populationCache = populationCache;
        this.populationRequester = populationRequester;
    }

    /**
     * Resolves a request into available and unavailable cells, triggering
     * population for unavailable cells that are not already pending.
     *
     * @throws ElevationStoreException if the store lookup fails
     */
    public Validated<ElevationLookup> resolve(ElevationRequest request) {
        Validated<RequestedCells> requested = requestShapes.from(request)
            .flatMap(limitEnforcer::checkResolution)
            .flatMap(limitEnforcer::checkEstimatedCoverage)
            .flatMap(inputResolver::resolve)
            .flatMap(limitEnforcer::checkCardinality);

        if (!requested.isOk()) {
            log.debug("Rejected elevation request: {}", requested.error());
            return Validated.rejected(requested.error());
        }
        return Validated.ok(lookup(requested.value()));
    }

    ElevationLookup lookup(RequestedCells requested) {
        Map<CellId, Double> found = elevationStore.lookup(requested.cells());
        ElevationLookup lookup = ElevationLookup.partition(requested, found);

        if (!lookup.isComplete()) {
            Set<CellId> pending = populationCache.membersStillPending(lookup.unavailable());
            Set<CellId> toPopulate = new LinkedHashSet<>(lookup.unavailable());
            toPopulate.removeAll(pending);

            if (!toPopulate.isEmpty()) {
                populationCache.markPending(toPopulate);
                triggerPopulation(toPopulate);
            }
            log.debug("{} requested, {} available, {} already pending, {} sent for population",
                requested.size(), lookup.available().size(), pending.size(), toPopulate.size());
        }
        return lookup;
    }

    // failures do not fail the response; the cells stay marked until their TTL lapses
    private void triggerPopulation(Set<CellId> cells) {
        try {
            populationRequester.requestPopulation(cells);
        } catch (RuntimeException e) {
            log.error("Population request for {} cells failed", cells.size(), e);
        }
    }

    @Scheduled(fixedDelayString = "${elevations.population.purge-interval-ms:60000}")
    public void purgeExpiredPopulationEntries() {
        int removed = populationCache.purgeExpired();
        if (removed > 0) {
            log.debug("Purged {} expired population entries", removed);
        }
    }
}
