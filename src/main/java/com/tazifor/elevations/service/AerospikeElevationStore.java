package com.tazifor.elevations.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.BatchPolicy;
import com.tazifor.elevations.geo.model.CellId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * AerospikeElevationStore - batch point lookup of elevations
 *
 * DATA LAYOUT:
 * One record per H3 cell in {@code <namespace>.<set>}, user key = the 64-bit
 * cell index, elevation in meters in the {@code elevation} bin.
 *
 * BATCH READ:
 * A polygon request can ask for over a thousand cells. One batch call costs a
 * single round trip per node.
 *
 * TIMEOUTS:
 * The batch policy's totalTimeout bounds the call. A timeout or any other
 * client error becomes an {@link ElevationStoreException}.
 */
@Slf4j
public class AerospikeElevationStore implements ElevationStore {

    public static final String ELEVATION_BIN = "elevation";

    private final IAerospikeClient client;
    private final BatchPolicy batchPolicy;
    private final String namespace;
    private final String setName;

    public AerospikeElevationStore(IAerospikeClient client, BatchPolicy batchPolicy, String namespace, String setName) {
        this.client = client;
        this.batchPolicy = batchPolicy;
        this.namespace = namespace;
        this.setName = setName;
    }

    @Override
    public Map<CellId, Double> lookup(Set<CellId> cells) {
        Map<CellId, Double> elevations = new LinkedHashMap<>();
        if (cells.isEmpty()) {
            return elevations;
        }

        List<CellId> ordered = new ArrayList<>(cells);
        Key[] keys = new Key[ordered.size()];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = keyOf(ordered.get(i));
        }

        Record[] records;
        try {
            records = client.get(batchPolicy, keys, ELEVATION_BIN);
        } catch (AerospikeException e) {
            throw new ElevationStoreException(
                "Elevation lookup for " + keys.length + " cells failed: " + e.getMessage(), e);
        }

        for (int i = 0; i < records.length; i++) {
            // null record = cell not populated yet
            if (records[i] == null) {
                continue;
            }
            Object value = records[i].getValue(ELEVATION_BIN);
            if (value instanceof Number number) {
                elevations.put(ordered.get(i), number.doubleValue());
            } else if (value != null) {
                log.warn("Ignoring non-numeric elevation {} for cell {}", value, ordered.get(i));
            }
        }
        return elevations;
    }

    Key keyOf(CellId cell) {
        return new Key(namespace, setName, cell.value());
    }
}
