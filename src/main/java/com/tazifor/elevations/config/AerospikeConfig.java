package com.tazifor.elevations.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Host;
import com.aerospike.client.IAerospikeClient;
import com.aerospike.client.policy.BatchPolicy;
import com.aerospike.client.policy.ClientPolicy;
import com.tazifor.elevations.service.AerospikeElevationStore;
import com.tazifor.elevations.service.ElevationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Aerospike Configuration for the elevation store
 *
 * Elevations are read in batches on the request path, so every read is
 * bounded by a short total timeout.
 */
@Slf4j
@Configuration
public class AerospikeConfig {

    @Value("${aerospike.hosts}")
    private String hosts;

    @Value("${aerospike.namespace}")
    private String namespace;

    @Value("${aerospike.set:elevations}")
    private String setName;

    @Value("${aerospike.timeout-ms:200}")
    private int timeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy policy = new ClientPolicy();
        policy.readPolicyDefault.totalTimeout = timeoutMs;
        policy.batchPolicyDefault.totalTimeout = timeoutMs;

        AerospikeClient client = new AerospikeClient(policy, parseHosts(hosts).toArray(new Host[0]));

        log.info("Connected to Aerospike hosts={} namespace={} set={} nodes={}",
            hosts, namespace, setName, client.getNodes().length);
        return client;
    }

    /**
     * Batch policy for elevation lookups
     */
    @Bean("elevationBatchPolicy")
    public BatchPolicy elevationBatchPolicy() {
        BatchPolicy policy = new BatchPolicy();
        policy.totalTimeout = timeoutMs;
        return policy;
    }

    @Bean
    public ElevationStore elevationStore(IAerospikeClient aerospikeClient, BatchPolicy elevationBatchPolicy) {
        return new AerospikeElevationStore(aerospikeClient, elevationBatchPolicy, namespace, setName);
    }

    /**
     * Parses {@code host[:port],host[:port]}; the port defaults to 3000.
     */
    static List<Host> parseHosts(String hosts) {
        List<Host> hostList = new ArrayList<>();
        for (String hostPart : hosts.split(",")) {
            if (hostPart.isBlank()) {
                continue;
            }
            String[] parts = hostPart.trim().split(":");
            String hostname = parts[0];
            int port = parts.length > 1 ? Integer.parseInt(parts[1]) : 3000;
            hostList.add(new Host(hostname, port));
        }
        if (hostList.isEmpty()) {
            throw new IllegalArgumentException("aerospike.hosts must name at least one host");
        }
        return hostList;
    }
}
