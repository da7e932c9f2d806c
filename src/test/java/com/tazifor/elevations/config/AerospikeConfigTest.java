package com.tazifor.elevations.config;

import com.aerospike.client.Host;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AerospikeConfigTest {

    @Test
    void parsesHostsWithAndWithoutPorts() {
        List<Host> hosts = AerospikeConfig.parseHosts("db1:3100, db2");

        assertEquals(2, hosts.size());
        assertEquals("db1", hosts.get(0).name);
        assertEquals(3100, hosts.get(0).port);
        assertEquals("db2", hosts.get(1).name);
        assertEquals(3000, hosts.get(1).port);
    }

    @Test
    void rejectsEmptyHostList() {
        assertThrows(IllegalArgumentException.class, () -> AerospikeConfig.parseHosts(" , "));
    }
}
