package com.tazifor.elevations.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.elevations.geo.model.CellId;
import com.tazifor.elevations.geo.spi.H3CellCodec;
import com.tazifor.elevations.service.ElevationResolutionEngine;
import com.tazifor.elevations.service.ElevationStore;
import com.tazifor.elevations.service.ElevationStoreException;
import com.tazifor.elevations.service.InputResolver;
import com.tazifor.elevations.service.LimitEnforcer;
import com.tazifor.elevations.service.MutableClock;
import com.tazifor.elevations.service.PopulationDedupCache;
import com.tazifor.elevations.service.PopulationRequester;
import com.tazifor.elevations.service.RequestShapes;
import com.tazifor.elevations.service.ResolutionLimits;
import com.tazifor.elevations.service.ResponseAssembler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ElevationControllerTest {

    private final H3CellCodec codec = new H3CellCodec();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private ElevationStore store;
    private PopulationRequester requester;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        store = mock(ElevationStore.class);
        requester = mock(PopulationRequester.class);
        ResolutionLimits limits = ResolutionLimits.defaults();
        PopulationDedupCache cache = new PopulationDedupCache(MutableClock.startingAt2024(), Duration.ofSeconds(240), 1000);

        ElevationResolutionEngine engine = new ElevationResolutionEngine(
            new RequestShapes(codec, limits), new LimitEnforcer(limits, codec), new InputResolver(codec),
            store, cache, requester);

        mockMvc = MockMvcBuilders
            .standaloneSetup(new ElevationController(engine, new ResponseAssembler(240, 0), cache))
            .setControllerAdvice(new ElevationExceptionHandler())
            .build();
    }

    @Test
    void coordinateRequestEchoesTheInputCoordinate() throws Exception {
        CellId cell = codec.fromCoordinate(54.53097, 5.96836, 12);
        when(store.lookup(anySet())).thenReturn(Map.of(cell, 1.0));

        MvcResult result = mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"coordinates\": [[54.53097, 5.96836]]}"))
            .andExpect(status().isOk())
            .andReturn();

        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        assertEquals(1.0, body.get("elevations").get("[54.53097, 5.96836]").asDouble());
        assertEquals(1, body.get("elevations").size());
        assertFalse(body.has("pending"));
        assertFalse(body.has("estimated_wait_time"));
    }

    @Test
    void missingCellsAreAcceptedAsPending() throws Exception {
        CellId a = codec.fromCoordinate(54.50, 5.90, 10);
        CellId b = codec.fromCoordinate(54.51, 5.90, 10);
        when(store.lookup(anySet())).thenReturn(Map.of(a, 32.1));

        mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cells\": [" + a + ", \"" + b + "\"]}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.elevations['" + a + "']").value(32.1))
            .andExpect(jsonPath("$.pending[0]").value(b.toString()))
            .andExpect(jsonPath("$.estimated_wait_time").value(240));

        verify(requester).requestPopulation(Set.of(b));
    }

    @Test
    void pendingCoordinatesAreReturnedAsPairs() throws Exception {
        when(store.lookup(anySet())).thenReturn(Map.of());

        MvcResult result = mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"coordinates\": [[54.53097, 5.96836]], \"resolution\": 10}"))
            .andExpect(status().isAccepted())
            .andReturn();

        JsonNode pending = objectMapper.readTree(result.getResponse().getContentAsString()).get("pending");
        assertEquals(1, pending.size());
        assertEquals("54.53097", pending.get(0).get(0).asText());
        assertEquals("5.96836", pending.get(0).get(1).asText());
    }

    @Test
    void requestWithoutShapeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));

        verifyNoInteractions(store, requester);
    }

    @Test
    void nonNumericCoordinatesAreBadRequest() throws Exception {
        mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"coordinates\": [[\"north\", \"east\"]]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    void resolutionOutOfRangeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"coordinates\": [[54.53097, 5.96836]], \"resolution\": 7}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("RESOLUTION_OUT_OF_RANGE"));
    }

    @Test
    void fractionalResolutionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"coordinates\": [[54.53097, 5.96836]], \"resolution\": 11.9}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));

        verifyNoInteractions(store, requester);
    }

    @Test
    void quotedResolutionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"coordinates\": [[54.53097, 5.96836]], \"resolution\": \"11\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));

        verifyNoInteractions(store, requester);
    }

    @Test
    void oversizePolygonIsOverTheCellLimit() throws Exception {
        mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"polygon\": [[40, 0], [40, 20], [60, 20], [60, 0]]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("CELL_LIMIT_EXCEEDED"));

        verifyNoInteractions(store, requester);
    }

    @Test
    void invalidCellIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cells\": [12345]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_CELL_IDENTIFIER"));
    }

    @Test
    void storeFailureIsServiceUnavailable() throws Exception {
        when(store.lookup(anySet())).thenThrow(new ElevationStoreException("timeout", null));
        CellId a = codec.fromCoordinate(54.50, 5.90, 10);

        mockMvc.perform(post("/api/elevations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cells\": [" + a + "]}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("DEPENDENCY_FAILURE"));

        verifyNoInteractions(requester);
    }

    @Test
    void healthReportsUp() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.pendingPopulationEntries").value(0));
    }
}
