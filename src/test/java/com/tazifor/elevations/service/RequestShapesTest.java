package com.tazifor.elevations.service;

import com.tazifor.elevations.geo.spi.H3CellCodec;
import com.tazifor.elevations.model.ElevationRequest;
import com.tazifor.elevations.model.RequestError;
import com.tazifor.elevations.model.RequestShape;
import com.tazifor.elevations.model.Validated;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RequestShapesTest {

    private final H3CellCodec codec = new H3CellCodec();
    private final RequestShapes shapes = new RequestShapes(codec, ResolutionLimits.defaults());

    @Test
    void requestWithoutShapeKeyIsMalformed() {
        assertMalformed(shapes.from(new ElevationRequest()));
    }

    @Test
    void nullRequestIsMalformed() {
        assertMalformed(shapes.from(null));
    }

    @Test
    void requestWithTwoShapeKeysIsMalformed() {
        ElevationRequest request = ElevationRequest.builder()
            .cells(List.of("630949280220400639"))
            .coordinates(List.of(pair("54.53097", "5.96836")))
            .build();

        Validated<RequestShape> shape = shapes.from(request);

        assertMalformed(shape);
        assertTrue(shape.error().message().contains("only one"));
    }

    @Test
    void emptyShapeListsAreMalformed() {
        assertMalformed(shapes.from(ElevationRequest.builder().cells(List.of()).build()));
        assertMalformed(shapes.from(ElevationRequest.builder().coordinates(List.of()).build()));
        assertMalformed(shapes.from(ElevationRequest.builder().polygon(List.of()).build()));
    }

    @Test
    void cellsThatAreNotUnsignedIntegersAreMalformed() {
        Validated<RequestShape> shape = shapes.from(ElevationRequest.builder().cells(List.of("abc")).build());

        assertMalformed(shape);
        assertTrue(shape.error().message().contains("abc"));
    }

    @Test
    void cellListKeepsRequestOrder() {
        String a = codec.fromCoordinate(54.5, 5.9, 10).toString();
        String b = codec.fromCoordinate(54.6, 5.9, 10).toString();

        Validated<RequestShape> shape = shapes.from(ElevationRequest.builder().cells(List.of(b, a)).build());

        assertTrue(shape.isOk());
        RequestShape.CellList cells = (RequestShape.CellList) shape.value();
        assertEquals(List.of(b, a), cells.cells().stream().map(Object::toString).toList());
    }

    @Test
    void coordinatesDefaultToMaximumResolution() {
        Validated<RequestShape> shape = shapes.from(ElevationRequest.builder()
            .coordinates(List.of(pair("54.53097", "5.96836")))
            .build());

        assertTrue(shape.isOk());
        RequestShape.CoordinateList coordinates = (RequestShape.CoordinateList) shape.value();
        assertEquals(ResolutionLimits.DEFAULT_MAX_RESOLUTION, coordinates.resolution());
        assertEquals("[54.53097, 5.96836]", coordinates.coordinates().get(0).toKey());
    }

    @Test
    void explicitResolutionIsKept() {
        Validated<RequestShape> shape = shapes.from(ElevationRequest.builder()
            .coordinates(List.of(pair("54.53097", "5.96836")))
            .resolution(9)
            .build());

        assertEquals(9, ((RequestShape.CoordinateList) shape.value()).resolution());
    }

    @Test
    void coordinateEntriesMustBePairs() {
        assertMalformed(shapes.from(ElevationRequest.builder()
            .coordinates(List.of(List.of(new BigDecimal("54.5"))))
            .build()));
        assertMalformed(shapes.from(ElevationRequest.builder()
            .coordinates(List.of(List.of(new BigDecimal("54.5"), new BigDecimal("5.9"), new BigDecimal("1"))))
            .build()));
        assertMalformed(shapes.from(ElevationRequest.builder()
            .coordinates(List.of(Arrays.asList(new BigDecimal("54.5"), null)))
            .build()));
    }

    @Test
    void coordinatesOutsideGeographicRangeAreMalformed() {
        assertMalformed(shapes.from(ElevationRequest.builder()
            .coordinates(List.of(pair("91", "5.9")))
            .build()));
        assertMalformed(shapes.from(ElevationRequest.builder()
            .coordinates(List.of(pair("54.5", "-180.5")))
            .build()));
    }

    @Test
    void polygonNeedsThreeVertices() {
        Validated<RequestShape> shape = shapes.from(ElevationRequest.builder()
            .polygon(List.of(pair("54.5", "5.9"), pair("54.6", "5.9")))
            .build());

        assertMalformed(shape);
        assertTrue(shape.error().message().contains("at least 3"));
    }

    @Test
    void polygonIsReadWithResolution() {
        Validated<RequestShape> shape = shapes.from(ElevationRequest.builder()
            .polygon(List.of(pair("54.52", "5.95"), pair("54.52", "5.99"), pair("54.54", "5.97")))
            .resolution(10)
            .build());

        assertTrue(shape.isOk());
        assertEquals(RequestShape.Kind.POLYGON, shape.value().kind());
        RequestShape.PolygonArea area = (RequestShape.PolygonArea) shape.value();
        assertEquals(3, area.polygon().points().size());
        assertEquals(10, area.resolution());
    }

    private static List<BigDecimal> pair(String lat, String lng) {
        return List.of(new BigDecimal(lat), new BigDecimal(lng));
    }

    private static void assertMalformed(Validated<?> result) {
        assertFalse(result.isOk());
        assertEquals(RequestError.Kind.MALFORMED_REQUEST, result.error().kind());
    }
}
