package com.tazifor.elevations.service;

import com.tazifor.elevations.geo.model.CellId;
import com.tazifor.elevations.geo.model.Coordinate;
import com.tazifor.elevations.geo.model.Polygon;
import com.tazifor.elevations.geo.spi.CellCodec;
import com.tazifor.elevations.model.ElevationRequest;
import com.tazifor.elevations.model.RequestError;
import com.tazifor.elevations.model.RequestShape;
import com.tazifor.elevations.model.Validated;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the raw payload into one of the {@link RequestShape} variants.
 *
 * Only structural problems are reported here (missing or ambiguous shape key,
 * unparseable ids, bad coordinate pairs). Cell validity, resolution bounds and
 * cardinality are checked further down.
 */
@Component
public class RequestShapes {

    private final CellCodec codec;
    private final ResolutionLimits limits;

    public RequestShapes(CellCodec codec, ResolutionLimits limits) {
        this.codec = codec;
        this.limits = limits;
    }

    public Validated<RequestShape> from(ElevationRequest request) {
        if (request == null) {
            return Validated.rejected(RequestError.malformed("Request body is required"));
        }

        int present = 0;
        if (request.getCells() != null) present++;
        if (request.getCoordinates() != null) present++;
        if (request.getPolygon() != null) present++;

        if (present == 0) {
            return Validated.rejected(RequestError.malformed(
                "Request must contain one of 'cells', 'coordinates' or 'polygon'"));
        }
        if (present > 1) {
            return Validated.rejected(RequestError.malformed(
                "Request must contain only one of 'cells', 'coordinates' or 'polygon'"));
        }

        int resolution = request.getResolution() != null ? request.getResolution() : limits.maxResolution();

        if (request.getCells() != null) {
            return cellList(request.getCells());
        }
        if (request.getCoordinates() != null) {
            return coordinateList(request.getCoordinates(), resolution);
        }
        return polygon(request.getPolygon(), resolution);
    }

    private Validated<RequestShape> cellList(List<String> raw) {
        if (raw.isEmpty()) {
            return Validated.rejected(RequestError.malformed("'cells' must not be empty"));
        }
        List<CellId> cells = new ArrayList<>(raw.size());
        for (String text : raw) {
            Optional<CellId> cell = codec.parse(text);
            if (cell.isEmpty()) {
                return Validated.rejected(RequestError.malformed(
                    "Cell '" + text + "' is not an unsigned 64-bit integer"));
            }
            cells.add(cell.get());
        }
        return Validated.ok(new RequestShape.CellList(cells));
    }

    private Validated<RequestShape> coordinateList(List<List<BigDecimal>> raw, int resolution) {
        if (raw.isEmpty()) {
            return Validated.rejected(RequestError.malformed("'coordinates' must not be empty"));
        }
        return coordinates(raw, "coordinates")
            .map(points -> new RequestShape.CoordinateList(points, resolution));
    }

    private Validated<RequestShape> polygon(List<List<BigDecimal>> raw, int resolution) {
        if (raw.isEmpty()) {
            return Validated.rejected(RequestError.malformed("'polygon' must not be empty"));
        }
        Validated<List<Coordinate>> vertices = coordinates(raw, "polygon");
        if (!vertices.isOk()) {
            return Validated.rejected(vertices.error());
        }
        Polygon polygon = new Polygon(vertices.value());
        if (!polygon.hasEnoughVertices()) {
            return Validated.rejected(RequestError.malformed(
                "'polygon' needs at least " + Polygon.MIN_VERTICES + " vertices, got " + polygon.points().size()));
        }
        return Validated.ok(new RequestShape.PolygonArea(polygon, resolution));
    }

    private static Validated<List<Coordinate>> coordinates(List<List<BigDecimal>> raw, String field) {
        List<Coordinate> points = new ArrayList<>(raw.size());
        for (List<BigDecimal> pair : raw) {
            if (pair == null || pair.size() != 2 || pair.get(0) == null || pair.get(1) == null) {
                return Validated.rejected(RequestError.malformed(
                    "Each entry of '" + field + "' must be a [lat, lng] pair, got " + pair));
            }
            Coordinate point = new Coordinate(pair.get(0), pair.get(1));
            if (!point.isInRange()) {
                return Validated.rejected(RequestError.malformed(
                    "Coordinate " + point.toKey() + " in '" + field + "' is outside the valid latitude/longitude range"));
            }
            points.add(point);
        }
        return Validated.ok(points);
    }
}
