package com.tazifor.elevations.model;

import com.tazifor.elevations.geo.model.CellId;
import com.tazifor.elevations.geo.model.Coordinate;
import com.tazifor.elevations.geo.model.Polygon;

import java.util.List;

/**
 * How a request addresses its cells.
 * <p>
 * Consumers handle every shape through {@link Handler}, so adding a shape
 * breaks compilation everywhere it is not yet handled.
 * </p>
 */
public sealed interface RequestShape
    permits RequestShape.CellList, RequestShape.CoordinateList, RequestShape.PolygonArea {

    <R> R dispatch(Handler<R> handler);

    Kind kind();

    enum Kind { CELLS, COORDINATES, POLYGON }

    interface Handler<R> {
        R onCells(CellList shape);

        R onCoordinates(CoordinateList shape);

        R onPolygon(PolygonArea shape);
    }

    record CellList(List<CellId> cells) implements RequestShape {
        public CellList {
            cells = List.copyOf(cells);
        }

        @Override
        public <R> R dispatch(Handler<R> handler) { return handler.onCells(this); }

        @Override
        public Kind kind() { return Kind.CELLS; }
    }

    record CoordinateList(List<Coordinate> coordinates, int resolution) implements RequestShape {
        public CoordinateList {
            coordinates = List.copyOf(coordinates);
        }

        @Override
        public <R> R dispatch(Handler<R> handler) { return handler.onCoordinates(this); }

        @Override
        public Kind kind() { return Kind.COORDINATES; }
    }

    record PolygonArea(Polygon polygon, int resolution) implements RequestShape {
        @Override
        public <R> R dispatch(Handler<R> handler) { return handler.onPolygon(this); }

        @Override
        public Kind kind() { return Kind.POLYGON; }
    }
}
