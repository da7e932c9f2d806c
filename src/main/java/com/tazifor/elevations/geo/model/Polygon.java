package com.tazifor.elevations.geo.model;

import java.util.List;

/**
 * Represents a polygon as an <b>ordered list of coordinates</b>.
 * <p>
 * Each vertex {@code i} is connected to {@code i+1}, and the last vertex
 * automatically connects back to the first. You do <b>not</b> need to repeat
 * the first vertex at the end.
 * </p>
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Polygon windFarm = new Polygon(List.of(
 *     Coordinate.of(54.53, 5.96),   // southwest corner
 *     Coordinate.of(54.53, 5.98),   // southeast corner
 *     Coordinate.of(54.54, 5.98),   // northeast corner
 *     Coordinate.of(54.54, 5.96)    // northwest corner
 * ));
 * }</pre>
 */
public record Polygon(List<Coordinate> points) {

    public static final int MIN_VERTICES = 3;

    public Polygon {
        points = List.copyOf(points);
    }

    /** A boundary needs at least three vertices to enclose anything. */
    public boolean hasEnoughVertices() {
        return points.size() >= MIN_VERTICES;
    }
}
