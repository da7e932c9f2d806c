package com.tazifor.elevations.geo.spi;

import com.tazifor.elevations.geo.model.CellId;
import com.tazifor.elevations.geo.model.Polygon;

import java.util.Optional;
import java.util.Set;

/**
 * The {@code CellCodec} interface defines the contract for encoding geographic
 * locations into hierarchical grid cells and for checking cell identifiers.
 * <p>
 * Elevation lookups are always keyed on cell identifiers, whatever shape the
 * caller used to address them. The codec is the only place that knows how a
 * coordinate or a polygon becomes a set of cells.
 * </p>
 *
 * <h3>Example usage</h3>
 * <pre>{@code
 * CellCodec codec = new H3CellCodec();
 * CellId cell = codec.fromCoordinate(54.53097, 5.96836, 12);
 * boolean ok = codec.validate(cell.value());
 * Set<CellId> covering = codec.cellsCoveringPolygon(area, 10);
 * }</pre>
 *
 * @see H3CellCodec
 */
public interface CellCodec {

    /**
     * Structural well-formedness check. Does not consult any store.
     *
     * @param id raw 64-bit cell index
     * @return {@code true} if {@code id} is a valid cell of the grid
     */
    boolean validate(long id);

    /**
     * Returns the resolution level encoded in a valid cell identifier.
     *
     * @param cell a cell that passed {@link #validate(long)}
     * @return the resolution of {@code cell}
     */
    int resolutionOf(CellId cell);

    /**
     * Computes the cell containing a point at the given resolution.
     * <p>
     * Deterministic: the same {@code (lat, lng, resolution)} always yields the
     * same cell. Coarser resolutions yield the containing parent cells.
     * </p>
     *
     * @param lat latitude in degrees
     * @param lng longitude in degrees
     * @param resolution grid resolution
     * @return the containing cell
     */
    CellId fromCoordinate(double lat, double lng, int resolution);

    /**
     * Returns the cells at {@code resolution} whose centers fall inside the polygon.
     * <p>
     * Small polygons at coarse resolutions can legitimately cover no cell
     * centers; the result is then empty rather than an error.
     * </p>
     *
     * @param polygon implicitly-closed boundary
     * @param resolution grid resolution
     * @return the covering cells, possibly empty
     * @throws CoverageTooLargeException if the grid library cannot fill the polygon at this resolution
     */
    Set<CellId> cellsCoveringPolygon(Polygon polygon, int resolution);

    /**
     * Rough number of cells needed to cover the polygon's bounding box at
     * {@code resolution}. Cheap enough to call before any polyfill.
     *
     * @param polygon implicitly-closed boundary
     * @param resolution grid resolution
     * @return bounding-box area divided by the average cell area
     */
    double estimatedCellCount(Polygon polygon, int resolution);

    /**
     * Parses the unsigned decimal text form of a cell identifier.
     *
     * @param text e.g. {@code "630949280220400639"}
     * @return the parsed identifier, or empty when {@code text} is not an unsigned 64-bit integer
     */
    Optional<CellId> parse(String text);
}
