package com.streamfirst.scenesearch.domain;

import java.util.Objects;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * Spatial search constraint. The geometry may be tagged with any EPSG code as SRID; catalogs and
 * tile grids work on {@link #geographic()}, the area in EPSG:4326 (x = longitude, y = latitude).
 * Geometries without an SRID (0) are taken to be geographic already.
 */
public record AreaOfInterest(Geometry geometry) {

    public static final int WGS84 = 4326;

    static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), WGS84);

    private static final CRSFactory CRS_FACTORY = new CRSFactory();
    private static final CoordinateTransformFactory TRANSFORMS = new CoordinateTransformFactory();

    public AreaOfInterest {
        Objects.requireNonNull(geometry, "Area geometry cannot be null");
        if (geometry.getSRID() < 0) {
            throw new ConfigurationException("invalid SRID " + geometry.getSRID());
        }
        if (geometry.isEmpty()) {
            throw new ConfigurationException("spatial filter geometry is empty");
        }
    }

    public static AreaOfInterest of(Geometry geometry) {
        return new AreaOfInterest(geometry);
    }

    /**
     * Reads a geographic area from well-known text.
     *
     * @throws ConfigurationException if the text is not valid WKT
     */
    public static AreaOfInterest fromWkt(String wkt) {
        try {
            return new AreaOfInterest(new WKTReader(FACTORY).read(wkt));
        } catch (ParseException e) {
            throw new ConfigurationException("invalid WKT geometry: " + wkt, e);
        }
    }

    public boolean isGeographic() {
        return geometry.getSRID() == 0 || geometry.getSRID() == WGS84;
    }

    /**
     * This area in geographic coordinates. Every vertex is transformed from the geometry's EPSG
     * reference system to EPSG:4326; geographic areas are returned as is.
     *
     * @throws ConfigurationException if the SRID is not a known EPSG code
     */
    public AreaOfInterest geographic() {
        if (isGeographic()) {
            return this;
        }
        CoordinateTransform transform = toGeographic(geometry.getSRID());
        Geometry projected = FACTORY.createGeometry(geometry);
        projected.apply(
                new CoordinateSequenceFilter() {
                    private final ProjCoordinate target = new ProjCoordinate();

                    @Override
                    public void filter(CoordinateSequence seq, int i) {
                        transform.transform(new ProjCoordinate(seq.getX(i), seq.getY(i)), target);
                        seq.setOrdinate(i, CoordinateSequence.X, target.x);
                        seq.setOrdinate(i, CoordinateSequence.Y, target.y);
                    }

                    @Override
                    public boolean isDone() {
                        return false;
                    }

                    @Override
                    public boolean isGeometryChanged() {
                        return true;
                    }
                });
        return new AreaOfInterest(projected);
    }

    private static CoordinateTransform toGeographic(int srid) {
        try {
            return TRANSFORMS.createTransform(
                    CRS_FACTORY.createFromName("EPSG:" + srid), CRS_FACTORY.createFromName("EPSG:" + WGS84));
        } catch (Proj4jException e) {
            throw new ConfigurationException("cannot reproject spatial filter from EPSG:" + srid, e);
        }
    }

    /** Bounds in the geometry's own reference system. */
    public Extent extent() {
        Envelope env = geometry.getEnvelopeInternal();
        return new Extent(env.getMinX(), env.getMinY(), env.getMaxX(), env.getMaxY());
    }

    /** The bounding box of the geometry; a point or line for degenerate extents. */
    public Geometry boundingBox() {
        return geometry.getFactory().toGeometry(geometry.getEnvelopeInternal());
    }

    /** Two-dimensional WKT of the geometry. */
    public String toWkt() {
        return new WKTWriter(2).write(geometry);
    }

    /** Whether a geographic {@code footprint} intersects the geographic bounding box of this area. */
    public boolean boundingBoxIntersects(Geometry footprint) {
        return footprint != null && geographic().boundingBox().intersects(footprint);
    }

    @Override
    public String toString() {
        return "AreaOfInterest" + extent();
    }
}
