package com.example.cameratrap.util;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;

/**
 * Builds WGS 84 points. JTS orders coordinates as (x, y), so longitude comes first.
 */
public final class GeoPoints {

    public static final int WGS84_SRID = 4326;

    private static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    private GeoPoints() {
    }

    public static Point of(double latitude, double longitude) {
        GeoValidator.requireValidCoordinate(latitude, longitude);
        return FACTORY.createPoint(new Coordinate(longitude, latitude));
    }

    public static GeometryFactory factory() {
        return FACTORY;
    }
}
