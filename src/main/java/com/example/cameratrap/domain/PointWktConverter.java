package com.example.cameratrap.domain;

import com.example.cameratrap.util.GeoPoints;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

/**
 * Stores WGS 84 points as WKT so the column works on databases without a spatial extension.
 */
@Converter
public class PointWktConverter implements AttributeConverter<Point, String> {

    @Override
    public String convertToDatabaseColumn(Point attribute) {
        return attribute == null ? null : new WKTWriter().write(attribute);
    }

    @Override
    public Point convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            Geometry geometry = new WKTReader(GeoPoints.factory()).read(dbData);
            if (!(geometry instanceof Point point)) {
                throw new IllegalArgumentException("Expected a POINT geometry but found " + geometry.getGeometryType());
            }
            return point;
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid WKT point: " + dbData, ex);
        }
    }
}
