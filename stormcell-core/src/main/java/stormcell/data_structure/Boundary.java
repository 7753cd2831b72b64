/* 
 * Copyright (C) 2025 Jean Ollion
 *
 * This File is part of STORMCELL
 *
 * STORMCELL is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * STORMCELL is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with STORMCELL.  If not, see <http://www.gnu.org/licenses/>.
 */
package stormcell.data_structure;

import stormcell.utils.JSONUtils;
import org.json.simple.JSONArray;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Geometry of a cell boundary in (x=lon, y=lat) coordinates, tagged by its kind.
 * Only {@link Kind#POLYGON} boundaries are persisted as a ring; other kinds fall back to the bounding box downstream.
 * @author Jean Ollion
 */
public class Boundary {
    public final static Logger logger = LoggerFactory.getLogger(Boundary.class);
    public static final GeometryFactory FACTORY = new GeometryFactory();
    public enum Kind {EMPTY, POINT, LINE, POLYGON, MULTI_POLYGON}
    public static final Boundary EMPTY = new Boundary(Kind.EMPTY, FACTORY.createPolygon());

    final Kind kind;
    final Geometry geometry;

    private Boundary(Kind kind, Geometry geometry) {
        this.kind = kind;
        this.geometry = geometry;
    }

    /**
     * Wraps {@param geometry}. Invalid polygonal geometries are repaired with a zero-width buffer; if repair fails the boundary is empty
     */
    public static Boundary of(Geometry geometry) {
        if (geometry==null || geometry.isEmpty()) return EMPTY;
        switch (geometry.getDimension()) {
            case 0:
                return new Boundary(Kind.POINT, geometry);
            case 1:
                return new Boundary(Kind.LINE, geometry);
            default:
                if (!geometry.isValid()) {
                    Geometry repaired = geometry.buffer(0);
                    logger.debug("invalid boundary repaired: area {} -> {}", geometry.getArea(), repaired.getArea());
                    if (repaired.isEmpty() || repaired.getDimension()<2) {
                        logger.warn("boundary could not be repaired: {}", geometry.getGeometryType());
                        return EMPTY;
                    }
                    geometry = repaired;
                }
                if (geometry instanceof Polygon) return new Boundary(Kind.POLYGON, geometry);
                else return new Boundary(Kind.MULTI_POLYGON, geometry);
        }
    }

    /**
     * @param ring ordered [[lon, lat], ...] coordinates, closed or not
     * @return a polygon boundary, or {@link #EMPTY} if the ring has less than 3 distinct points
     */
    public static Boundary fromRing(List<double[]> ring) {
        if (ring==null || ring.size()<3) return EMPTY;
        List<Coordinate> coords = new ArrayList<>(ring.size()+1);
        for (double[] c : ring) coords.add(new Coordinate(c[0], c[1]));
        if (!coords.get(0).equals2D(coords.get(coords.size()-1))) coords.add(new Coordinate(coords.get(0)));
        if (coords.size()<4) return EMPTY;
        LinearRing shell = FACTORY.createLinearRing(coords.toArray(new Coordinate[0]));
        return of(FACTORY.createPolygon(shell));
    }

    public Kind getKind() {
        return kind;
    }

    public Geometry getGeometry() {
        return geometry;
    }

    public boolean isPolygonal() {
        return kind==Kind.POLYGON || kind==Kind.MULTI_POLYGON;
    }

    /**
     * @return the polygon itself, the component of greatest area of a multi-polygon, or null for other kinds
     */
    public Polygon getLargestPolygon() {
        switch (kind) {
            case POLYGON:
                return (Polygon)geometry;
            case MULTI_POLYGON:
                Polygon res = null;
                for (int i = 0; i<geometry.getNumGeometries(); ++i) {
                    Geometry g = geometry.getGeometryN(i);
                    if (g instanceof Polygon && (res==null || g.getArea()>res.getArea())) res = (Polygon)g;
                }
                return res;
            default:
                return null;
        }
    }

    /**
     * @return boundary restricted to its largest polygon if it is a multi-polygon, this boundary otherwise
     */
    public Boundary largestComponent() {
        if (kind!=Kind.MULTI_POLYGON) return this;
        Polygon p = getLargestPolygon();
        return p==null ? EMPTY : new Boundary(Kind.POLYGON, p);
    }

    public double getArea() {
        return isPolygonal() ? geometry.getArea() : 0;
    }

    /**
     * @return exterior ring of the largest polygon as [lon, lat] pairs, empty if the boundary is not polygonal
     */
    public List<double[]> getRing() {
        Polygon p = getLargestPolygon();
        List<double[]> res = new ArrayList<>();
        if (p==null) return res;
        for (Coordinate c : p.getExteriorRing().getCoordinates()) res.add(new double[]{c.x, c.y});
        return res;
    }

    /**
     * @return all vertices of the geometry
     */
    public Coordinate[] getPoints() {
        return geometry.getCoordinates();
    }

    public BoundingBox getBounds() {
        return BoundingBox.fromEnvelope(geometry.getEnvelopeInternal());
    }

    public JSONArray toJSONEntry(int decimalPlaces) {
        JSONArray res = new JSONArray();
        for (double[] c : getRing()) {
            JSONArray coord = new JSONArray();
            coord.add(JSONUtils.round(c[0], decimalPlaces));
            coord.add(JSONUtils.round(c[1], decimalPlaces));
            res.add(coord);
        }
        return res;
    }

    public static Boundary fromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof List)) return EMPTY;
        List<double[]> ring = new ArrayList<>();
        for (Object o : (List)jsonEntry) {
            double[] c = JSONUtils.fromDoubleArray((List)o);
            if (c.length<2) throw new IllegalArgumentException("Invalid ring coordinate: "+o);
            ring.add(c);
        }
        return fromRing(ring);
    }

    @Override
    public String toString() {
        return kind+(isPolygonal() ? "[area="+geometry.getArea()+"]" : "");
    }
}
