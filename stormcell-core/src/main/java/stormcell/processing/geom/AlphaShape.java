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
package stormcell.processing.geom;

import stormcell.data_structure.Boundary;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateArrays;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Triangle;
import org.locationtech.jts.operation.union.CascadedPolygonUnion;
import org.locationtech.jts.triangulate.DelaunayTriangulationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Concave hull of a point set: union of the Delaunay triangles whose circumradius is lower than {@code 1/alpha}.
 * {@code alpha <= 0} yields the convex hull; higher values follow concavities more tightly.
 * @author Jean Ollion
 */
public class AlphaShape {
    public final static Logger logger = LoggerFactory.getLogger(AlphaShape.class);

    /**
     * @param points (x=lon, y=lat) coordinates. Duplicated points are ignored
     * @return an empty geometry if there are no points, a point or line for 1 or 2 distinct points or collinear points, a polygonal geometry otherwise.
     * The polygonal result may be empty if no triangle passes the radius criterion
     */
    public static Geometry compute(Coordinate[] points, double alpha, GeometryFactory factory) {
        if (points==null || points.length==0) return factory.createPolygon();
        Coordinate[] unique = unique(points);
        Geometry hull = factory.createMultiPointFromCoords(unique).convexHull();
        if (!(hull instanceof Polygon) || alpha <= 0) return hull;
        double maxRadius = 1. / alpha;
        DelaunayTriangulationBuilder builder = new DelaunayTriangulationBuilder();
        builder.setSites(Arrays.asList(unique));
        Geometry triangles = builder.getTriangles(factory);
        List<Geometry> kept = new ArrayList<>(triangles.getNumGeometries());
        for (int i = 0; i<triangles.getNumGeometries(); ++i) {
            Geometry t = triangles.getGeometryN(i);
            Coordinate[] c = t.getCoordinates();
            if (t.getArea()==0) continue;
            if (circumradius(c[0], c[1], c[2]) < maxRadius) kept.add(t);
        }
        logger.trace("alpha shape: {} points, {}/{} triangles kept", unique.length, kept.size(), triangles.getNumGeometries());
        if (kept.isEmpty()) return factory.createPolygon();
        if (kept.size()==triangles.getNumGeometries()) return hull;
        return CascadedPolygonUnion.union(kept);
    }

    public static double circumradius(Coordinate a, Coordinate b, Coordinate c) {
        Coordinate center = Triangle.circumcentre(a, b, c);
        return center.distance(a);
    }

    static Coordinate[] unique(Coordinate[] points) {
        Coordinate[] sorted = CoordinateArrays.copyDeep(points);
        Arrays.sort(sorted);
        return CoordinateArrays.removeRepeatedPoints(sorted);
    }

    public static Boundary computeBoundary(Coordinate[] points, double alpha) {
        return Boundary.of(compute(points, alpha, Boundary.FACTORY));
    }
}
