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
import stormcell.data_structure.BoundingBox;
import stormcell.data_structure.CandidateCell;
import stormcell.data_structure.CoordCollection;
import stormcell.image.ReflectivityGrid;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Computes the boundary of a cell from its pixels: alpha shape restricted to its largest polygon, and the bounding box of that shape
 * (or of the pixels themselves when no shape could be computed)
 * @author Jean Ollion
 */
public class BoundaryBuilder {
    public final static Logger logger = LoggerFactory.getLogger(BoundaryBuilder.class);

    /**
     * @return pixel locations as (x=lon, y=lat) coordinates
     */
    public static Coordinate[] getPoints(CoordCollection mask, ReflectivityGrid grid) {
        Coordinate[] res = new Coordinate[mask.size()];
        for (int i = 0; i<res.length; ++i) {
            int c = mask.get(i);
            res[i] = new Coordinate(grid.getLongitude(c), grid.getLatitude(c));
        }
        return res;
    }

    public static Boundary buildBoundary(Coordinate[] points, double alpha) {
        Boundary b = AlphaShape.computeBoundary(points, alpha);
        if (b.getKind()==Boundary.Kind.MULTI_POLYGON) logger.trace("alpha shape split into {} parts: keeping largest", b.getGeometry().getNumGeometries());
        return b.largestComponent();
    }

    /**
     * @return envelope of {@param boundary} if not empty, of {@param points} otherwise. null if both are empty
     */
    public static BoundingBox getBounds(Boundary boundary, Coordinate[] points) {
        if (boundary.getKind()!=Boundary.Kind.EMPTY) return boundary.getBounds();
        if (points==null || points.length==0) return null;
        Envelope env = new Envelope();
        for (Coordinate c : points) env.expandToInclude(c);
        return BoundingBox.fromEnvelope(env);
    }

    /**
     * Sets boundary and bounding box of {@param cell} from its pixels
     */
    public static CandidateCell build(CandidateCell cell, ReflectivityGrid grid, double alpha) {
        Coordinate[] points = getPoints(cell.getPixels(), grid);
        Boundary boundary = buildBoundary(points, alpha);
        if (!boundary.isPolygonal()) logger.debug("cell {}: insufficient geometry ({}), bounding box fallback", cell.getId(), boundary.getKind());
        return cell.setBoundary(boundary).setBounds(getBounds(boundary, points));
    }

    public static void build(List<CandidateCell> cells, ReflectivityGrid grid, double alpha) {
        for (CandidateCell c : cells) build(c, grid, alpha);
    }
}
