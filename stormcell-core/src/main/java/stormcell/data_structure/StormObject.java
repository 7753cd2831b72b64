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

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

/**
 * Common view of detected and tracked storm cells used by matching and termination
 * @author Jean Ollion
 */
public interface StormObject {
    int getId();
    int getNumGates();
    double getMaxReflectivity();
    GeoPoint getCentroid();
    BoundingBox getBounds();
    Boundary getBoundary();

    /**
     * @return the boundary's largest polygon, or null if the boundary is not polygonal
     */
    default Polygon getPolygon() {
        Boundary b = getBoundary();
        return b==null ? null : b.getLargestPolygon();
    }

    /**
     * @return polygon if available, bounding box geometry otherwise. null if neither is available
     */
    default Geometry getFootprint() {
        Polygon p = getPolygon();
        if (p!=null) return p;
        BoundingBox bds = getBounds();
        return bds==null ? null : bds.toGeometry(Boundary.FACTORY);
    }
}
