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

/**
 * Storm cell detected in a single scan. The id is local to the scan.
 * Geometry (boundary, bounds) is set once the pixel mask is final, and updated when cells are merged.
 * @author Jean Ollion
 */
public class CandidateCell implements StormObject {
    int id;
    final CoordCollection pixels;
    int numGates;
    double maxReflectivity;
    GeoPoint centroid;
    Boundary boundary = Boundary.EMPTY;
    BoundingBox bounds;
    String timestamp;

    public CandidateCell(int id, CoordCollection pixels) {
        this.id = id;
        this.pixels = pixels;
        this.numGates = pixels==null ? 0 : pixels.size();
    }

    /**
     * Cell described only by its attributes, without pixel mask
     */
    public CandidateCell(int id, int numGates, double maxReflectivity, GeoPoint centroid) {
        this(id, null);
        this.numGates = numGates;
        this.maxReflectivity = maxReflectivity;
        this.centroid = centroid;
    }

    @Override
    public int getId() {
        return id;
    }

    public CandidateCell setId(int id) {
        this.id = id;
        return this;
    }

    /**
     * @return pixel mask, null if the cell was not built from a grid
     */
    public CoordCollection getPixels() {
        return pixels;
    }

    @Override
    public int getNumGates() {
        return numGates;
    }

    public CandidateCell setNumGates(int numGates) {
        this.numGates = numGates;
        return this;
    }

    @Override
    public double getMaxReflectivity() {
        return maxReflectivity;
    }

    public CandidateCell setMaxReflectivity(double maxReflectivity) {
        this.maxReflectivity = maxReflectivity;
        return this;
    }

    @Override
    public GeoPoint getCentroid() {
        return centroid;
    }

    public CandidateCell setCentroid(GeoPoint centroid) {
        this.centroid = centroid;
        return this;
    }

    @Override
    public Boundary getBoundary() {
        return boundary;
    }

    public CandidateCell setBoundary(Boundary boundary) {
        this.boundary = boundary==null ? Boundary.EMPTY : boundary;
        return this;
    }

    @Override
    public BoundingBox getBounds() {
        return bounds;
    }

    public CandidateCell setBounds(BoundingBox bounds) {
        this.bounds = bounds;
        return this;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public CandidateCell setTimestamp(String timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    @Override
    public String toString() {
        return "Cell#"+id+"[gates="+numGates+", max="+maxReflectivity+", centroid="+centroid+", "+boundary+"]";
    }
}
