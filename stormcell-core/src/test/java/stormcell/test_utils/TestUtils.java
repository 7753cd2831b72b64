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
package stormcell.test_utils;

import stormcell.data_structure.Boundary;
import stormcell.data_structure.BoundingBox;
import stormcell.data_structure.CandidateCell;
import stormcell.data_structure.GeoPoint;
import stormcell.image.ReflectivityGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Synthetic scans and cells
 * @author Jean Ollion
 */
public class TestUtils {
    public static final Logger logger = LoggerFactory.getLogger(TestUtils.class);
    public static final double LAT0 = 35, LON0 = 262, STEP = 0.01;

    public static double[][] values(int sizeX, int sizeY, double background) {
        double[][] res = new double[sizeY][sizeX];
        for (double[] row : res) Arrays.fill(row, background);
        return res;
    }

    /**
     * Sets {@param value} in the rectangle of {@param width} x {@param height} pixels starting at column {@param x0} and row {@param y0}
     */
    public static double[][] fill(double[][] values, int x0, int y0, int width, int height, double value) {
        for (int y = y0; y<y0+height; ++y) {
            for (int x = x0; x<x0+width; ++x) values[y][x] = value;
        }
        return values;
    }

    /**
     * @return grid with regular 1D coordinates: latitude {@link #LAT0} + y * {@link #STEP}, longitude {@link #LON0} + x * {@link #STEP}
     */
    public static ReflectivityGrid grid(double[][] values, String timestamp) {
        int sizeY = values.length;
        int sizeX = sizeY==0 ? 0 : values[0].length;
        double[] lat = new double[sizeY];
        double[] lon = new double[sizeX];
        for (int y = 0; y<sizeY; ++y) lat[y] = LAT0 + y * STEP;
        for (int x = 0; x<sizeX; ++x) lon[x] = LON0 + x * STEP;
        return new ReflectivityGrid(values, lat, lon, timestamp);
    }

    /**
     * Grid of {@param size} x {@param size} pixels with a square patch
     */
    public static ReflectivityGrid patchGrid(int size, int x0, int y0, int patchSize, double value, String timestamp) {
        return grid(fill(values(size, size, 0), x0, y0, patchSize, patchSize, value), timestamp);
    }

    public static Boundary rectangle(double latMin, double latMax, double lonMin, double lonMax) {
        return Boundary.fromRing(Arrays.asList(new double[]{lonMin, latMin}, new double[]{lonMax, latMin}, new double[]{lonMax, latMax}, new double[]{lonMin, latMax}));
    }

    /**
     * @return cell without pixel mask, with a rectangular boundary, its bounding box and centered centroid
     */
    public static CandidateCell rectangleCell(int id, int numGates, double maxReflectivity, double latMin, double latMax, double lonMin, double lonMax) {
        return new CandidateCell(id, numGates, maxReflectivity, new GeoPoint((latMin+latMax)/2, (lonMin+lonMax)/2))
                .setBoundary(rectangle(latMin, latMax, lonMin, lonMax))
                .setBounds(new BoundingBox(latMin, latMax, lonMin, lonMax));
    }

    /**
     * @return square cell of half size {@param halfSize} degrees centered on ({@param lat}, {@param lon})
     */
    public static CandidateCell squareCell(int id, int numGates, double maxReflectivity, double lat, double lon, double halfSize) {
        return rectangleCell(id, numGates, maxReflectivity, lat-halfSize, lat+halfSize, lon-halfSize, lon+halfSize);
    }
}
