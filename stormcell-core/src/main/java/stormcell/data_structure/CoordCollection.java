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

import stormcell.image.ReflectivityGrid;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

import java.util.stream.IntStream;

/**
 * Set of pixel indices of a 2D grid, in insertion order. Pixel index is {@code x + y * sizeX}
 * @author Jean Ollion
 */
public class CoordCollection {
    final int sizeX, sizeY;
    final IntArrayList coords;
    final IntSet contained;

    public CoordCollection(int sizeX, int sizeY) {
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.coords = new IntArrayList();
        this.contained = new IntOpenHashSet();
    }

    public int sizeX() {
        return sizeX;
    }

    public int sizeY() {
        return sizeY;
    }

    public int size() {
        return coords.size();
    }

    public boolean isEmpty() {
        return coords.isEmpty();
    }

    public int get(int i) {
        return coords.getInt(i);
    }

    public IntList getCoords() {
        return coords;
    }

    public IntStream stream() {
        return coords.intStream();
    }

    public boolean contains(int coord) {
        return contained.contains(coord);
    }

    public boolean add(int coord) {
        if (!contained.add(coord)) return false;
        coords.add(coord);
        return true;
    }

    /**
     * @return number of added coordinates
     */
    public int addAll(CoordCollection other) {
        if (other.sizeX!=sizeX || other.sizeY!=sizeY) throw new IllegalArgumentException("Coordinate collections of different grid sizes");
        int count = 0;
        for (int i = 0; i<other.coords.size(); ++i) if (add(other.coords.getInt(i))) ++count;
        return count;
    }

    public boolean insideBounds(int coord, int dx, int dy) {
        int y = coord / sizeX;
        int x = coord - y * sizeX;
        x += dx;
        y += dy;
        return x>=0 && y>=0 && x<sizeX && y<sizeY;
    }

    public int translate(int coord, int dx, int dy) {
        return coord + dy * sizeX + dx;
    }

    public int getX(int coord) {
        return coord % sizeX;
    }

    public int getY(int coord) {
        return coord / sizeX;
    }

    /**
     * @return max valid value of {@param grid} within this collection, NaN if there is none
     */
    public double getMaxValue(ReflectivityGrid grid) {
        double max = Double.NaN;
        for (int i = 0; i<coords.size(); ++i) {
            double v = grid.getPixel(coords.getInt(i));
            if (!Double.isNaN(v) && (Double.isNaN(max) || v>max)) max = v;
        }
        return max;
    }

    public CoordCollection duplicate() {
        CoordCollection res = new CoordCollection(sizeX, sizeY);
        res.addAll(this);
        return res;
    }

    @Override
    public String toString() {
        return "Coords[n="+coords.size()+"]";
    }
}
