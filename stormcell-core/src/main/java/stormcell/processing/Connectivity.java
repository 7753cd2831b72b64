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
package stormcell.processing;

/**
 * Neighborhood used to label connected seed regions
 * @author Jean Ollion
 */
public enum Connectivity {
    FOUR(new int[][]{{-1, 0}, {0, -1}}, new int[][]{{-1, 0}, {1, 0}, {0, -1}, {0, 1}}),
    EIGHT(new int[][]{{-1, -1}, {0, -1}, {1, -1}, {-1, 0}}, new int[][]{{-1, -1}, {0, -1}, {1, -1}, {-1, 0}, {1, 0}, {-1, 1}, {0, 1}, {1, 1}});
    /** {dx, dy} of neighbors already visited in a raster scan */
    final int[][] half;
    final int[][] full;
    Connectivity(int[][] half, int[][] full) {
        this.half = half;
        this.full = full;
    }
    public int[][] getHalfNeighborhood() {
        return half;
    }
    public int[][] getNeighborhood() {
        return full;
    }
}
