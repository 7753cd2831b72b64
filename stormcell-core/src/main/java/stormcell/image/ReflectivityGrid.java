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
package stormcell.image;

/**
 * One radar scan: a 2D reflectivity array (dBZ) with its latitude / longitude coordinates and scan timestamp.
 * Pixels are indexed in row-major order: {@code idx = x + y * sizeX} with x the column and y the row.
 * @author Jean Ollion
 */
public class ReflectivityGrid {
    final int sizeX, sizeY;
    final double[] pixels;
    final double[] latitude, longitude;
    final String timestamp;
    final double noDataValue;

    /**
     * @param reflectivity values indexed [row][column]. NaN or values lower or equal to {@param noDataValue} are missing data
     * @param latitude either 1D (one value per row) or 2D with the same shape as {@param reflectivity}
     * @param longitude either 1D (one value per column) or 2D with the same shape as {@param reflectivity}
     * @throws IllegalArgumentException if shapes are inconsistent
     */
    public ReflectivityGrid(double[][] reflectivity, Object latitude, Object longitude, String timestamp, double noDataValue) {
        if (reflectivity==null) throw new IllegalArgumentException("Null reflectivity array");
        this.sizeY = reflectivity.length;
        this.sizeX = sizeY == 0 ? 0 : reflectivity[0].length;
        this.pixels = new double[sizeX * sizeY];
        for (int y = 0; y<sizeY; ++y) {
            if (reflectivity[y]==null || reflectivity[y].length!=sizeX) throw new IllegalArgumentException("Ragged reflectivity array: row "+y+" has "+(reflectivity[y]==null ? 0 : reflectivity[y].length)+" columns instead of "+sizeX);
            int off = y * sizeX;
            for (int x = 0; x<sizeX; ++x) pixels[off + x] = reflectivity[y][x];
        }
        this.latitude = expand(latitude, true, "latitude");
        this.longitude = expand(longitude, false, "longitude");
        this.timestamp = timestamp;
        this.noDataValue = noDataValue;
    }

    public ReflectivityGrid(double[][] reflectivity, Object latitude, Object longitude, String timestamp) {
        this(reflectivity, latitude, longitude, timestamp, -9999);
    }

    private double[] expand(Object coords, boolean alongRows, String name) {
        int n = sizeX * sizeY;
        if (coords == null) throw new IllegalArgumentException("Null "+name+" array");
        if (coords instanceof double[]) {
            double[] c = (double[]) coords;
            int expected = alongRows ? sizeY : sizeX;
            if (c.length != expected) throw new IllegalArgumentException("1D "+name+" array has "+c.length+" values instead of "+expected);
            double[] res = new double[n];
            for (int y = 0; y<sizeY; ++y) {
                for (int x = 0; x<sizeX; ++x) res[x + y * sizeX] = alongRows ? c[y] : c[x];
            }
            return res;
        } else if (coords instanceof double[][]) {
            double[][] c = (double[][]) coords;
            if (c.length != sizeY) throw new IllegalArgumentException("2D "+name+" array has "+c.length+" rows instead of "+sizeY);
            double[] res = new double[n];
            for (int y = 0; y<sizeY; ++y) {
                if (c[y]==null || c[y].length != sizeX) throw new IllegalArgumentException("2D "+name+" array row "+y+" does not have "+sizeX+" columns");
                System.arraycopy(c[y], 0, res, y * sizeX, sizeX);
            }
            return res;
        } else throw new IllegalArgumentException(name+" must be a double[] or double[][], found: "+coords.getClass().getSimpleName());
    }

    public int sizeX() {
        return sizeX;
    }

    public int sizeY() {
        return sizeY;
    }

    public int getPixelCount() {
        return pixels.length;
    }

    public boolean isEmpty() {
        return pixels.length == 0;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public double getNoDataValue() {
        return noDataValue;
    }

    public int toIndex(int x, int y) {
        return x + y * sizeX;
    }

    public int getX(int idx) {
        return idx % sizeX;
    }

    public int getY(int idx) {
        return idx / sizeX;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < sizeX && y < sizeY;
    }

    /**
     * @return reflectivity at {@param idx} or NaN if missing
     */
    public double getPixel(int idx) {
        double v = pixels[idx];
        if (Double.isNaN(v) || v <= noDataValue) return Double.NaN;
        return v;
    }

    public double getPixel(int x, int y) {
        return getPixel(toIndex(x, y));
    }

    /**
     * @return true if reflectivity at {@param idx} is present and greater or equal to {@param threshold}
     */
    public boolean isAbove(int idx, double threshold) {
        double v = getPixel(idx);
        return !Double.isNaN(v) && v >= threshold;
    }

    /**
     * @return max of valid values, NaN if no value is valid
     */
    public double getMaxValue() {
        double max = Double.NaN;
        for (int i = 0; i<pixels.length; ++i) {
            double v = getPixel(i);
            if (!Double.isNaN(v) && (Double.isNaN(max) || v > max)) max = v;
        }
        return max;
    }

    public double getLatitude(int idx) {
        return latitude[idx];
    }

    /**
     * @return longitude in the convention of the input coordinates (0-360 for MRMS grids)
     */
    public double getLongitude(int idx) {
        return longitude[idx];
    }

    @Override
    public String toString() {
        return "ReflectivityGrid["+sizeX+"x"+sizeY+(timestamp==null ? "" : " @"+timestamp)+"]";
    }
}
