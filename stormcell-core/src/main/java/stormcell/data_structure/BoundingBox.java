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
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latitude / longitude envelope. Immutable.
 * @author Jean Ollion
 */
public class BoundingBox {
    final double latMin, latMax, lonMin, lonMax;

    public BoundingBox(double latMin, double latMax, double lonMin, double lonMax) {
        if (latMin > latMax || lonMin > lonMax) throw new IllegalArgumentException("Invalid bounding box: lat ["+latMin+";"+latMax+"] lon ["+lonMin+";"+lonMax+"]");
        this.latMin = latMin;
        this.latMax = latMax;
        this.lonMin = lonMin;
        this.lonMax = lonMax;
    }

    /**
     * @param envelope envelope in (x=lon, y=lat) coordinates
     */
    public static BoundingBox fromEnvelope(Envelope envelope) {
        if (envelope==null || envelope.isNull()) return null;
        return new BoundingBox(envelope.getMinY(), envelope.getMaxY(), envelope.getMinX(), envelope.getMaxX());
    }

    public double getLatMin() {return latMin;}
    public double getLatMax() {return latMax;}
    public double getLonMin() {return lonMin;}
    public double getLonMax() {return lonMax;}

    public BoundingBox union(BoundingBox other) {
        if (other==null) return this;
        return new BoundingBox(Math.min(latMin, other.latMin), Math.max(latMax, other.latMax), Math.min(lonMin, other.lonMin), Math.max(lonMax, other.lonMax));
    }

    public BoundingBox dilate(double latBuffer, double lonBuffer) {
        return new BoundingBox(latMin - latBuffer, latMax + latBuffer, lonMin - lonBuffer, lonMax + lonBuffer);
    }

    /**
     * @return true if both boxes intersect, touching boxes included
     */
    public boolean intersects(BoundingBox other) {
        return !(lonMax < other.lonMin || lonMin > other.lonMax || latMax < other.latMin || latMin > other.latMax);
    }

    public boolean contains(BoundingBox other) {
        return latMin <= other.latMin && latMax >= other.latMax && lonMin <= other.lonMin && lonMax >= other.lonMax;
    }

    public boolean contains(double lat, double lon) {
        return lat >= latMin && lat <= latMax && lon >= lonMin && lon <= lonMax;
    }

    public Envelope toEnvelope() {
        return new Envelope(lonMin, lonMax, latMin, latMax);
    }

    /**
     * @return box polygon in (x=lon, y=lat) coordinates; degenerate boxes yield a point or line geometry
     */
    public Geometry toGeometry(GeometryFactory factory) {
        return factory.toGeometry(toEnvelope());
    }

    public Map<String, Object> toJSONEntry(int decimalPlaces) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put("lat_min", JSONUtils.round(latMin, decimalPlaces));
        res.put("lat_max", JSONUtils.round(latMax, decimalPlaces));
        res.put("lon_min", JSONUtils.round(lonMin, decimalPlaces));
        res.put("lon_max", JSONUtils.round(lonMax, decimalPlaces));
        return res;
    }

    public static BoundingBox fromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Invalid bbox: "+jsonEntry);
        Map m = (Map)jsonEntry;
        return new BoundingBox(getDouble(m, "lat_min"), getDouble(m, "lat_max"), getDouble(m, "lon_min"), getDouble(m, "lon_max"));
    }

    private static double getDouble(Map m, String key) {
        Object o = m.get(key);
        if (!(o instanceof Number)) throw new IllegalArgumentException("Invalid bbox: missing or non numeric "+key);
        return ((Number)o).doubleValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox)) return false;
        BoundingBox b = (BoundingBox) o;
        return b.latMin == latMin && b.latMax == latMax && b.lonMin == lonMin && b.lonMax == lonMax;
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 53 * hash + Double.hashCode(latMin);
        hash = 53 * hash + Double.hashCode(latMax);
        hash = 53 * hash + Double.hashCode(lonMin);
        hash = 53 * hash + Double.hashCode(lonMax);
        return hash;
    }

    @Override
    public String toString() {
        return "[lat:"+latMin+"->"+latMax+"; lon:"+lonMin+"->"+lonMax+"]";
    }
}
