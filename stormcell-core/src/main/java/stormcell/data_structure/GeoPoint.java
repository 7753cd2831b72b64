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

import java.util.List;

/**
 * Immutable (latitude, longitude) pair. Serialized as {@code [lat, lon]}
 * @author Jean Ollion
 */
public class GeoPoint {
    public final double lat, lon;

    public GeoPoint(double lat, double lon) {
        this.lat = lat;
        this.lon = lon;
    }

    public double distanceDeg(GeoPoint other) {
        double dLat = lat - other.lat;
        double dLon = lon - other.lon;
        return Math.sqrt(dLat * dLat + dLon * dLon);
    }

    public JSONArray toJSONEntry(int decimalPlaces) {
        JSONArray res = new JSONArray();
        res.add(JSONUtils.round(lat, decimalPlaces));
        res.add(JSONUtils.round(lon, decimalPlaces));
        return res;
    }

    public static GeoPoint fromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof List) || ((List)jsonEntry).size()!=2) throw new IllegalArgumentException("Invalid centroid: "+jsonEntry);
        List l = (List)jsonEntry;
        return new GeoPoint(((Number)l.get(0)).doubleValue(), ((Number)l.get(1)).doubleValue());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeoPoint)) return false;
        GeoPoint other = (GeoPoint) o;
        return Double.compare(other.lat, lat) == 0 && Double.compare(other.lon, lon) == 0;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 31 * hash + Double.hashCode(lat);
        hash = 31 * hash + Double.hashCode(lon);
        return hash;
    }

    @Override
    public String toString() {
        return "("+lat+";"+lon+")";
    }
}
