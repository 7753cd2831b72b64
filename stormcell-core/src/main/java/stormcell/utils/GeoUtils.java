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
package stormcell.utils;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;

/**
 * Flat-earth conversions between degrees and distances, valid at the scale of a storm cell.
 * Longitudes may follow either the 0-360 or the +-180 convention, as long as both operands use the same one.
 * @author Jean Ollion
 */
public class GeoUtils {
    /** approximate length of one degree of latitude in km, used for gating and buffers */
    public static final double KM_PER_DEGREE = 111.0;
    /** length of one degree of latitude in meters, used for motion vectors */
    public static final double METERS_PER_DEGREE = 111320.0;
    public static final double EARTH_RADIUS_KM = 6371.0;

    public static double toPM180(double lon) {
        return lon > 180 ? lon - 360 : lon;
    }

    public static double to0360(double lon) {
        double res = lon % 360;
        return res < 0 ? res + 360 : res;
    }

    /**
     * @return {latitude degrees, longitude degrees} equivalent of {@param km} at latitude {@param lat}
     */
    public static double[] kmToDegrees(double lat, double km) {
        double latDeg = km / KM_PER_DEGREE;
        double lonDeg = km / (KM_PER_DEGREE * Math.cos(Math.toRadians(lat)));
        return new double[]{latDeg, lonDeg};
    }

    /**
     * @return absolute {east-west, north-south} displacement in km between two (lat, lon) points, east-west component corrected at mean latitude
     */
    public static double[] displacementKm(double lat1, double lon1, double lat2, double lon2) {
        double dx = Math.abs(lon1 - lon2) * KM_PER_DEGREE * Math.cos(Math.toRadians((lat1 + lat2) / 2));
        double dy = Math.abs(lat1 - lat2) * KM_PER_DEGREE;
        return new double[]{dx, dy};
    }

    /**
     * @return signed {east-west, north-south} displacement in meters from (lat1, lon1) to (lat2, lon2)
     */
    public static double[] displacementMeters(double lat1, double lon1, double lat2, double lon2) {
        double meanLat = (lat1 + lat2) / 2;
        double dx = (lon2 - lon1) * METERS_PER_DEGREE * Math.cos(Math.toRadians(meanLat));
        double dy = (lat2 - lat1) * METERS_PER_DEGREE;
        return new double[]{dx, dy};
    }

    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = phi2 - phi1;
        double dLambda = Math.toRadians(lon2 - lon1);
        double a = Math.pow(Math.sin(dPhi/2), 2) + Math.cos(phi1) * Math.cos(phi2) * Math.pow(Math.sin(dLambda/2), 2);
        return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    /**
     * Approximate area of a lon/lat geometry in km², using an equirectangular projection at the geometry's mean latitude
     */
    public static double areaKm2(Geometry geometry) {
        if (geometry==null || geometry.isEmpty()) return 0;
        Coordinate c = geometry.getCentroid().getCoordinate();
        if (c==null) return 0;
        double kmPerDegLon = KM_PER_DEGREE * Math.cos(Math.toRadians(c.y));
        return geometry.getArea() * KM_PER_DEGREE * kmPerDegLon;
    }
}
