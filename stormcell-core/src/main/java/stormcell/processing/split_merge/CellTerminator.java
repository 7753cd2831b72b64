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
package stormcell.processing.split_merge;

import stormcell.data_structure.StormObject;
import stormcell.utils.GeoUtils;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.TopologyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Drops cells whose polygon is mostly covered by the polygon of a larger cell. Cells are ranked by gate count, ties by input order.
 * Cells without polygon are never covered.
 * @author Jean Ollion
 */
public class CellTerminator {
    public final static Logger logger = LoggerFactory.getLogger(CellTerminator.class);

    /**
     * @return cells that are not terminated, in input order
     */
    public static <T extends StormObject> List<T> terminate(List<T> cells, double coverageThresholdPct) {
        boolean[] terminated = getTerminated(cells, coverageThresholdPct);
        List<T> res = new ArrayList<>(cells.size());
        for (int i = 0; i<cells.size(); ++i) if (!terminated[i]) res.add(cells.get(i));
        return res;
    }

    /**
     * @return terminated cells, in input order
     */
    public static <T extends StormObject> List<T> getTerminatedCells(List<T> cells, double coverageThresholdPct) {
        boolean[] terminated = getTerminated(cells, coverageThresholdPct);
        List<T> res = new ArrayList<>();
        for (int i = 0; i<cells.size(); ++i) if (terminated[i]) res.add(cells.get(i));
        return res;
    }

    /**
     * @return for each cell, whether it is covered at least {@param coverageThresholdPct} % by a larger cell that is not terminated itself
     */
    public static boolean[] getTerminated(List<? extends StormObject> cells, double coverageThresholdPct) {
        boolean[] terminated = new boolean[cells.size()];
        if (cells.size() <= 1) return terminated;
        List<Integer> order = new ArrayList<>(cells.size());
        for (int i = 0; i<cells.size(); ++i) order.add(i);
        order.sort(Comparator.comparingInt((Integer i) -> cells.get(i).getNumGates()).reversed()); // stable: ties keep input order
        for (int rank = 1; rank<order.size(); ++rank) {
            int s = order.get(rank);
            StormObject smaller = cells.get(s);
            for (int r = 0; r<rank; ++r) {
                int l = order.get(r);
                if (terminated[l]) continue;
                StormObject larger = cells.get(l);
                double pct = getCoveragePct(smaller, larger);
                if (pct >= coverageThresholdPct) {
                    terminated[s] = true;
                    logger.debug("terminating cell {} ({} km²): {}% covered by cell {} ({} km²)", smaller.getId(), String.format("%.1f", GeoUtils.areaKm2(smaller.getPolygon())), String.format("%.1f", pct), larger.getId(), String.format("%.1f", GeoUtils.areaKm2(larger.getPolygon())));
                    break;
                }
            }
        }
        return terminated;
    }

    /**
     * @return percentage of the polygon area of {@param covered} that lies within the polygon of {@param covering}. 0 if one of the cells has no polygon
     */
    public static double getCoveragePct(StormObject covered, StormObject covering) {
        Polygon p1 = covered.getPolygon();
        Polygon p2 = covering.getPolygon();
        if (p1==null || p2==null) return 0;
        double area = GeoUtils.areaKm2(p1);
        if (area <= 0) return 0;
        try {
            if (!p1.getEnvelopeInternal().intersects(p2.getEnvelopeInternal())) return 0;
            Geometry inter = p1.intersection(p2);
            if (inter.isEmpty()) return 0;
            return 100 * GeoUtils.areaKm2(inter) / area;
        } catch (TopologyException e) {
            logger.warn("could not compute overlap of cells {} and {}: {}", covered.getId(), covering.getId(), e.getMessage());
            return 0;
        }
    }
}
