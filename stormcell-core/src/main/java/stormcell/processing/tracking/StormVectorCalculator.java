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
package stormcell.processing.tracking;

import stormcell.data_structure.HistorySnapshot;
import stormcell.data_structure.TrackedCell;
import stormcell.data_structure.TrackedCellCollection;
import stormcell.utils.GeoUtils;
import stormcell.utils.TimestampUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Motion between two successive snapshots of a track, stored on the most recent one:
 * {@code dx} (east-west, m), {@code dy} (north-south, m) and {@code dt} (s).
 * Speed is {@code sqrt(dx²+dy²)/dt} and bearing {@code atan2(dy, dx)}
 * @author Jean Ollion
 */
public class StormVectorCalculator {
    public final static Logger logger = LoggerFactory.getLogger(StormVectorCalculator.class);

    /**
     * Sets motion of {@param current} relative to {@param previous}
     * @return false if motion could not be computed (missing centroid or unparseable timestamp)
     */
    public static boolean computeMotion(HistorySnapshot previous, HistorySnapshot current) {
        if (previous.getCentroid()==null || current.getCentroid()==null) return false;
        double dt;
        try {
            dt = TimestampUtils.secondsBetween(previous.getTimestamp(), current.getTimestamp());
        } catch (IllegalArgumentException e) {
            logger.warn("cannot compute motion between {} and {}: {}", previous.getTimestamp(), current.getTimestamp(), e.getMessage());
            return false;
        }
        double[] d = GeoUtils.displacementMeters(previous.getCentroid().lat, previous.getCentroid().lon, current.getCentroid().lat, current.getCentroid().lon);
        current.setMotion(d[0], d[1], dt);
        return true;
    }

    /**
     * Computes motion of the last snapshot of {@param cell} from the two last snapshots. Does nothing if history has less than 2 snapshots
     * @return true if motion was computed
     */
    public static boolean computeLatest(TrackedCell cell) {
        List<HistorySnapshot> history = cell.getHistory();
        if (history.size()<2) return false;
        boolean ok = computeMotion(history.get(history.size()-2), history.get(history.size()-1));
        if (ok) logger.trace("track {}: {}", cell.getId(), cell.getLastSnapshot());
        return ok;
    }

    /**
     * Computes motion of the snapshot at {@param timestamp} and of the snapshot that follows it, whose motion depends on it
     * @return number of computed snapshots
     */
    public static int computeAround(TrackedCell cell, String timestamp) {
        List<HistorySnapshot> history = cell.getHistory();
        int idx = -1;
        for (int i = 0; i<history.size(); ++i) {
            if (history.get(i).getTimestamp().equals(timestamp)) {
                idx = i;
                break;
            }
        }
        if (idx<0) return 0;
        int count = 0;
        if (idx>0 && computeMotion(history.get(idx-1), history.get(idx))) ++count;
        if (idx+1<history.size() && computeMotion(history.get(idx), history.get(idx+1))) ++count;
        return count;
    }

    /**
     * Computes motion of every snapshot of {@param cell} that has a predecessor
     * @param onlyMissing if true, snapshots that already carry motion are not recomputed
     * @return number of computed snapshots
     */
    public static int computeAll(TrackedCell cell, boolean onlyMissing) {
        List<HistorySnapshot> history = cell.getHistory();
        int count = 0;
        for (int i = 1; i<history.size(); ++i) {
            if (onlyMissing && history.get(i).hasMotion()) continue;
            if (computeMotion(history.get(i-1), history.get(i))) ++count;
        }
        return count;
    }

    /**
     * Computes motion of the last snapshot of every track of {@param cells}
     * @return number of tracks whose motion was computed
     */
    public static int computeLatest(TrackedCellCollection cells) {
        return (int)cells.stream().filter(StormVectorCalculator::computeLatest).count();
    }
}
