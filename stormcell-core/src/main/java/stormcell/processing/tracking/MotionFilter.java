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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Removes tracks whose last displacement is implausibly large, which indicates a wrong association
 * @author Jean Ollion
 */
public class MotionFilter {
    public final static Logger logger = LoggerFactory.getLogger(MotionFilter.class);

    /**
     * @param maxDisplacementM maximal displacement in meters. 0 or negative: no filtering
     * @return ids of tracks whose last snapshot displacement exceeds {@param maxDisplacementM}
     */
    public static List<Integer> getOutliers(TrackedCellCollection cells, double maxDisplacementM) {
        if (maxDisplacementM <= 0) return Collections.emptyList();
        return cells.stream().filter(c -> {
            HistorySnapshot last = c.getLastSnapshot();
            return last!=null && last.hasMotion() && last.getDisplacement() > maxDisplacementM;
        }).map(TrackedCell::getId).collect(Collectors.toList());
    }

    /**
     * Removes outlier tracks from {@param cells}
     * @return removed ids
     */
    public static List<Integer> filter(TrackedCellCollection cells, double maxDisplacementM) {
        List<Integer> outliers = getOutliers(cells, maxDisplacementM);
        if (!outliers.isEmpty()) {
            cells.removeAll(outliers);
            logger.info("removed {} track(s) moving more than {} m: {}", outliers.size(), maxDisplacementM, outliers);
        }
        return outliers;
    }
}
