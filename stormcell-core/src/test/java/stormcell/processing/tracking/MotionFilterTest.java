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

import stormcell.data_structure.CandidateCell;
import stormcell.data_structure.GeoPoint;
import stormcell.data_structure.TrackedCell;
import stormcell.data_structure.TrackedCellCollection;
import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author Jean Ollion
 */
public class MotionFilterTest {

    static TrackedCell track(int id, double dx, double dy) {
        TrackedCell t = TrackedCell.create(id, new CandidateCell(id, 50, 55, new GeoPoint(35, -97)), "2024-05-01T12:00:00");
        t.getLastSnapshot().setMotion(dx, dy, 300);
        return t;
    }

    @Test
    public void testFilter() {
        TrackedCellCollection cells = new TrackedCellCollection()
                .add(track(1, 1000, 2000))
                .add(track(2, 8000, 6000))
                .add(TrackedCell.create(3, new CandidateCell(3, 50, 55, new GeoPoint(35, -97)), "2024-05-01T12:00:00"));
        assertEquals(Collections.singletonList(2), MotionFilter.getOutliers(cells, 9000));
        assertTrue("disabled", MotionFilter.getOutliers(cells, 0).isEmpty());
        assertEquals(Collections.singletonList(2), MotionFilter.filter(cells, 9000));
        assertEquals(2, cells.size());
        assertTrue(cells.contains(1));
        assertTrue("track without motion kept", cells.contains(3));
    }
}
