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
import stormcell.data_structure.HistorySnapshot;
import stormcell.data_structure.TrackedCell;
import stormcell.data_structure.TrackedCellCollection;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author Jean Ollion
 */
public class StormVectorCalculatorTest {

    @Test
    public void testMotion() {
        HistorySnapshot previous = new HistorySnapshot("2024-05-01T12:00:00", 55, 50, new GeoPoint(35, -97));
        HistorySnapshot current = new HistorySnapshot("2024-05-01T12:05:00", 55, 50, new GeoPoint(35.01, -96.99));
        assertTrue(StormVectorCalculator.computeMotion(previous, current));
        double expectedDx = 0.01 * 111320 * Math.cos(Math.toRadians(35.005));
        double expectedDy = 0.01 * 111320;
        assertEquals("dx (m)", expectedDx, current.getDx(), 1e-3);
        assertEquals("dy (m)", expectedDy, current.getDy(), 1e-3);
        assertEquals("dt (s)", 300, current.getDt(), 0);
        assertEquals("speed", Math.sqrt(expectedDx * expectedDx + expectedDy * expectedDy) / 300, current.getSpeed(), 1e-6);
        assertEquals("bearing", Math.atan2(expectedDy, expectedDx), current.getBearing(), 1e-9);
        assertFalse("stored on the newer snapshot only", previous.hasMotion());
    }

    @Test
    public void testWestwardMotion() {
        HistorySnapshot previous = new HistorySnapshot("2024-05-01T12:00:00Z", 55, 50, new GeoPoint(35, 263));
        HistorySnapshot current = new HistorySnapshot("2024-05-01T12:02:00Z", 55, 50, new GeoPoint(34.99, 262.98));
        assertTrue(StormVectorCalculator.computeMotion(previous, current));
        assertTrue(current.getDx() < 0);
        assertTrue(current.getDy() < 0);
        assertEquals(120, current.getDt(), 0);
    }

    @Test
    public void testUnparseableTimestamp() {
        HistorySnapshot previous = new HistorySnapshot("scan-a", 55, 50, new GeoPoint(35, -97));
        HistorySnapshot current = new HistorySnapshot("scan-b", 55, 50, new GeoPoint(35.01, -97));
        assertFalse(StormVectorCalculator.computeMotion(previous, current));
        assertFalse(current.hasMotion());
    }

    @Test
    public void testComputeLatestAndAll() {
        TrackedCell t = TrackedCell.create(1, new CandidateCell(1, 50, 55, new GeoPoint(35, -97)), "2024-05-01T12:00:00");
        assertFalse("single snapshot", StormVectorCalculator.computeLatest(t));
        t.addOrUpdateSnapshot(new HistorySnapshot("2024-05-01T12:05:00", 55, 50, new GeoPoint(35.01, -97)));
        t.addOrUpdateSnapshot(new HistorySnapshot("2024-05-01T12:10:00", 55, 50, new GeoPoint(35.02, -97)));
        TrackedCellCollection cells = new TrackedCellCollection().add(t);
        assertEquals(1, StormVectorCalculator.computeLatest(cells));
        assertFalse(t.getHistory().get(1).hasMotion());
        assertEquals("only missing", 1, StormVectorCalculator.computeAll(t, true));
        assertTrue(t.getHistory().get(1).hasMotion());
        assertEquals("all", 2, StormVectorCalculator.computeAll(t, false));
    }
}
