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

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author Jean Ollion
 */
public class TrackedCellCollectionTest {
    static final String T0 = "2024-05-01T12:00:00", T1 = "2024-05-01T12:05:00", T2 = "2024-05-01T12:10:00";

    static TrackedCell track(int id, int gates, String... timestamps) {
        TrackedCell t = TrackedCell.create(id, new CandidateCell(id, gates, 50, new GeoPoint(35, -97)), timestamps[0]);
        for (int i = 1; i<timestamps.length; ++i) t.addOrUpdateSnapshot(new HistorySnapshot(timestamps[i], 50, gates, new GeoPoint(35, -97)));
        return t;
    }

    @Test
    public void testAddOrMerge() {
        TrackedCellCollection cells = new TrackedCellCollection();
        cells.addOrMerge(track(1, 10, T0, T1));
        TrackedCell merged = cells.addOrMerge(track(1, 30, T1, T2));
        assertEquals(1, cells.size());
        assertEquals(Arrays.asList(T0, T1, T2), Arrays.asList(merged.getHistory().get(0).getTimestamp(), merged.getHistory().get(1).getTimestamp(), merged.getHistory().get(2).getTimestamp()));
        assertEquals("state from the most recent record", 30, merged.getNumGates());
        TrackedCell older = cells.addOrMerge(track(1, 5, T0));
        assertEquals("older record does not change state", 30, older.getNumGates());
        assertEquals(3, older.getHistory().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateId() {
        new TrackedCellCollection().add(track(1, 10, T0)).add(track(1, 10, T1));
    }

    @Test
    public void testNextId() {
        TrackedCellCollection cells = new TrackedCellCollection();
        assertEquals(1, cells.nextId());
        cells.add(track(5, 10, T0));
        assertEquals(6, cells.nextId());
        assertEquals("allocated ids are not handed out twice", 7, cells.nextId());
        cells.removeAll(Arrays.asList(5, 8));
        assertEquals(8, cells.nextId());
        assertNull(cells.get(5));
    }

    @Test
    public void testDuplicateIsDeep() {
        TrackedCellCollection cells = new TrackedCellCollection().add(track(1, 10, T0));
        cells.get(1).getLastSnapshot().setExtraField("VII", 1.5);
        TrackedCellCollection dup = cells.duplicate();
        dup.get(1).getLastSnapshot().setExtraField("VII", 2.5);
        dup.get(1).addOrUpdateSnapshot(new HistorySnapshot(T1, 50, 10, new GeoPoint(35, -97)));
        assertEquals(1.5, cells.get(1).getLastSnapshot().getExtraField("VII"));
        assertEquals(1, cells.get(1).getHistory().size());
        assertEquals(cells.nextId(), dup.nextId());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReservedSnapshotField() {
        new HistorySnapshot(T0, 50, 10, null).setExtraField(HistorySnapshot.DX, 1);
    }

    @Test
    public void testSnapshotJSON() {
        HistorySnapshot s = new HistorySnapshot(T0, 51.23456, 10, new GeoPoint(35.123456, -97.654321)).setMotion(1000.123456, -20, 300);
        s.setExtraField("PrecipRate", 12.345678);
        HistorySnapshot parsed = HistorySnapshot.fromJSONEntry(s.toJSONEntry(4));
        assertEquals(51.2346, parsed.getMaxReflectivity(), 0);
        assertEquals(new GeoPoint(35.1235, -97.6543), parsed.getCentroid());
        assertTrue(parsed.hasMotion());
        assertEquals(1000.1235, parsed.getDx(), 0);
        assertEquals("enrichment values written unchanged", 12.345678, parsed.getExtraField("PrecipRate"));
        assertEquals(Arrays.asList("timestamp", "max_reflectivity_dbz", "num_gates", "centroid", "dx", "dy", "dt", "PrecipRate"), Arrays.asList(s.toJSONEntry(4).keySet().toArray()));
    }
}
