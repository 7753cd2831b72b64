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

import stormcell.data_structure.CandidateCell;
import stormcell.test_utils.TestUtils;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

/**
 *
 * @author Jean Ollion
 */
public class CellTerminatorTest {

    @Test
    public void testCoveredCellTerminated() {
        CandidateCell large = TestUtils.rectangleCell(1, 100, 55, 35, 36, -97, -96);
        CandidateCell inside = TestUtils.rectangleCell(2, 20, 55, 35.4, 35.6, -96.6, -96.4);
        CandidateCell far = TestUtils.rectangleCell(3, 10, 55, 38, 38.2, -96.6, -96.4);
        assertEquals(100, CellTerminator.getCoveragePct(inside, large), 1e-6);
        List<CandidateCell> kept = CellTerminator.terminate(Arrays.asList(inside, large, far), 67);
        assertEquals(2, kept.size());
        assertEquals("input order kept", 1, kept.get(0).getId());
        assertEquals(3, kept.get(1).getId());
        assertEquals(2, CellTerminator.getTerminatedCells(Arrays.asList(inside, large, far), 67).get(0).getId());
    }

    @Test
    public void testPartialCoverage() {
        CandidateCell large = TestUtils.rectangleCell(1, 100, 55, 35, 36, -97, -96);
        CandidateCell half = TestUtils.rectangleCell(2, 20, 55, 35.4, 35.6, -96.1, -95.9);
        double pct = CellTerminator.getCoveragePct(half, large);
        assertEquals(50, pct, 0.5);
        assertArrayEquals(new boolean[]{false, false}, CellTerminator.getTerminated(Arrays.asList(large, half), 67));
        assertArrayEquals("lower threshold", new boolean[]{false, true}, CellTerminator.getTerminated(Arrays.asList(large, half), 40));
    }

    @Test
    public void testTerminatedCellDoesNotTerminate() {
        CandidateCell a = TestUtils.rectangleCell(1, 100, 55, 35, 36, -97, -96);
        CandidateCell b = TestUtils.rectangleCell(2, 50, 55, 35, 36, -96.2, -95.95); // 80% within a
        CandidateCell c = TestUtils.rectangleCell(3, 20, 55, 35.4, 35.6, -95.99, -95.96); // within b only
        assertArrayEquals(new boolean[]{false, true, false}, CellTerminator.getTerminated(Arrays.asList(a, b, c), 67));
    }

    @Test
    public void testEqualSizeTieBrokenByOrder() {
        CandidateCell a = TestUtils.rectangleCell(1, 50, 55, 35, 35.5, -97, -96.5);
        CandidateCell b = TestUtils.rectangleCell(2, 50, 55, 35, 35.5, -97, -96.5);
        assertArrayEquals("first ranked cell survives", new boolean[]{false, true}, CellTerminator.getTerminated(Arrays.asList(a, b), 67));
    }

    @Test
    public void testCellWithoutPolygon() {
        CandidateCell a = TestUtils.rectangleCell(1, 100, 55, 35, 36, -97, -96);
        CandidateCell noPolygon = new CandidateCell(2, 10, 50, a.getCentroid());
        assertEquals(0, CellTerminator.getCoveragePct(noPolygon, a), 0);
        assertEquals(2, CellTerminator.terminate(Arrays.asList(a, noPolygon), 67).size());
    }
}
