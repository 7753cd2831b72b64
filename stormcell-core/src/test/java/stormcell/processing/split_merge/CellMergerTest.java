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

import stormcell.data_structure.BoundingBox;
import stormcell.data_structure.CandidateCell;
import stormcell.test_utils.TestUtils;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author Jean Ollion
 */
public class CellMergerTest {
    public final static Logger logger = LoggerFactory.getLogger(CellMergerTest.class);

    @Test
    public void testSmallCellAbsorbed() {
        CandidateCell large = TestUtils.squareCell(1, 500, 55, 35, -97, 0.05);
        // ~0.45 km east of the large cell
        CandidateCell small = TestUtils.squareCell(2, 10, 62, 35, -96.94, 0.005);
        BoundingBox largeBox = large.getBounds(), smallBox = small.getBounds();
        List<CandidateCell> res = CellMerger.merge(Arrays.asList(large, small), 0.9, 1, 0.1);
        assertEquals("one cell remains", 1, res.size());
        CandidateCell merged = res.get(0);
        assertEquals(1, merged.getId());
        assertEquals(510, merged.getNumGates());
        assertEquals("max reflectivity", 62, merged.getMaxReflectivity(), 0);
        assertTrue("bbox covers the large cell", merged.getBounds().contains(largeBox));
        assertTrue("bbox covers the small cell", merged.getBounds().contains(smallBox));
        assertEquals("gate-weighted centroid", (-97 * 500 - 96.94 * 10) / 510, merged.getCentroid().lon, 1e-9);
        assertEquals(35, merged.getCentroid().lat, 1e-9);
        assertTrue("boundary recomputed on both cells", merged.getBoundary().getBounds().contains(smallBox));
    }

    @Test
    public void testDistantSmallCellKept() {
        CandidateCell large = TestUtils.squareCell(1, 500, 55, 35, -97, 0.05);
        CandidateCell small = TestUtils.squareCell(2, 10, 62, 35, -96.8, 0.005);
        List<CandidateCell> res = CellMerger.merge(Arrays.asList(large, small), 0.9, 1, 0.1);
        assertEquals(2, res.size());
        assertEquals("input order kept", 1, res.get(0).getId());
    }

    @Test
    public void testClosestLargeCellChosen() {
        CandidateCell left = TestUtils.squareCell(1, 500, 55, 35, -97.1, 0.05);
        CandidateCell right = TestUtils.squareCell(2, 480, 55, 35, -96.98, 0.05);
        // buffered box touches both large cells
        CandidateCell small = TestUtils.squareCell(3, 10, 55, 35, -97.043, 0.003);
        List<CandidateCell> res = CellMerger.merge(new ArrayList<>(Arrays.asList(left, right, small)), 0.9, 1, 0.1);
        assertEquals(2, res.size());
        assertEquals("absorbed by the closest centroid", 510, res.get(0).getNumGates());
        assertEquals(480, res.get(1).getNumGates());
    }

    @Test
    public void testInputListNotModified() {
        List<CandidateCell> input = Arrays.asList(TestUtils.squareCell(1, 500, 55, 35, -97, 0.05), TestUtils.squareCell(2, 10, 62, 35, -96.94, 0.005));
        new CellMerger(0.9, 1, 0.1).merge(input);
        assertEquals(2, input.size());
    }

    @Test
    public void testOverlapResolution() {
        // both cells are large: only the overlap pass applies
        CandidateCell a = TestUtils.squareCell(1, 100, 50, 35, -97, 0.05);
        CandidateCell b = TestUtils.squareCell(2, 95, 58, 35.02, -96.97, 0.05);
        CandidateCell c = TestUtils.squareCell(3, 98, 52, 36, -97, 0.05);
        assertTrue(CellMerger.overlap(a, b));
        assertFalse(CellMerger.overlap(a, c));
        List<CandidateCell> res = CellMerger.merge(Arrays.asList(a, b, c), 0.9, 1, 0.1);
        assertEquals(2, res.size());
        assertEquals("larger cell absorbs", 1, res.get(0).getId());
        assertEquals(195, res.get(0).getNumGates());
        assertEquals(58, res.get(0).getMaxReflectivity(), 0);
        assertNoOverlap(res);
    }

    @Test
    public void testOverlapChain() {
        List<CandidateCell> cells = new ArrayList<>();
        for (int i = 0; i<5; ++i) cells.add(TestUtils.squareCell(i+1, 100 - i, 50, 35, -97 + i * 0.08, 0.05));
        List<CandidateCell> res = CellMerger.merge(cells, 0.9, 0, 0.1);
        assertEquals("all cells chained by overlaps", 1, res.size());
        assertEquals(490, res.get(0).getNumGates());
        assertNoOverlap(res);
    }

    @Test
    public void testTouchingCellsAreNotOverlapping() {
        CandidateCell a = TestUtils.rectangleCell(1, 100, 50, 35, 35.1, -97, -96.9);
        CandidateCell b = TestUtils.rectangleCell(2, 100, 50, 35, 35.1, -96.9, -96.8);
        assertFalse(CellMerger.overlap(a, b));
        assertEquals(2, CellMerger.merge(Arrays.asList(a, b), 0.9, 0, 0.1).size());
    }

    @Test
    public void testBoundingBoxFootprint() {
        CandidateCell a = TestUtils.squareCell(1, 100, 50, 35, -97, 0.05);
        CandidateCell noPolygon = new CandidateCell(2, 100, 50, a.getCentroid()).setBounds(new BoundingBox(34.99, 35.01, -97.01, -96.99));
        assertTrue("bounding box used when there is no polygon", CellMerger.overlap(a, noPolygon));
        CandidateCell nothing = new CandidateCell(3, 100, 50, a.getCentroid());
        assertFalse(CellMerger.overlap(a, nothing));
    }

    static void assertNoOverlap(List<CandidateCell> cells) {
        for (int i = 0; i<cells.size(); ++i) {
            for (int j = i+1; j<cells.size(); ++j) {
                if (cells.get(i).getPolygon()==null || cells.get(j).getPolygon()==null) continue;
                double area = cells.get(i).getPolygon().intersection(cells.get(j).getPolygon()).getArea();
                assertEquals("overlap between "+cells.get(i).getId()+" and "+cells.get(j).getId(), 0, area, CellMerger.MIN_OVERLAP_AREA);
            }
        }
    }

    @Test
    public void testLargeCellsFixedBeforeAbsorption() {
        CandidateCell a = TestUtils.rectangleCell(1, 100, 55, 34.95, 35.05, -97.05, -96.95);
        // touches a on the east, large at start: 95 >= 0.9 * 100
        CandidateCell b = TestUtils.rectangleCell(2, 95, 52, 34.95, 35.05, -96.95, -96.85);
        // 0.005 degree west of a
        CandidateCell s = TestUtils.squareCell(3, 12, 50, 35, -97.06, 0.005);
        List<CandidateCell> res = CellMerger.merge(Arrays.asList(a, b, s), 0.9, 1, 0.1);
        assertEquals("b stays large after a grows", 2, res.size());
        assertEquals(112, res.get(0).getNumGates());
        assertEquals(95, res.get(1).getNumGates());
        assertEquals(2, res.get(1).getId());
    }

    @Test
    public void testSmallCellReachedAfterSeveralPasses() {
        CandidateCell a = TestUtils.squareCell(1, 100, 55, 35, -97, 0.05);
        // 0.005 degree east of a
        CandidateCell s1 = TestUtils.squareCell(2, 10, 50, 35, -96.94, 0.005);
        // 0.008 degree east of s1, beyond the buffer of a
        CandidateCell s2 = TestUtils.squareCell(3, 10, 50, 35, -96.922, 0.005);
        List<CandidateCell> cells = new ArrayList<>(Arrays.asList(a, s2, s1));
        int merges = new CellMerger(0.9, 1, 0.1).mergeSmallCells(cells);
        assertEquals(2, merges);
        assertEquals(1, cells.size());
        assertEquals(120, cells.get(0).getNumGates());
        assertEquals(-96.917, cells.get(0).getBounds().getLonMax(), 1e-9);
    }
}
