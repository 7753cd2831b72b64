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
package stormcell.core;

import stormcell.configuration.TrackingConfiguration;
import stormcell.data_structure.HistorySnapshot;
import stormcell.data_structure.TrackedCell;
import stormcell.data_structure.TrackedCellCollection;
import stormcell.image.ReflectivityGrid;
import stormcell.processing.matching.MatchResult;
import stormcell.test_utils.TestUtils;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author Jean Ollion
 */
public class TrackingPipelineTest {
    static final String T0 = "2024-05-01T12:00:00", T1 = "2024-05-01T12:05:00";

    static TrackingPipeline pipeline() {
        return new TrackingPipeline(new TrackingConfiguration().setMinGates(5));
    }

    @Test
    public void testTwoScans() {
        TrackingPipeline pipeline = pipeline();
        TrackedCellCollection tracked = new TrackedCellCollection();
        ScanReport first = pipeline.process(TestUtils.patchGrid(40, 20, 20, 5, 55, T0), tracked);
        assertEquals(1, first.getDetectedCells());
        assertEquals(MatchResult.Status.EMPTY, first.getMatchStatus());
        assertEquals(Collections.singletonList(1), first.getCreatedIds());
        assertEquals(1, tracked.size());
        TrackedCell track = tracked.get(1);
        assertEquals(25, track.getNumGates());
        assertEquals(35.22, track.getCentroid().lat, 1e-9);
        assertEquals(262.22, track.getCentroid().lon, 1e-9);
        assertFalse("first snapshot has no motion", track.getLastSnapshot().hasMotion());

        ScanReport second = pipeline.process(TestUtils.patchGrid(40, 22, 20, 5, 55, T1), tracked);
        assertEquals(MatchResult.Status.OPTIMAL, second.getMatchStatus());
        assertEquals(Collections.singletonList(1), second.getMatchedIds());
        assertTrue(second.getCreatedIds().isEmpty());
        assertEquals(1, tracked.size());
        assertEquals(2, track.getHistory().size());
        HistorySnapshot last = track.getLastSnapshot();
        assertEquals(T1, last.getTimestamp());
        assertEquals(0.02 * 111320 * Math.cos(Math.toRadians(35.22)), last.getDx(), 1e-6);
        assertEquals(0, last.getDy(), 1e-6);
        assertEquals(300, last.getDt(), 0);
        assertEquals(262.24, track.getCentroid().lon, 1e-9);

        pipeline.process(TestUtils.patchGrid(40, 22, 20, 5, 55, T1), tracked);
        assertEquals("reprocessing a scan does not duplicate the snapshot", 2, tracked.get(1).getHistory().size());
    }

    @Test
    public void testNewCellAndLostCell() {
        TrackingPipeline pipeline = pipeline();
        TrackedCellCollection tracked = new TrackedCellCollection();
        pipeline.process(TestUtils.patchGrid(60, 5, 5, 5, 55, T0), tracked);
        // a cell appears 45 gates away from the first one, which disappears
        ScanReport report = pipeline.process(TestUtils.patchGrid(60, 50, 50, 5, 55, T1), tracked);
        assertEquals(MatchResult.Status.INFEASIBLE, report.getMatchStatus());
        assertEquals(Collections.singletonList(2), report.getCreatedIds());
        assertEquals(Arrays.asList(1, 2), tracked.getIds());
        assertEquals("lost track kept", 1, tracked.get(1).getHistory().size());
    }

    @Test
    public void testNoCellDetected() {
        TrackingPipeline pipeline = pipeline();
        TrackedCellCollection tracked = new TrackedCellCollection();
        pipeline.process(TestUtils.patchGrid(40, 20, 20, 5, 55, T0), tracked);
        ScanReport report = pipeline.process(TestUtils.patchGrid(40, 20, 20, 5, 45, T1), tracked);
        assertEquals(0, report.getDetectedCells());
        assertEquals(MatchResult.Status.EMPTY, report.getMatchStatus());
        assertTrue(report.getCreatedIds().isEmpty());
        assertEquals(1, tracked.size());
    }

    @Test
    public void testImplausibleDisplacementFiltered() {
        TrackingPipeline pipeline = pipeline();
        TrackedCellCollection tracked = new TrackedCellCollection();
        pipeline.process(TestUtils.patchGrid(50, 20, 20, 5, 55, T0), tracked);
        // 0.1 degree of longitude at 35.22N: about 9.07 km, within the matching gate but above the displacement limit
        ScanReport report = pipeline.process(TestUtils.patchGrid(50, 30, 20, 5, 55, T1), tracked);
        assertEquals(Collections.singletonList(1), report.getMatchedIds());
        assertEquals(Collections.singletonList(1), report.getFilteredIds());
        assertTrue(tracked.isEmpty());
    }

    static TrackedCellCollection nestedTracks() {
        TrackedCell large = TrackedCell.create(1, TestUtils.rectangleCell(1, 900, 58, 35.0, 35.3, 262.0, 262.3), T0);
        TrackedCell small = TrackedCell.create(2, TestUtils.squareCell(2, 30, 52, 35.25, 262.25, 0.02), T0);
        return new TrackedCellCollection(Arrays.asList(large, small));
    }

    @Test
    public void testCoveredTrackTerminated() {
        TrackedCellCollection tracked = nestedTracks();
        ScanReport report = pipeline().process(TestUtils.patchGrid(40, 13, 13, 5, 55, T1), tracked);
        assertEquals(Collections.singletonList(2), report.getTerminatedIds());
        assertEquals(Collections.singletonList(1), report.getMatchedIds());
        assertEquals(Collections.singletonList(1), tracked.getIds());

        TrackedCellCollection kept = nestedTracks();
        ScanReport noTermination = new TrackingPipeline(new TrackingConfiguration().setMinGates(5).setTerminatePrevious(false))
                .process(TestUtils.patchGrid(40, 13, 13, 5, 55, T1), kept);
        assertTrue(noTermination.getTerminatedIds().isEmpty());
        assertEquals(Arrays.asList(1, 2), kept.getIds());
    }

    @Test
    public void testDetect() {
        double[][] values = TestUtils.values(40, 40, 0);
        TestUtils.fill(values, 2, 2, 6, 6, 55);
        TestUtils.fill(values, 25, 25, 3, 3, 55);
        ReflectivityGrid grid = TestUtils.grid(values, T0);
        assertEquals(2, pipeline().detect(grid).size());
        assertEquals("small cell discarded", 1, new TrackingPipeline(new TrackingConfiguration().setMinGates(10)).detect(grid).size());
        assertTrue(pipeline().detect(grid).stream().allMatch(c -> c.getBoundary().isPolygonal()));
    }
}
