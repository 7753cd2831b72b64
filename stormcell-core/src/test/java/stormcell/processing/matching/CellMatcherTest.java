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
package stormcell.processing.matching;

import stormcell.data_structure.CandidateCell;
import stormcell.data_structure.GeoPoint;
import stormcell.utils.GeoUtils;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author Jean Ollion
 */
public class CellMatcherTest {
    public final static Logger logger = LoggerFactory.getLogger(CellMatcherTest.class);

    static CandidateCell cell(int id, int gates, double refl, double lat, double lon) {
        return new CandidateCell(id, gates, refl, new GeoPoint(lat, lon));
    }

    static double lonShift(double lat, double km) {
        return GeoUtils.kmToDegrees(lat, km)[1];
    }

    @Test
    public void testDistantCellsNotMatched() {
        List<CandidateCell> old = Collections.singletonList(cell(1, 100, 55, 35, -97));
        List<CandidateCell> cur = Collections.singletonList(cell(1, 100, 55, 35, -97 + lonShift(35, 50)));
        MatchResult res = new CellMatcher().setMaxGateKm(10).match(old, cur);
        assertEquals(MatchResult.Status.INFEASIBLE, res.getStatus());
        assertTrue(res.getMatches().isEmpty());
        assertEquals(Collections.singletonList(0), res.getUnmatchedOld());
        assertEquals(Collections.singletonList(0), res.getUnmatchedNew());
    }

    @Test
    public void testShiftedCellMatched() {
        List<CandidateCell> old = Collections.singletonList(cell(1, 100, 55, 35, -97));
        List<CandidateCell> cur = Collections.singletonList(cell(1, 104, 56, 35, -97 + lonShift(35, 2)));
        MatchResult res = new CellMatcher().match(old, cur);
        assertEquals(MatchResult.Status.OPTIMAL, res.getStatus());
        assertEquals(1, res.getMatches().size());
        Match m = res.getMatches().get(0);
        assertEquals(0, m.oldIndex);
        assertEquals(0, m.newIndex);
        assertTrue("finite cost", Double.isFinite(m.cost) && m.cost < 1);
        assertTrue(res.getUnmatchedOld().isEmpty());
        assertTrue(res.getUnmatchedNew().isEmpty());
    }

    @Test
    public void testEmptySide() {
        MatchResult res = new CellMatcher().match(Collections.<CandidateCell>emptyList(), Collections.singletonList(cell(1, 100, 55, 35, -97)));
        assertEquals(MatchResult.Status.EMPTY, res.getStatus());
        assertEquals(Collections.singletonList(0), res.getUnmatchedNew());
        res = new CellMatcher().match(Collections.singletonList(cell(1, 100, 55, 35, -97)), Collections.<CandidateCell>emptyList());
        assertEquals(Collections.singletonList(0), res.getUnmatchedOld());
    }

    @Test
    public void testCost() {
        List<CandidateCell> old = Collections.singletonList(cell(1, 100, 50, 35, -97));
        List<CandidateCell> cur = Collections.singletonList(cell(1, 80, 60, 35.01, -97));
        double[][] cost = new CellMatcher().getCostMatrix(old, cur);
        double expected = 0.5 * 0.01 / 10 + 0.3 * 20. / 100 + 0.2 * 10. / 60;
        assertEquals(expected, cost[0][0], 1e-9);
        assertEquals("identical cells", 0, new CellMatcher().getCostMatrix(old, old)[0][0], 0);
    }

    @Test
    public void testGating() {
        CellMatcher matcher = new CellMatcher().setMaxGateKm(10);
        GeoPoint p = new GeoPoint(35, -97);
        assertTrue(matcher.isWithinGate(p, new GeoPoint(35 + 9.9 / GeoUtils.KM_PER_DEGREE, -97)));
        assertFalse("north-south", matcher.isWithinGate(p, new GeoPoint(35 + 10.1 / GeoUtils.KM_PER_DEGREE, -97)));
        assertTrue(matcher.isWithinGate(p, new GeoPoint(35, -97 + lonShift(35, 9.5))));
        assertFalse("east-west", matcher.isWithinGate(p, new GeoPoint(35, -97 + lonShift(35, 10.5))));
        assertTrue("0-360 longitudes", matcher.isWithinGate(new GeoPoint(35, 263), new GeoPoint(35, 263 + lonShift(35, 5))));
        double[][] cost = matcher.getCostMatrix(Collections.singletonList(cell(1, 10, 50, 35, -97)), Collections.singletonList(cell(1, 10, 50, 35.2, -97)));
        assertEquals(Double.POSITIVE_INFINITY, cost[0][0], 0);
    }

    @Test
    public void testPartialInjection() {
        List<CandidateCell> old = new ArrayList<>(), cur = new ArrayList<>();
        for (int i = 0; i<4; ++i) {
            old.add(cell(i+1, 100 + 10 * i, 50, 35, -97 + i * 0.5));
            cur.add(cell(i+1, 102 + 10 * i, 51, 35.01, -97 + i * 0.5 + lonShift(35, 1)));
        }
        cur.add(cell(5, 300, 60, 37, -97)); // no predecessor
        old.add(cell(5, 50, 45, 33, -97)); // no successor
        Collections.shuffle(cur, new Random(1));
        CellMatcher matcher = new CellMatcher();
        MatchResult res = matcher.match(old, cur);
        assertEquals(4, res.getMatches().size());
        Set<Integer> oldIdx = new HashSet<>(), newIdx = new HashSet<>();
        for (Match m : res.getMatches()) {
            assertTrue("old index matched once", oldIdx.add(m.oldIndex));
            assertTrue("new index matched once", newIdx.add(m.newIndex));
            assertEquals("nearest cell", old.get(m.oldIndex).getId(), cur.get(m.newIndex).getId());
            assertTrue("gate respected", matcher.isWithinGate(old.get(m.oldIndex).getCentroid(), cur.get(m.newIndex).getCentroid()));
        }
        assertEquals(Collections.singletonList(4), res.getUnmatchedOld());
        assertEquals(1, res.getUnmatchedNew().size());
        assertEquals(5, cur.get(res.getUnmatchedNew().get(0)).getId());
    }

    @Test
    public void testForcedAssignmentAboveBoundDiscarded() {
        // second pair is outside the gate but the square assignment pairs it anyway
        List<CandidateCell> old = Arrays.asList(cell(1, 100, 50, 35, -97), cell(2, 100, 50, 36, -97));
        List<CandidateCell> cur = Arrays.asList(cell(1, 100, 50, 35.01, -97), cell(2, 100, 50, 34, -97));
        MatchResult res = new CellMatcher().match(old, cur);
        assertEquals(MatchResult.Status.OPTIMAL, res.getStatus());
        assertEquals(1, res.getMatches().size());
        assertEquals(new Match(0, 0, res.getMatches().get(0).cost), res.getMatches().get(0));
        assertEquals(Collections.singletonList(1), res.getUnmatchedOld());
        assertEquals(Collections.singletonList(1), res.getUnmatchedNew());
    }

    @Test
    public void testFallbackWhenSolverFails() {
        List<CandidateCell> old = Arrays.asList(cell(1, 100, 50, 35, -97), cell(2, 60, 50, 35, -96.9));
        List<CandidateCell> cur = Arrays.asList(cell(1, 61, 50, 35, -96.91), cell(2, 101, 50, 35, -97.01));
        CellMatcher matcher = new CellMatcher().setSolver(cost -> {throw new IllegalStateException("solver failure");});
        MatchResult res = matcher.match(old, cur);
        assertEquals(MatchResult.Status.FALLBACK, res.getStatus());
        assertTrue(res.isDegraded());
        assertEquals(2, res.getMatches().size());
        for (Match m : res.getMatches()) assertEquals("crossed pairs", 3, old.get(m.oldIndex).getId() + cur.get(m.newIndex).getId());
        assertEquals("fallback is the greedy assignment", CellMatcher.greedyMatch(matcher.getCostMatrix(old, cur), matcher.getPenaltyCost()), res.getMatches());
    }

    @Test
    public void testFallbackWhenSolverReturnsInvalidAssignment() {
        List<CandidateCell> old = Arrays.asList(cell(1, 100, 50, 35, -97), cell(2, 60, 50, 35, -96.9));
        List<CandidateCell> cur = Arrays.asList(cell(1, 100, 50, 35, -97), cell(2, 60, 50, 35, -96.9));
        MatchResult res = new CellMatcher().setSolver(cost -> new int[]{0, 0}).match(old, cur);
        assertEquals(MatchResult.Status.FALLBACK, res.getStatus());
        assertEquals(2, res.getMatches().size());
    }

    @Test
    public void testGreedyMatch() {
        double[][] cost = new double[][]{{1, 2}, {0.5, 3}};
        List<Match> res = CellMatcher.greedyMatch(cost, 10);
        assertEquals(Arrays.asList(new Match(1, 0, 0.5), new Match(0, 1, 2)), res);
        assertTrue("costs at penalty are never accepted", CellMatcher.greedyMatch(new double[][]{{10, Double.POSITIVE_INFINITY}}, 10).isEmpty());
    }

    @Test
    public void testKuhnMunkres() {
        AssignmentSolver solver = new KuhnMunkresAssignmentSolver();
        assertArrayEquals("optimal, not greedy", new int[]{1, 0}, solver.solve(new double[][]{{1, 2}, {2, 10}}));
        assertArrayEquals("more columns", new int[]{1, 0}, solver.solve(new double[][]{{5, 1, 9}, {1, 5, 9}}));
        assertArrayEquals("more rows", new int[]{1, 0, -1}, solver.solve(new double[][]{{5, 1}, {1, 5}, {3, 3}}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMatchResultRejectsDuplicates() {
        new MatchResult(MatchResult.Status.OPTIMAL, Arrays.asList(new Match(0, 0, 1), new Match(1, 0, 1)), 2, 2);
    }
}
