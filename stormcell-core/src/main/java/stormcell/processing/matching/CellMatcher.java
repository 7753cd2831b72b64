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

import stormcell.data_structure.GeoPoint;
import stormcell.data_structure.StormObject;
import stormcell.utils.GeoUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Links cells of two successive scans by minimal cost assignment.
 * <p>
 * Pair cost = {@code distanceWeight * min(distance / distanceNorm, 1) + numGatesWeight * |Δgates| / maxGates + reflectivityWeight * |Δmax reflectivity| / maxReflectivity},
 * with distance between centroids in degrees, and maxima computed over both scans (at least 1).
 * Pairs whose east-west or north-south displacement exceeds {@code maxGateKm} are not allowed.
 * If the exact solver fails, a greedy assignment by increasing cost is used and the result is flagged {@link MatchResult.Status#FALLBACK}
 * @author Jean Ollion
 */
public class CellMatcher {
    public final static Logger logger = LoggerFactory.getLogger(CellMatcher.class);
    double distanceWeight = 0.5, numGatesWeight = 0.3, reflectivityWeight = 0.2;
    double maxGateKm = 10;
    double distanceNormDeg = 10;
    double penaltyCost = 1000;
    AssignmentSolver solver = new KuhnMunkresAssignmentSolver();

    public CellMatcher setWeights(double distanceWeight, double numGatesWeight, double reflectivityWeight) {
        this.distanceWeight = distanceWeight;
        this.numGatesWeight = numGatesWeight;
        this.reflectivityWeight = reflectivityWeight;
        return this;
    }

    public CellMatcher setMaxGateKm(double maxGateKm) {
        this.maxGateKm = maxGateKm;
        return this;
    }

    public CellMatcher setDistanceNormDeg(double distanceNormDeg) {
        if (distanceNormDeg<=0) throw new IllegalArgumentException("Distance normalization must be positive");
        this.distanceNormDeg = distanceNormDeg;
        return this;
    }

    public CellMatcher setPenaltyCost(double penaltyCost) {
        this.penaltyCost = penaltyCost;
        return this;
    }

    public CellMatcher setSolver(AssignmentSolver solver) {
        this.solver = solver;
        return this;
    }

    public double getPenaltyCost() {
        return penaltyCost;
    }

    /**
     * @return cost matrix indexed [old][new]. Disallowed pairs have infinite cost
     */
    public double[][] getCostMatrix(List<? extends StormObject> oldCells, List<? extends StormObject> newCells) {
        double maxGates = Math.max(1, Stream.concat(oldCells.stream(), newCells.stream()).mapToDouble(StormObject::getNumGates).max().orElse(1));
        double maxRefl = Math.max(1, Stream.concat(oldCells.stream(), newCells.stream()).mapToDouble(StormObject::getMaxReflectivity).filter(d -> !Double.isNaN(d)).max().orElse(1));
        double[][] cost = new double[oldCells.size()][newCells.size()];
        for (int i = 0; i<oldCells.size(); ++i) {
            for (int j = 0; j<newCells.size(); ++j) cost[i][j] = getCost(oldCells.get(i), newCells.get(j), maxGates, maxRefl);
        }
        return cost;
    }

    protected double getCost(StormObject o, StormObject n, double maxGates, double maxRefl) {
        GeoPoint c0 = o.getCentroid(), c1 = n.getCentroid();
        if (c0==null || c1==null || !isWithinGate(c0, c1)) return Double.POSITIVE_INFINITY;
        double dist = Math.min(c0.distanceDeg(c1) / distanceNormDeg, 1);
        double gates = Math.abs(o.getNumGates() - n.getNumGates()) / maxGates;
        double refl = Math.abs(o.getMaxReflectivity() - n.getMaxReflectivity()) / maxRefl;
        if (Double.isNaN(refl)) refl = 1;
        return distanceWeight * dist + numGatesWeight * gates + reflectivityWeight * refl;
    }

    public boolean isWithinGate(GeoPoint c0, GeoPoint c1) {
        double[] d = GeoUtils.displacementKm(c0.lat, c0.lon, c1.lat, c1.lon);
        return d[0] <= maxGateKm && d[1] <= maxGateKm;
    }

    public MatchResult match(List<? extends StormObject> oldCells, List<? extends StormObject> newCells) {
        if (oldCells.isEmpty() || newCells.isEmpty()) return new MatchResult(MatchResult.Status.EMPTY, new ArrayList<>(), oldCells.size(), newCells.size());
        double[][] cost = getCostMatrix(oldCells, newCells);
        boolean feasible = false;
        for (double[] row : cost) {
            for (double c : row) if (c < penaltyCost) {feasible = true; break;}
            if (feasible) break;
        }
        if (!feasible) {
            logger.debug("no pair of cells within {} km among {} previous and {} current cells", maxGateKm, oldCells.size(), newCells.size());
            return new MatchResult(MatchResult.Status.INFEASIBLE, new ArrayList<>(), oldCells.size(), newCells.size());
        }
        MatchResult res;
        try {
            res = new MatchResult(MatchResult.Status.OPTIMAL, solve(cost), oldCells.size(), newCells.size());
        } catch (RuntimeException e) {
            logger.warn("exact assignment failed ({}): falling back to greedy assignment", e.toString());
            res = new MatchResult(MatchResult.Status.FALLBACK, greedyMatch(cost, penaltyCost), oldCells.size(), newCells.size());
        }
        logger.debug("matching: {}", res);
        return res;
    }

    protected List<Match> solve(double[][] cost) {
        double[][] bounded = new double[cost.length][];
        for (int i = 0; i<cost.length; ++i) {
            bounded[i] = new double[cost[i].length];
            for (int j = 0; j<cost[i].length; ++j) bounded[i][j] = Double.isFinite(cost[i][j]) ? Math.min(cost[i][j], penaltyCost) : penaltyCost;
        }
        int[] assignment = solver.solve(bounded);
        if (assignment==null || assignment.length!=cost.length) throw new IllegalStateException("Invalid assignment returned by solver");
        List<Match> res = new ArrayList<>();
        boolean[] usedCols = new boolean[cost[0].length];
        for (int i = 0; i<assignment.length; ++i) {
            int j = assignment[i];
            if (j<0) continue;
            if (j>=usedCols.length || usedCols[j]) throw new IllegalStateException("Invalid assignment returned by solver: column "+j);
            usedCols[j] = true;
            if (cost[i][j] < penaltyCost) res.add(new Match(i, j, cost[i][j]));
        }
        return res;
    }

    /**
     * Accepts pairs by increasing cost as long as neither index is already matched. Pairs with cost at or above {@param penaltyCost} are never accepted
     */
    public static List<Match> greedyMatch(double[][] cost, double penaltyCost) {
        List<Match> candidates = new ArrayList<>();
        for (int i = 0; i<cost.length; ++i) {
            for (int j = 0; j<cost[i].length; ++j) if (cost[i][j] < penaltyCost) candidates.add(new Match(i, j, cost[i][j]));
        }
        candidates.sort(Comparator.comparingDouble(m -> m.cost)); // stable: ties in row-major order
        boolean[] usedRows = new boolean[cost.length];
        boolean[] usedCols = new boolean[cost.length==0 ? 0 : cost[0].length];
        List<Match> res = new ArrayList<>();
        for (Match m : candidates) {
            if (usedRows[m.oldIndex] || usedCols[m.newIndex]) continue;
            usedRows[m.oldIndex] = true;
            usedCols[m.newIndex] = true;
            res.add(m);
        }
        return res;
    }
}
