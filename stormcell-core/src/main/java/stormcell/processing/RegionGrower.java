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
package stormcell.processing;

import stormcell.data_structure.CandidateCell;
import stormcell.data_structure.CoordCollection;
import stormcell.data_structure.GeoPoint;
import stormcell.image.LabelGrid;
import stormcell.image.ReflectivityGrid;
import stormcell.utils.ThreadRunner;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Detects storm cells by hysteresis region growing.
 * Connected regions above the seed threshold are grown ring by ring (8-neighborhood) into unclaimed pixels above the expansion threshold,
 * until no cell can grow or the maximal number of sweeps is reached.
 * Each pixel is owned by at most one cell: within one sweep, growth candidates of all cells are computed against the state of the previous sweep,
 * then committed in cell order so that a pixel reachable by several cells goes to the cell with the lowest label.
 * @author Jean Ollion
 */
public class RegionGrower {
    public final static Logger logger = LoggerFactory.getLogger(RegionGrower.class);
    static final int[][] DILATION = Connectivity.EIGHT.getNeighborhood();
    final double seedThreshold, expandThreshold;
    final int minGates, maxIterations;
    Connectivity seedConnectivity = Connectivity.FOUR;
    int numThreads = 1;
    GrowthListener listener;

    public interface GrowthListener {
        /**
         * Called after each sweep
         * @param iteration index of the sweep, starting from 0
         * @param owners owner-id grid (label of the cell owning each pixel, 0 if unclaimed). Must not be modified
         * @param masks pixel masks of all cells, indexed by label - 1. Must not be modified
         */
        void sweepDone(int iteration, LabelGrid owners, List<CoordCollection> masks);
    }

    /**
     * @throws IllegalArgumentException if {@param expandThreshold} is greater than {@param seedThreshold}
     */
    public RegionGrower(double seedThreshold, double expandThreshold, int minGates, int maxIterations) {
        if (expandThreshold > seedThreshold) throw new IllegalArgumentException("Expansion threshold ("+expandThreshold+") must not exceed seed threshold ("+seedThreshold+")");
        if (maxIterations < 0) throw new IllegalArgumentException("Negative max iterations: "+maxIterations);
        this.seedThreshold = seedThreshold;
        this.expandThreshold = expandThreshold;
        this.minGates = minGates;
        this.maxIterations = maxIterations;
    }

    public RegionGrower setSeedConnectivity(Connectivity connectivity) {
        this.seedConnectivity = connectivity;
        return this;
    }

    public RegionGrower setNumThreads(int numThreads) {
        this.numThreads = numThreads;
        return this;
    }

    public RegionGrower setListener(GrowthListener listener) {
        this.listener = listener;
        return this;
    }

    public static List<CandidateCell> grow(ReflectivityGrid grid, double seedThreshold, double expandThreshold, int minGates, int maxIterations) {
        return new RegionGrower(seedThreshold, expandThreshold, minGates, maxIterations).run(grid);
    }

    /**
     * @return cells with at least {@code minGates} pixels, with gate count, max reflectivity, centroid and timestamp set. Boundaries are not computed.
     * Empty list if no pixel reaches the seed threshold
     */
    public List<CandidateCell> run(ReflectivityGrid grid) {
        if (grid==null) throw new IllegalArgumentException("Null grid");
        if (grid.isEmpty()) return Collections.emptyList();
        List<CoordCollection> masks = ImageLabeller.labelAbove(grid, seedThreshold, seedConnectivity);
        if (masks.isEmpty()) {
            logger.debug("no seed above {} dBZ in {}", seedThreshold, grid);
            return Collections.emptyList();
        }
        LabelGrid owners = new LabelGrid(grid.sizeX(), grid.sizeY());
        List<IntArrayList> frontiers = new ArrayList<>(masks.size());
        for (int i = 0; i<masks.size(); ++i) {
            int label = i + 1;
            CoordCollection m = masks.get(i);
            m.stream().forEach(c -> owners.setLabel(c, label));
            frontiers.add(new IntArrayList(m.getCoords()));
        }
        logger.debug("{} seeds above {} dBZ", masks.size(), seedThreshold);
        int iteration = 0;
        while (iteration < maxIterations) {
            List<Integer> active = IntStream.range(0, masks.size()).filter(i -> !frontiers.get(i).isEmpty()).boxed().collect(Collectors.toList());
            if (active.isEmpty()) break;
            IntLinkedOpenHashSet[] candidates = new IntLinkedOpenHashSet[masks.size()];
            ThreadRunner.executeAndThrowErrors(active, numThreads, (i, idx) -> candidates[i] = getGrowthCandidates(grid, owners, masks.get(i), frontiers.get(i)));
            int newPixels = 0;
            for (int i : active) { // commit in label order
                int label = i + 1;
                IntArrayList newFrontier = new IntArrayList();
                for (int c : candidates[i]) {
                    if (owners.claim(c, label)) {
                        masks.get(i).add(c);
                        newFrontier.add(c);
                    }
                }
                frontiers.set(i, newFrontier);
                newPixels += newFrontier.size();
            }
            if (listener!=null) listener.sweepDone(iteration, owners, Collections.unmodifiableList(masks));
            ++iteration;
            logger.trace("sweep {}: {} new pixels", iteration, newPixels);
            if (newPixels==0) break;
        }
        List<CandidateCell> res = new ArrayList<>();
        for (CoordCollection m : masks) {
            if (m.size() < minGates) continue;
            CandidateCell cell = new CandidateCell(res.size()+1, m)
                    .setMaxReflectivity(m.getMaxValue(grid))
                    .setCentroid(getCentroid(grid, m, seedThreshold))
                    .setTimestamp(grid.getTimestamp());
            res.add(cell);
        }
        logger.debug("{} cells after {} sweeps ({} discarded with less than {} gates)", res.size(), iteration, masks.size()-res.size(), minGates);
        return res;
    }

    /**
     * @return unclaimed neighbors of {@param frontier} pixels that are above the expansion threshold, in discovery order. Does not modify any argument
     */
    protected IntLinkedOpenHashSet getGrowthCandidates(ReflectivityGrid grid, LabelGrid owners, CoordCollection mask, IntArrayList frontier) {
        IntLinkedOpenHashSet res = new IntLinkedOpenHashSet();
        for (int i = 0; i<frontier.size(); ++i) {
            int coord = frontier.getInt(i);
            for (int[] t : DILATION) {
                if (mask.insideBounds(coord, t[0], t[1])) {
                    int next = mask.translate(coord, t[0], t[1]);
                    if (!owners.isClaimed(next) && grid.isAbove(next, expandThreshold)) res.add(next);
                }
            }
        }
        return res;
    }

    /**
     * Centroid is the reflectivity-weighted center of the pixels of {@param mask} above {@param seedThreshold},
     * or the geometric center of the whole mask if there are none. Location is read from the grid at the nearest pixel
     */
    public static GeoPoint getCentroid(ReflectivityGrid grid, CoordCollection mask, double seedThreshold) {
        double sumW = 0, sumX = 0, sumY = 0;
        for (int i = 0; i<mask.size(); ++i) {
            int c = mask.get(i);
            double v = grid.getPixel(c);
            if (Double.isNaN(v) || v < seedThreshold) continue;
            sumW += v;
            sumX += v * mask.getX(c);
            sumY += v * mask.getY(c);
        }
        if (sumW <= 0) { // unweighted center
            sumW = mask.size();
            sumX = mask.stream().map(mask::getX).sum();
            sumY = mask.stream().map(mask::getY).sum();
        }
        int x = (int)Math.round(sumX / sumW);
        int y = (int)Math.round(sumY / sumW);
        x = Math.max(0, Math.min(grid.sizeX()-1, x));
        y = Math.max(0, Math.min(grid.sizeY()-1, y));
        int idx = grid.toIndex(x, y);
        return new GeoPoint(grid.getLatitude(idx), grid.getLongitude(idx));
    }
}
