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
import stormcell.data_structure.CandidateCell;
import stormcell.data_structure.TrackedCell;
import stormcell.data_structure.TrackedCellCollection;
import stormcell.image.ReflectivityGrid;
import stormcell.processing.RegionGrower;
import stormcell.processing.geom.BoundaryBuilder;
import stormcell.processing.matching.AssignmentSolver;
import stormcell.processing.matching.CellMatcher;
import stormcell.processing.matching.MatchResult;
import stormcell.processing.split_merge.CellMerger;
import stormcell.processing.split_merge.CellTerminator;
import stormcell.processing.tracking.HistoryTracker;
import stormcell.processing.tracking.MotionFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Processes one scan: detection, boundaries, merge, termination of covered previous tracks, matching, history update and motion filtering.
 * A pipeline instance must not process several scans concurrently on the same collection.
 * @author Jean Ollion
 */
public class TrackingPipeline {
    public final static Logger logger = LoggerFactory.getLogger(TrackingPipeline.class);
    final TrackingConfiguration config;
    AssignmentSolver solver;

    /**
     * @throws IllegalArgumentException if {@param config} is not valid
     */
    public TrackingPipeline(TrackingConfiguration config) {
        this.config = config.checkValid();
    }

    public TrackingPipeline setSolver(AssignmentSolver solver) {
        this.solver = solver;
        return this;
    }

    public TrackingConfiguration getConfiguration() {
        return config;
    }

    /**
     * @return merged cells of {@param grid} with boundaries
     */
    public List<CandidateCell> detect(ReflectivityGrid grid) {
        List<CandidateCell> cells = new RegionGrower(config.getSeedDbz(), config.getExpandDbz(), config.getMinGates(), config.getMaxIterations())
                .setSeedConnectivity(config.getConnectivity())
                .setNumThreads(config.getNumThreads())
                .run(grid);
        BoundaryBuilder.build(cells, grid, config.getAlpha());
        return cells;
    }

    public CellMatcher getMatcher() {
        CellMatcher matcher = new CellMatcher()
                .setWeights(config.getDistanceWeight(), config.getNumGatesWeight(), config.getReflectivityWeight())
                .setMaxGateKm(config.getMaxGateKm())
                .setDistanceNormDeg(config.getDistanceNormDeg())
                .setPenaltyCost(config.getPenaltyCost());
        if (solver!=null) matcher.setSolver(solver);
        return matcher;
    }

    /**
     * Updates {@param tracked} with the cells of {@param grid}
     */
    public ScanReport process(ReflectivityGrid grid, TrackedCellCollection tracked) {
        ScanReport report = new ScanReport(grid.getTimestamp());
        List<CandidateCell> detected = detect(grid);
        report.detectedCells = detected.size();
        List<CandidateCell> cells = CellMerger.merge(detected, config.getSizeRatioThreshold(), config.getBufferKm(), config.getAlpha());
        report.mergedCells = cells.size();
        for (int i = 0; i<cells.size(); ++i) cells.get(i).setId(i+1);
        List<TrackedCell> previous = tracked.getCells();
        if (config.terminatePrevious()) {
            List<TrackedCell> terminated = CellTerminator.getTerminatedCells(previous, config.getCoverageThresholdPct());
            if (!terminated.isEmpty()) {
                List<Integer> ids = terminated.stream().map(TrackedCell::getId).collect(Collectors.toList());
                tracked.removeAll(ids);
                previous.removeAll(terminated);
                report.terminatedIds.addAll(ids);
            }
        }
        MatchResult match = getMatcher().match(previous, cells);
        report.matchStatus = match.getStatus();
        HistoryTracker.Update update = HistoryTracker.apply(tracked, previous, cells, match.getMatches(), grid.getTimestamp());
        report.matchedIds.addAll(update.getMatchedIds());
        report.createdIds.addAll(update.getCreatedIds());
        report.filteredIds.addAll(MotionFilter.filter(tracked, config.getMaxDisplacementM()));
        if (match.isDegraded()) logger.warn("{}: degraded matching", grid.getTimestamp());
        logger.info("{}", report);
        return report;
    }
}
