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

import stormcell.data_structure.Boundary;
import stormcell.data_structure.BoundingBox;
import stormcell.data_structure.CandidateCell;
import stormcell.data_structure.GeoPoint;
import stormcell.data_structure.StormObject;
import stormcell.processing.geom.BoundaryBuilder;
import stormcell.utils.GeoUtils;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.TopologyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Merges the cells of one scan in two passes:
 * <ol>
 *     <li>Small cells (fewer gates than a fraction of the largest cell) whose buffered bounding box touches the bounding box of a large cell are absorbed by the closest such cell, until no merge occurs</li>
 *     <li>Any two cells whose footprints (polygon, or bounding box if there is none) overlap are merged, the larger absorbing the smaller, until no overlap remains</li>
 * </ol>
 * The first pass relies on bounding boxes only, the second on footprints.
 * @author Jean Ollion
 */
public class CellMerger {
    public final static Logger logger = LoggerFactory.getLogger(CellMerger.class);
    /** intersections with a smaller area (squared degrees) are considered as contacts */
    public static final double MIN_OVERLAP_AREA = 1e-12;
    final double sizeRatioThreshold, bufferKm, alpha;

    public CellMerger(double sizeRatioThreshold, double bufferKm, double alpha) {
        this.sizeRatioThreshold = sizeRatioThreshold;
        this.bufferKm = bufferKm;
        this.alpha = alpha;
    }

    public static List<CandidateCell> merge(List<CandidateCell> cells, double sizeRatioThreshold, double bufferKm, double alpha) {
        return new CellMerger(sizeRatioThreshold, bufferKm, alpha).merge(cells);
    }

    /**
     * @return remaining cells, in input order. Input list is not modified, but cells that absorb others are
     */
    public List<CandidateCell> merge(List<CandidateCell> cells) {
        List<CandidateCell> res = new ArrayList<>(cells);
        int n = res.size();
        int absorbed = mergeSmallCells(res);
        int overlaps = resolveOverlaps(res);
        logger.debug("merge: {} cells -> {} ({} small cells absorbed, {} overlaps resolved)", n, res.size(), absorbed, overlaps);
        return res;
    }

    /**
     * Small and large cells are defined once from the initial gate counts: a large cell never becomes small as its neighbors grow.
     * Small cells are absorbed until a pass absorbs none, so a small cell can be reached by a large cell whose box grew in a previous pass
     * @return number of merges
     */
    public int mergeSmallCells(List<CandidateCell> cells) {
        if (cells.size() < 2) return 0;
        int maxGates = cells.stream().mapToInt(CandidateCell::getNumGates).max().orElse(0);
        double sizeThld = maxGates * sizeRatioThreshold;
        List<CandidateCell> large = cells.stream().filter(c -> c.getNumGates() >= sizeThld).collect(Collectors.toList());
        List<CandidateCell> small = cells.stream().filter(c -> c.getNumGates() < sizeThld).collect(Collectors.toList());
        int count = 0;
        boolean merged = true;
        while (merged && !small.isEmpty()) {
            merged = false;
            Iterator<CandidateCell> it = small.iterator();
            while (it.hasNext()) {
                CandidateCell s = it.next();
                if (s.getBounds()==null || s.getCentroid()==null) continue;
                double[] buffer = GeoUtils.kmToDegrees(s.getCentroid().lat, bufferKm);
                BoundingBox searchBox = s.getBounds().dilate(buffer[0], buffer[1]);
                CandidateCell closest = large.stream()
                        .filter(l -> l.getBounds()!=null && l.getCentroid()!=null && searchBox.intersects(l.getBounds()))
                        .min(Comparator.comparingDouble(l -> l.getCentroid().distanceDeg(s.getCentroid()))).orElse(null);
                if (closest==null) continue;
                if (s.getNumGates() >= closest.getNumGates() * sizeRatioThreshold) continue;
                logger.trace("small cell {} ({} gates) absorbed by cell {} ({} gates)", s.getId(), s.getNumGates(), closest.getId(), closest.getNumGates());
                absorb(closest, s, alpha);
                cells.remove(s);
                it.remove();
                merged = true;
                ++count;
            }
        }
        return count;
    }

    /**
     * @return number of merges
     */
    public int resolveOverlaps(List<CandidateCell> cells) {
        int count = 0;
        boolean merged = true;
        while (merged) {
            merged = false;
            search : for (int i = 0; i<cells.size()-1; ++i) {
                for (int j = i+1; j<cells.size(); ++j) {
                    CandidateCell a = cells.get(i);
                    CandidateCell b = cells.get(j);
                    if (overlap(a, b)) {
                        CandidateCell larger = a.getNumGates() >= b.getNumGates() ? a : b;
                        CandidateCell smaller = larger==a ? b : a;
                        logger.trace("overlapping cells {} and {}: merging", larger.getId(), smaller.getId());
                        absorb(larger, smaller, alpha);
                        cells.remove(smaller);
                        merged = true;
                        ++count;
                        break search;
                    }
                }
            }
        }
        return count;
    }

    /**
     * @return true if footprints of both cells have an intersection of positive area. Pairs whose intersection cannot be computed are considered non overlapping
     */
    public static boolean overlap(StormObject a, StormObject b) {
        Geometry ga = a.getFootprint();
        Geometry gb = b.getFootprint();
        if (ga==null || gb==null || ga.getDimension()<2 || gb.getDimension()<2) return false;
        try {
            if (!ga.getEnvelopeInternal().intersects(gb.getEnvelopeInternal()) || !ga.intersects(gb)) return false;
            return ga.intersection(gb).getArea() > MIN_OVERLAP_AREA;
        } catch (TopologyException e) {
            logger.warn("could not compute intersection of cells {} and {}: {}", a.getId(), b.getId(), e.getMessage());
            return false;
        }
    }

    /**
     * Merges {@param source} into {@param target}: gate counts are summed, centroid is the gate-weighted average,
     * boundary is the alpha shape of the union of both boundaries' vertices and bounding box the union of both boxes
     */
    public static void absorb(CandidateCell target, CandidateCell source, double alpha) {
        int n1 = target.getNumGates(), n2 = source.getNumGates();
        GeoPoint c1 = target.getCentroid(), c2 = source.getCentroid();
        if (c1!=null && c2!=null && n1+n2>0) {
            target.setCentroid(new GeoPoint((c1.lat * n1 + c2.lat * n2) / (n1 + n2), (c1.lon * n1 + c2.lon * n2) / (n1 + n2)));
        } else if (c1==null) target.setCentroid(c2);
        target.setNumGates(n1 + n2);
        target.setMaxReflectivity(Math.max(target.getMaxReflectivity(), source.getMaxReflectivity()));
        if (target.getPixels()!=null && source.getPixels()!=null) target.getPixels().addAll(source.getPixels());
        Coordinate[] p1 = target.getBoundary().getPoints();
        Coordinate[] p2 = source.getBoundary().getPoints();
        Coordinate[] points = new Coordinate[p1.length + p2.length];
        System.arraycopy(p1, 0, points, 0, p1.length);
        System.arraycopy(p2, 0, points, p1.length, p2.length);
        Boundary boundary = BoundaryBuilder.buildBoundary(points, alpha);
        BoundingBox bounds = target.getBounds()==null ? source.getBounds() : target.getBounds().union(source.getBounds());
        if (bounds==null) bounds = BoundaryBuilder.getBounds(boundary, points);
        target.setBoundary(boundary).setBounds(bounds);
    }
}
