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

import stormcell.data_structure.CoordCollection;
import stormcell.image.LabelGrid;
import stormcell.image.ReflectivityGrid;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.function.IntPredicate;

/**
 * Labels connected components of a binary mask in a single raster scan, fusing labels when two components meet.
 * Components are returned in raster order of their first pixel, with pixels in raster order.
 * @author Jean Ollion
 */
public class ImageLabeller {
    public final LabelGrid labels;
    final TreeMap<Integer, Spot> spots;
    final IntPredicate mask;
    final int sizeX, sizeY;
    final int[][] neigh;

    public ImageLabeller(int sizeX, int sizeY, IntPredicate mask, Connectivity connectivity) {
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.mask = mask;
        this.labels = new LabelGrid(sizeX, sizeY);
        this.spots = new TreeMap<>();
        this.neigh = connectivity.getHalfNeighborhood();
    }

    /**
     * @return connected regions of pixels of {@param grid} with valid value greater or equal to {@param threshold}
     */
    public static List<CoordCollection> labelAbove(ReflectivityGrid grid, double threshold, Connectivity connectivity) {
        ImageLabeller il = new ImageLabeller(grid.sizeX(), grid.sizeY(), idx -> grid.isAbove(idx, threshold), connectivity);
        il.labelSpots();
        return il.getRegions();
    }

    public static List<CoordCollection> labelMask(int sizeX, int sizeY, IntPredicate mask, Connectivity connectivity) {
        ImageLabeller il = new ImageLabeller(sizeX, sizeY, mask, connectivity);
        il.labelSpots();
        return il.getRegions();
    }

    protected List<CoordCollection> getRegions() {
        List<CoordCollection> res = new ArrayList<>(spots.size());
        for (Spot s : spots.values()) {
            CoordCollection cc = new CoordCollection(sizeX, sizeY);
            s.voxels.stream().sorted().forEach(cc::add);
            res.add(cc);
        }
        return res;
    }

    private void labelSpots() {
        int currentLabel = 1;
        CoordCollection cc = new CoordCollection(sizeX, sizeY);
        for (int y = 0; y < sizeY; ++y) {
            for (int x = 0; x < sizeX; ++x) {
                int coord = x + y * sizeX;
                if (mask.test(coord)) {
                    Spot currentSpot = null;
                    for (int[] t : neigh) {
                        if (cc.insideBounds(coord, t[0], t[1])) {
                            int next = cc.translate(coord, t[0], t[1]);
                            int nextLabel = labels.getLabel(next);
                            if (nextLabel != 0) {
                                if (currentSpot == null) {
                                    currentSpot = spots.get(nextLabel);
                                    currentSpot.addVox(coord);
                                } else if (nextLabel != currentSpot.label) {
                                    currentSpot = currentSpot.fusion(spots.get(nextLabel));
                                    currentSpot.addVox(coord);
                                }
                            }
                        }
                    }
                    if (currentSpot == null) {
                        spots.put(currentLabel, new Spot(currentLabel++, coord));
                    }
                }
            }
        }
    }

    class Spot {
        final CoordCollection voxels;
        int label;

        Spot(int label, int coord) {
            this.label = label;
            this.voxels = new CoordCollection(sizeX, sizeY);
            addVox(coord);
        }

        void addVox(int c) {
            voxels.add(c);
            labels.setLabel(c, label);
        }

        void setLabel(int label) {
            this.label = label;
            voxels.stream().forEach(c -> labels.setLabel(c, label));
        }

        Spot fusion(Spot other) {
            if (other.label < label) {
                return other.fusion(this);
            }
            spots.remove(other.label);
            voxels.addAll(other.voxels);
            other.setLabel(label);
            return this;
        }
    }
}
