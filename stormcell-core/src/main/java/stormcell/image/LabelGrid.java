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
package stormcell.image;

import java.util.Arrays;

/**
 * Owner-id grid: one integer per pixel, 0 for unclaimed pixels, the owning cell's label otherwise
 * @author Jean Ollion
 */
public class LabelGrid {
    final int sizeX, sizeY;
    final int[] labels;

    public LabelGrid(int sizeX, int sizeY) {
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.labels = new int[sizeX * sizeY];
    }

    private LabelGrid(int sizeX, int sizeY, int[] labels) {
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.labels = labels;
    }

    public int sizeX() {
        return sizeX;
    }

    public int sizeY() {
        return sizeY;
    }

    public int getLabel(int idx) {
        return labels[idx];
    }

    public boolean isClaimed(int idx) {
        return labels[idx] != 0;
    }

    public void setLabel(int idx, int label) {
        labels[idx] = label;
    }

    /**
     * Sets {@param label} at {@param idx} only if the pixel is unclaimed
     * @return true if the pixel has been claimed
     */
    public boolean claim(int idx, int label) {
        if (labels[idx] != 0) return false;
        labels[idx] = label;
        return true;
    }

    public int countClaimed() {
        int count = 0;
        for (int l : labels) if (l != 0) ++count;
        return count;
    }

    public LabelGrid duplicate() {
        return new LabelGrid(sizeX, sizeY, Arrays.copyOf(labels, labels.length));
    }
}
