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

import stormcell.processing.matching.MatchResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary of the processing of one scan
 * @author Jean Ollion
 */
public class ScanReport {
    final String timestamp;
    int detectedCells, mergedCells;
    MatchResult.Status matchStatus = MatchResult.Status.EMPTY;
    final List<Integer> matchedIds = new ArrayList<>(), createdIds = new ArrayList<>(), terminatedIds = new ArrayList<>(), filteredIds = new ArrayList<>();

    public ScanReport(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getTimestamp() {
        return timestamp;
    }

    /**
     * @return number of cells after region growing
     */
    public int getDetectedCells() {
        return detectedCells;
    }

    /**
     * @return number of cells after merging
     */
    public int getMergedCells() {
        return mergedCells;
    }

    public MatchResult.Status getMatchStatus() {
        return matchStatus;
    }

    public List<Integer> getMatchedIds() {
        return Collections.unmodifiableList(matchedIds);
    }

    public List<Integer> getCreatedIds() {
        return Collections.unmodifiableList(createdIds);
    }

    /**
     * @return ids of previous tracks removed because they are covered by a larger track
     */
    public List<Integer> getTerminatedIds() {
        return Collections.unmodifiableList(terminatedIds);
    }

    /**
     * @return ids of tracks removed because of an implausible displacement
     */
    public List<Integer> getFilteredIds() {
        return Collections.unmodifiableList(filteredIds);
    }

    @Override
    public String toString() {
        return "Scan "+timestamp+": "+detectedCells+" detected, "+mergedCells+" after merge, matching "+matchStatus
                +", matched="+matchedIds+", new="+createdIds+", terminated="+terminatedIds+", filtered="+filteredIds;
    }
}
