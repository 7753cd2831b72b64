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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of matching two successive scans
 * @author Jean Ollion
 */
public class MatchResult {
    public enum Status {
        /** one side is empty */
        EMPTY,
        /** no pair is within gating distance */
        INFEASIBLE,
        /** minimal cost assignment */
        OPTIMAL,
        /** exact solver failed: greedy assignment, possibly not optimal */
        FALLBACK
    }
    final Status status;
    final List<Match> matches;
    final List<Integer> unmatchedOld, unmatchedNew;

    public MatchResult(Status status, List<Match> matches, int oldCount, int newCount) {
        this.status = status;
        this.matches = Collections.unmodifiableList(new ArrayList<>(matches));
        boolean[] oldMatched = new boolean[oldCount];
        boolean[] newMatched = new boolean[newCount];
        for (Match m : matches) {
            if (oldMatched[m.oldIndex] || newMatched[m.newIndex]) throw new IllegalArgumentException("Index matched several times: "+m);
            oldMatched[m.oldIndex] = true;
            newMatched[m.newIndex] = true;
        }
        List<Integer> uo = new ArrayList<>(), un = new ArrayList<>();
        for (int i = 0; i<oldCount; ++i) if (!oldMatched[i]) uo.add(i);
        for (int i = 0; i<newCount; ++i) if (!newMatched[i]) un.add(i);
        this.unmatchedOld = Collections.unmodifiableList(uo);
        this.unmatchedNew = Collections.unmodifiableList(un);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isDegraded() {
        return status == Status.FALLBACK;
    }

    public List<Match> getMatches() {
        return matches;
    }

    /**
     * @return indices of previous cells without match (termination candidates), in increasing order
     */
    public List<Integer> getUnmatchedOld() {
        return unmatchedOld;
    }

    /**
     * @return indices of current cells without match (new tracks), in increasing order
     */
    public List<Integer> getUnmatchedNew() {
        return unmatchedNew;
    }

    @Override
    public String toString() {
        return status+": "+matches.size()+" matches, unmatched old="+unmatchedOld+" new="+unmatchedNew;
    }
}
