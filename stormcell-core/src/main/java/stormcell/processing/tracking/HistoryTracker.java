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
package stormcell.processing.tracking;

import stormcell.data_structure.CandidateCell;
import stormcell.data_structure.HistorySnapshot;
import stormcell.data_structure.StormObject;
import stormcell.data_structure.TrackedCell;
import stormcell.data_structure.TrackedCellCollection;
import stormcell.processing.matching.Match;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Applies the matches of one scan to the tracked cells: matched tracks receive a snapshot of their new detection,
 * unmatched detections start new tracks, unmatched previous tracks are left untouched.
 * Snapshots are idempotent: a detection with the timestamp of an existing snapshot updates it in place.
 * @author Jean Ollion
 */
public class HistoryTracker {
    public final static Logger logger = LoggerFactory.getLogger(HistoryTracker.class);

    public static class Update {
        final List<Integer> matchedIds = new ArrayList<>(), createdIds = new ArrayList<>();
        int appendedSnapshots, updatedSnapshots;

        /**
         * @return ids of tracks that received a detection, in match order
         */
        public List<Integer> getMatchedIds() {
            return Collections.unmodifiableList(matchedIds);
        }

        /**
         * @return ids of created tracks, in detection order
         */
        public List<Integer> getCreatedIds() {
            return Collections.unmodifiableList(createdIds);
        }

        public int getAppendedSnapshots() {
            return appendedSnapshots;
        }

        public int getUpdatedSnapshots() {
            return updatedSnapshots;
        }

        @Override
        public String toString() {
            return "matched="+matchedIds+" created="+createdIds+" snapshots: "+appendedSnapshots+" appended, "+updatedSnapshots+" updated";
        }
    }

    /**
     * @param tracked tracked cells, modified in place
     * @param oldCells previous cells, whose ids are track ids of {@param tracked}
     * @param newCells current detections
     * @param matches pairs of indices in {@param oldCells} and {@param newCells}
     * @param timestamp timestamp of the current scan, used when a detection has none
     */
    public static Update apply(TrackedCellCollection tracked, List<? extends StormObject> oldCells, List<CandidateCell> newCells, List<Match> matches, String timestamp) {
        Update update = new Update();
        boolean[] newMatched = new boolean[newCells.size()];
        for (Match m : matches) {
            StormObject old = oldCells.get(m.oldIndex);
            CandidateCell detection = newCells.get(m.newIndex);
            newMatched[m.newIndex] = true;
            TrackedCell track = tracked.get(old.getId());
            String ts = getTimestamp(detection, timestamp);
            if (track==null) {
                logger.warn("matched cell {} is not tracked: creating track", old.getId());
                track = TrackedCell.create(old.getId(), detection, ts);
                tracked.add(track);
                ++update.appendedSnapshots;
            } else {
                if (track.addOrUpdateSnapshot(HistorySnapshot.of(ts, detection))) ++update.appendedSnapshots;
                else ++update.updatedSnapshots;
                if (track.getLastSnapshot().getTimestamp().equals(ts)) track.setState(detection);
                else logger.debug("track {}: scan {} is older than the latest snapshot, current state kept", track.getId(), ts);
            }
            StormVectorCalculator.computeAround(track, ts);
            update.matchedIds.add(track.getId());
        }
        for (int i = 0; i<newCells.size(); ++i) {
            if (newMatched[i]) continue;
            CandidateCell detection = newCells.get(i);
            TrackedCell track = TrackedCell.create(tracked.nextId(), detection, getTimestamp(detection, timestamp));
            tracked.add(track);
            update.createdIds.add(track.getId());
            ++update.appendedSnapshots;
        }
        logger.debug("history update: {}", update);
        return update;
    }

    private static String getTimestamp(CandidateCell detection, String defaultTimestamp) {
        String ts = detection.getTimestamp()!=null ? detection.getTimestamp() : defaultTimestamp;
        if (ts==null) throw new IllegalArgumentException("Detection "+detection.getId()+" has no timestamp");
        return ts;
    }
}
