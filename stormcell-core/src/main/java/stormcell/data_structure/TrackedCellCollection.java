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
package stormcell.data_structure;

import stormcell.utils.TimestampUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tracked cells indexed by id, in insertion order. Ids handed out by {@link #nextId()} are never reused within the lifetime of the collection.
 * Not thread safe.
 * @author Jean Ollion
 */
public class TrackedCellCollection {
    public final static Logger logger = LoggerFactory.getLogger(TrackedCellCollection.class);
    final Map<Integer, TrackedCell> cells = new LinkedHashMap<>();
    int maxAllocatedId = 0;

    public TrackedCellCollection() {}

    public TrackedCellCollection(Collection<TrackedCell> cells) {
        for (TrackedCell c : cells) addOrMerge(c);
    }

    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public TrackedCell get(int id) {
        return cells.get(id);
    }

    public boolean contains(int id) {
        return cells.containsKey(id);
    }

    public List<TrackedCell> getCells() {
        return new ArrayList<>(cells.values());
    }

    public Stream<TrackedCell> stream() {
        return cells.values().stream();
    }

    public List<Integer> getIds() {
        return new ArrayList<>(cells.keySet());
    }

    /**
     * @throws IllegalArgumentException if a cell with the same id is already present
     */
    public TrackedCellCollection add(TrackedCell cell) {
        if (cells.containsKey(cell.getId())) throw new IllegalArgumentException("Duplicate track id: "+cell.getId());
        cells.put(cell.getId(), cell);
        maxAllocatedId = Math.max(maxAllocatedId, cell.getId());
        return this;
    }

    /**
     * Adds {@param cell}, or merges it with the present cell of same id: snapshots whose timestamp is absent are appended,
     * and current state is taken from the cell with the most recent last snapshot
     * @return the cell stored in the collection
     */
    public TrackedCell addOrMerge(TrackedCell cell) {
        TrackedCell existing = cells.get(cell.getId());
        if (existing==null) {
            add(cell);
            return cell;
        }
        logger.debug("merging duplicated track: {}", cell.getId());
        HistorySnapshot lastExisting = existing.getLastSnapshot();
        HistorySnapshot lastOther = cell.getLastSnapshot();
        boolean otherIsMoreRecent = lastOther!=null && (lastExisting==null || TimestampUtils.CHRONOLOGICAL.compare(lastOther.getTimestamp(), lastExisting.getTimestamp())>0);
        for (HistorySnapshot s : cell.getHistory()) {
            if (existing.getSnapshot(s.getTimestamp())==null) existing.history.add(s);
        }
        existing.sortHistory();
        if (otherIsMoreRecent) existing.setState(cell);
        for (Map.Entry<String, Object> e : cell.getExtraFields().entrySet()) existing.extraFields.putIfAbsent(e.getKey(), e.getValue());
        return existing;
    }

    public TrackedCell remove(int id) {
        return cells.remove(id);
    }

    /**
     * @return removed cells
     */
    public List<TrackedCell> removeAll(Collection<Integer> ids) {
        return ids.stream().map(cells::remove).filter(c -> c!=null).collect(Collectors.toList());
    }

    /**
     * @return a new id greater than any id present in or previously allocated by this collection
     */
    public int nextId() {
        int maxPresent = cells.keySet().stream().mapToInt(i -> i).max().orElse(0);
        maxAllocatedId = Math.max(maxAllocatedId, maxPresent) + 1;
        return maxAllocatedId;
    }

    /**
     * @return deep copy: modifications of the copy's cells and snapshots do not affect this collection
     */
    public TrackedCellCollection duplicate() {
        TrackedCellCollection res = new TrackedCellCollection();
        for (TrackedCell c : cells.values()) res.add(c.duplicate());
        res.maxAllocatedId = maxAllocatedId;
        return res;
    }

    @Override
    public String toString() {
        return "TrackedCells"+cells.keySet();
    }
}
