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

import stormcell.utils.JSONUtils;
import stormcell.utils.TimestampUtils;
import com.google.common.collect.ImmutableSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Storm cell tracked across scans. The id is assigned at creation and never changes.
 * Current geometry and attributes mirror the latest detection; {@link #getHistory()} is ordered chronologically with at most one snapshot per timestamp.
 * @author Jean Ollion
 */
public class TrackedCell implements StormObject {
    public static final String ID = "id", NUM_GATES = "num_gates", MAX_REFLECTIVITY = "max_reflectivity_dbz", CENTROID = "centroid", BBOX = "bbox", ALPHA_SHAPE = "alpha_shape", HISTORY = "storm_history";
    static final Set<String> CORE_KEYS = ImmutableSet.of(ID, NUM_GATES, MAX_REFLECTIVITY, CENTROID, BBOX, ALPHA_SHAPE, HISTORY);
    final int id;
    int numGates;
    double maxReflectivity;
    GeoPoint centroid;
    BoundingBox bounds;
    Boundary boundary = Boundary.EMPTY;
    final List<HistorySnapshot> history = new ArrayList<>();
    final LinkedHashMap<String, Object> extraFields = new LinkedHashMap<>();

    public TrackedCell(int id) {
        this.id = id;
    }

    /**
     * Creates a track from its first detection
     */
    public static TrackedCell create(int id, StormObject detection, String timestamp) {
        TrackedCell res = new TrackedCell(id);
        res.setState(detection);
        res.history.add(HistorySnapshot.of(timestamp, detection));
        return res;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public int getNumGates() {
        return numGates;
    }

    @Override
    public double getMaxReflectivity() {
        return maxReflectivity;
    }

    @Override
    public GeoPoint getCentroid() {
        return centroid;
    }

    @Override
    public BoundingBox getBounds() {
        return bounds;
    }

    @Override
    public Boundary getBoundary() {
        return boundary;
    }

    /**
     * Current attributes and geometry are set from {@param detection}; history is not modified
     */
    public TrackedCell setState(StormObject detection) {
        this.numGates = detection.getNumGates();
        this.maxReflectivity = detection.getMaxReflectivity();
        this.centroid = detection.getCentroid();
        this.bounds = detection.getBounds();
        this.boundary = detection.getBoundary()==null ? Boundary.EMPTY : detection.getBoundary();
        return this;
    }

    public List<HistorySnapshot> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public HistorySnapshot getLastSnapshot() {
        return history.isEmpty() ? null : history.get(history.size()-1);
    }

    public HistorySnapshot getSnapshot(String timestamp) {
        for (HistorySnapshot s : history) if (s.timestamp.equals(timestamp)) return s;
        return null;
    }

    /**
     * Adds {@param snapshot} to the history, or updates the existing snapshot with the same timestamp in place.
     * History is sorted chronologically afterwards.
     * @return true if a new snapshot was appended
     */
    public boolean addOrUpdateSnapshot(HistorySnapshot snapshot) {
        HistorySnapshot existing = getSnapshot(snapshot.timestamp);
        if (existing!=null) {
            existing.updateFrom(snapshot);
            return false;
        }
        history.add(snapshot);
        sortHistory();
        return true;
    }

    public void sortHistory() {
        history.sort((s1, s2) -> TimestampUtils.CHRONOLOGICAL.compare(s1.timestamp, s2.timestamp));
    }

    /**
     * @return top-level fields added by other tools, modifiable
     */
    public Map<String, Object> getExtraFields() {
        return extraFields;
    }

    public TrackedCell duplicate() {
        TrackedCell res = new TrackedCell(id);
        res.numGates = numGates;
        res.maxReflectivity = maxReflectivity;
        res.centroid = centroid;
        res.bounds = bounds;
        res.boundary = boundary;
        for (HistorySnapshot s : history) res.history.add(s.duplicate());
        for (Map.Entry<String, Object> e : extraFields.entrySet()) res.extraFields.put(e.getKey(), JSONUtils.deepCopy(e.getValue()));
        return res;
    }

    /**
     * @param decimalPlaces floating point values are rounded to this number of decimals. negative value: no rounding
     */
    public Map<String, Object> toJSONEntry(int decimalPlaces) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put(ID, id);
        res.put(NUM_GATES, numGates);
        res.put(MAX_REFLECTIVITY, JSONUtils.round(maxReflectivity, decimalPlaces));
        res.put(CENTROID, centroid==null ? null : centroid.toJSONEntry(decimalPlaces));
        res.put(BBOX, bounds==null ? new LinkedHashMap<>() : bounds.toJSONEntry(decimalPlaces));
        res.put(ALPHA_SHAPE, boundary.toJSONEntry(decimalPlaces));
        List<Object> hist = new ArrayList<>(history.size());
        for (HistorySnapshot s : history) hist.add(s.toJSONEntry(decimalPlaces));
        res.put(HISTORY, hist);
        for (Map.Entry<String, Object> e : extraFields.entrySet()) res.put(e.getKey(), JSONUtils.deepCopy(e.getValue()));
        return res;
    }

    public static TrackedCell fromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Invalid tracked cell: "+jsonEntry);
        Map<?, ?> m = (Map<?, ?>)jsonEntry;
        Object id = m.get(ID);
        if (!(id instanceof Number)) throw new IllegalArgumentException("Tracked cell without id: "+jsonEntry);
        TrackedCell res = new TrackedCell(((Number)id).intValue());
        Object hist = m.get(HISTORY);
        if (hist instanceof List) {
            for (Object o : (List<?>)hist) res.history.add(HistorySnapshot.fromJSONEntry(o));
            res.sortHistory();
        }
        HistorySnapshot last = res.getLastSnapshot();
        Object gates = m.get(NUM_GATES);
        if (gates instanceof Number) res.numGates = ((Number)gates).intValue();
        else if (last!=null) res.numGates = last.numGates;
        Object refl = m.get(MAX_REFLECTIVITY);
        if (refl instanceof Number) res.maxReflectivity = ((Number)refl).doubleValue();
        else if (last!=null) res.maxReflectivity = last.maxReflectivity;
        Object centroid = m.get(CENTROID);
        if (centroid!=null) res.centroid = GeoPoint.fromJSONEntry(centroid);
        else if (last!=null) res.centroid = last.centroid;
        Object bbox = m.get(BBOX);
        if (bbox instanceof Map && !((Map<?, ?>)bbox).isEmpty()) res.bounds = BoundingBox.fromJSONEntry(bbox);
        res.boundary = Boundary.fromJSONEntry(m.get(ALPHA_SHAPE));
        if (res.bounds==null && res.boundary.isPolygonal()) res.bounds = res.boundary.getBounds();
        for (Map.Entry<?, ?> e : m.entrySet()) {
            String key = String.valueOf(e.getKey());
            if (!CORE_KEYS.contains(key)) res.extraFields.put(key, e.getValue());
        }
        return res;
    }

    @Override
    public String toString() {
        return "Track#"+id+"[gates="+numGates+", centroid="+centroid+", history="+history.size()+"]";
    }
}
