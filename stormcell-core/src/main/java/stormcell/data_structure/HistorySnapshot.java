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
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * State of a tracked cell at one scan. Motion fields are set once the track has at least two snapshots.
 * Fields written by other tools (enrichment) are kept untouched in their original order.
 * @author Jean Ollion
 */
public class HistorySnapshot {
    public static final String TIMESTAMP = "timestamp", MAX_REFLECTIVITY = "max_reflectivity_dbz", NUM_GATES = "num_gates", CENTROID = "centroid", DX = "dx", DY = "dy", DT = "dt";
    static final Set<String> CORE_KEYS = ImmutableSet.of(TIMESTAMP, MAX_REFLECTIVITY, NUM_GATES, CENTROID, DX, DY, DT);
    String timestamp;
    double maxReflectivity;
    int numGates;
    GeoPoint centroid;
    Double dx, dy, dt;
    final LinkedHashMap<String, Object> extraFields = new LinkedHashMap<>();

    public HistorySnapshot(String timestamp, double maxReflectivity, int numGates, GeoPoint centroid) {
        this.timestamp = timestamp;
        this.maxReflectivity = maxReflectivity;
        this.numGates = numGates;
        this.centroid = centroid;
    }

    public static HistorySnapshot of(String timestamp, StormObject cell) {
        return new HistorySnapshot(timestamp, cell.getMaxReflectivity(), cell.getNumGates(), cell.getCentroid());
    }

    public String getTimestamp() {
        return timestamp;
    }

    public double getMaxReflectivity() {
        return maxReflectivity;
    }

    public int getNumGates() {
        return numGates;
    }

    public GeoPoint getCentroid() {
        return centroid;
    }

    /**
     * Overwrites the detection fields with those of {@param other}. Extra fields of this snapshot are kept
     */
    public HistorySnapshot updateFrom(HistorySnapshot other) {
        this.maxReflectivity = other.maxReflectivity;
        this.numGates = other.numGates;
        this.centroid = other.centroid;
        for (Map.Entry<String, Object> e : other.extraFields.entrySet()) extraFields.putIfAbsent(e.getKey(), e.getValue());
        return this;
    }

    public boolean hasMotion() {
        return dx!=null && dy!=null && dt!=null;
    }

    /**
     * @return east-west displacement since the previous snapshot (m), null if not computed
     */
    public Double getDx() {
        return dx;
    }

    /**
     * @return north-south displacement since the previous snapshot (m), null if not computed
     */
    public Double getDy() {
        return dy;
    }

    /**
     * @return elapsed time since the previous snapshot (s), null if not computed
     */
    public Double getDt() {
        return dt;
    }

    public HistorySnapshot setMotion(double dx, double dy, double dt) {
        this.dx = dx;
        this.dy = dy;
        this.dt = dt;
        return this;
    }

    /**
     * @return displacement magnitude in meters, NaN if motion was not computed
     */
    public double getDisplacement() {
        if (!hasMotion()) return Double.NaN;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * @return speed in m/s, NaN if motion was not computed or elapsed time is null
     */
    public double getSpeed() {
        if (!hasMotion() || dt==0) return Double.NaN;
        return getDisplacement() / dt;
    }

    /**
     * @return mathematical bearing of the displacement (radians, counter-clockwise from east), NaN if motion was not computed
     */
    public double getBearing() {
        if (!hasMotion()) return Double.NaN;
        return Math.atan2(dy, dx);
    }

    /**
     * @return fields added by other tools, modifiable
     */
    public Map<String, Object> getExtraFields() {
        return extraFields;
    }

    public Object getExtraField(String key) {
        return extraFields.get(key);
    }

    public HistorySnapshot setExtraField(String key, Object value) {
        if (CORE_KEYS.contains(key)) throw new IllegalArgumentException("Reserved snapshot field: "+key);
        extraFields.put(key, value);
        return this;
    }

    public HistorySnapshot duplicate() {
        HistorySnapshot res = new HistorySnapshot(timestamp, maxReflectivity, numGates, centroid);
        res.dx = dx;
        res.dy = dy;
        res.dt = dt;
        for (Map.Entry<String, Object> e : extraFields.entrySet()) res.extraFields.put(e.getKey(), JSONUtils.deepCopy(e.getValue()));
        return res;
    }

    public Map<String, Object> toJSONEntry(int decimalPlaces) {
        Map<String, Object> res = new LinkedHashMap<>();
        res.put(TIMESTAMP, timestamp);
        res.put(MAX_REFLECTIVITY, JSONUtils.round(maxReflectivity, decimalPlaces));
        res.put(NUM_GATES, numGates);
        res.put(CENTROID, centroid==null ? null : centroid.toJSONEntry(decimalPlaces));
        if (dx!=null) res.put(DX, JSONUtils.round(dx, decimalPlaces));
        if (dy!=null) res.put(DY, JSONUtils.round(dy, decimalPlaces));
        if (dt!=null) res.put(DT, JSONUtils.round(dt, decimalPlaces));
        for (Map.Entry<String, Object> e : extraFields.entrySet()) res.put(e.getKey(), JSONUtils.deepCopy(e.getValue()));
        return res;
    }

    public static HistorySnapshot fromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Invalid history snapshot: "+jsonEntry);
        Map<?, ?> m = (Map<?, ?>)jsonEntry;
        Object ts = m.get(TIMESTAMP);
        if (ts==null) throw new IllegalArgumentException("History snapshot without timestamp: "+jsonEntry);
        Object refl = m.get(MAX_REFLECTIVITY);
        Object gates = m.get(NUM_GATES);
        Object centroid = m.get(CENTROID);
        HistorySnapshot res = new HistorySnapshot(ts.toString(),
                refl instanceof Number ? ((Number)refl).doubleValue() : Double.NaN,
                gates instanceof Number ? ((Number)gates).intValue() : 0,
                centroid==null ? null : GeoPoint.fromJSONEntry(centroid));
        Object dx = m.get(DX), dy = m.get(DY), dt = m.get(DT);
        if (dx instanceof Number && dy instanceof Number && dt instanceof Number) res.setMotion(((Number)dx).doubleValue(), ((Number)dy).doubleValue(), ((Number)dt).doubleValue());
        for (Map.Entry<?, ?> e : m.entrySet()) {
            String key = String.valueOf(e.getKey());
            if (!CORE_KEYS.contains(key)) res.extraFields.put(key, e.getValue());
        }
        return res;
    }

    @Override
    public String toString() {
        return timestamp+"[gates="+numGates+", max="+maxReflectivity+", centroid="+centroid+(hasMotion() ? ", dx="+dx+", dy="+dy+", dt="+dt : "")+"]";
    }
}
