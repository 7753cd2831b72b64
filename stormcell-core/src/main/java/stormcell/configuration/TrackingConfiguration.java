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
package stormcell.configuration;

import stormcell.configuration.parameters.BooleanParameter;
import stormcell.configuration.parameters.BoundedNumberParameter;
import stormcell.configuration.parameters.EnumChoiceParameter;
import stormcell.configuration.parameters.GroupParameter;
import stormcell.configuration.parameters.Parameter;
import stormcell.processing.Connectivity;
import stormcell.utils.JSONSerializable;
import stormcell.utils.JSONUtils;
import stormcell.utils.Utils;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * All tunable values of the detection / tracking pipeline, grouped by processing step.
 * Serialized as a JSON object keyed by group name, then parameter name.
 * @author Jean Ollion
 */
public class TrackingConfiguration implements JSONSerializable {
    public final static Logger logger = LoggerFactory.getLogger(TrackingConfiguration.class);

    // detection
    final BoundedNumberParameter seedDbz = new BoundedNumberParameter("seed_dbz", 2, 50).setHint("Minimal reflectivity (dBZ) of a gate to be part of a cell core");
    final BoundedNumberParameter expandDbz = new BoundedNumberParameter("expand_dbz", 2, 40).setHint("Minimal reflectivity (dBZ) of a gate a cell can grow into. Must not exceed the seed threshold");
    final BoundedNumberParameter minGates = new BoundedNumberParameter("min_gates", 0, 25, 1, null).setHint("Cells with fewer gates are discarded");
    final BoundedNumberParameter maxIterations = new BoundedNumberParameter("max_iterations", 0, 100, 0, null).setHint("Maximal number of growth sweeps");
    final EnumChoiceParameter<Connectivity> connectivity = new EnumChoiceParameter<>("connectivity", Connectivity.values(), Connectivity.FOUR).setHint("Connectivity used to label seed regions");
    final BoundedNumberParameter alpha = new BoundedNumberParameter("alpha", 4, 0.1, 0, null).setHint("Concavity of cell boundaries (inverse of the maximal circumradius of kept triangles, in degrees). 0 gives the convex hull");
    final BoundedNumberParameter noDataValue = new BoundedNumberParameter("no_data_value", 2, -9999).setHint("Gates with a value lower or equal are considered as missing. NaN is always missing");
    final BoundedNumberParameter numThreads = new BoundedNumberParameter("num_threads", 0, 1, 1, null).setHint("Number of threads used to compute growth candidates");
    final GroupParameter detection = new GroupParameter("detection", seedDbz, expandDbz, minGates, maxIterations, connectivity, alpha, noDataValue, numThreads);
    // merge
    final BoundedNumberParameter sizeRatioThreshold = new BoundedNumberParameter("size_ratio_threshold", 4, 0.9, 0, 1).setHint("Cells with less gates than this fraction of the largest cell are merged into a nearby larger cell");
    final BoundedNumberParameter bufferKm = new BoundedNumberParameter("buffer_km", 3, 1.0, 0, null).setHint("Distance (km) at which a small cell is considered near a larger cell");
    final GroupParameter merge = new GroupParameter("merge", sizeRatioThreshold, bufferKm);
    // termination
    final BoundedNumberParameter coverageThreshold = new BoundedNumberParameter("coverage_threshold_pct", 2, 67.0, 0, 100).setHint("A cell whose polygon is covered by a larger cell above this percentage is terminated");
    final BooleanParameter terminatePrevious = new BooleanParameter("terminate_previous", true).setHint("Whether terminated cells of the previous scan are removed from the tracked collection");
    final GroupParameter termination = new GroupParameter("termination", coverageThreshold, terminatePrevious);
    // matching
    final BoundedNumberParameter distanceWeight = new BoundedNumberParameter("distance_weight", 4, 0.5, 0, null);
    final BoundedNumberParameter numGatesWeight = new BoundedNumberParameter("num_gates_weight", 4, 0.3, 0, null);
    final BoundedNumberParameter reflectivityWeight = new BoundedNumberParameter("reflectivity_weight", 4, 0.2, 0, null);
    final BoundedNumberParameter maxGateKm = new BoundedNumberParameter("max_gate_km", 3, 10, 0, null).setHint("Maximal east-west or north-south displacement (km) between two scans");
    final BoundedNumberParameter distanceNormDeg = new BoundedNumberParameter("distance_norm_deg", 4, 10, 0.0001, null).setHint("Centroid distance (degrees) at which the distance cost saturates");
    final BoundedNumberParameter penaltyCost = new BoundedNumberParameter("penalty_cost", 2, 1000, 1, null).setHint("Cost of infeasible pairings. Assignments at or above this cost are discarded");
    final GroupParameter matching = new GroupParameter("matching", distanceWeight, numGatesWeight, reflectivityWeight, maxGateKm, distanceNormDeg, penaltyCost);
    // motion
    final BoundedNumberParameter maxDisplacementM = new BoundedNumberParameter("max_displacement_m", 1, 9000, 0, null).setHint("Tracks whose last displacement (m) exceeds this value are removed. 0 disables the filter");
    final GroupParameter motion = new GroupParameter("motion", maxDisplacementM);
    // persistence
    final BoundedNumberParameter floatPrecision = new BoundedNumberParameter("float_precision", 0, 4, 0, 15).setHint("Number of decimals of floating point values written to the tracked cell file");
    final GroupParameter persistence = new GroupParameter("persistence", floatPrecision);

    final List<GroupParameter> groups = Arrays.asList(detection, merge, termination, matching, motion, persistence);

    public TrackingConfiguration() {
        expandDbz.addValidationFunction(p -> p.getDoubleValue() <= seedDbz.getDoubleValue());
    }

    public static TrackingConfiguration load(Path file) throws IOException, ParseException {
        TrackingConfiguration res = new TrackingConfiguration();
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        res.initFromJSONEntry(JSONUtils.parse(content));
        logger.debug("configuration loaded from {}: {}", file, res);
        return res;
    }

    public boolean isValid() {
        return groups.stream().allMatch(GroupParameter::isValid);
    }

    /**
     * @throws IllegalArgumentException if one parameter is invalid
     */
    public TrackingConfiguration checkValid() {
        if (!isValid()) {
            List<String> invalid = groups.stream().flatMap(g -> g.getInvalidParameters().stream().map(p -> g.getName()+"."+p.getName()+"="+p.toJSONEntry())).collect(Collectors.toList());
            throw new IllegalArgumentException("Invalid configuration: "+Utils.toStringList(invalid));
        }
        return this;
    }

    public List<GroupParameter> getGroups() {
        return groups;
    }

    // detection
    public double getSeedDbz() {return seedDbz.getDoubleValue();}
    public TrackingConfiguration setSeedDbz(double value) {seedDbz.setValue(value); return this;}
    public double getExpandDbz() {return expandDbz.getDoubleValue();}
    public TrackingConfiguration setExpandDbz(double value) {expandDbz.setValue(value); return this;}
    public int getMinGates() {return minGates.getIntValue();}
    public TrackingConfiguration setMinGates(int value) {minGates.setValue(value); return this;}
    public int getMaxIterations() {return maxIterations.getIntValue();}
    public TrackingConfiguration setMaxIterations(int value) {maxIterations.setValue(value); return this;}
    public Connectivity getConnectivity() {return connectivity.getSelectedEnum();}
    public TrackingConfiguration setConnectivity(Connectivity value) {connectivity.setSelectedEnum(value); return this;}
    public double getAlpha() {return alpha.getDoubleValue();}
    public TrackingConfiguration setAlpha(double value) {alpha.setValue(value); return this;}
    public double getNoDataValue() {return noDataValue.getDoubleValue();}
    public int getNumThreads() {return numThreads.getIntValue();}
    public TrackingConfiguration setNumThreads(int value) {numThreads.setValue(value); return this;}
    // merge
    public double getSizeRatioThreshold() {return sizeRatioThreshold.getDoubleValue();}
    public TrackingConfiguration setSizeRatioThreshold(double value) {sizeRatioThreshold.setValue(value); return this;}
    public double getBufferKm() {return bufferKm.getDoubleValue();}
    public TrackingConfiguration setBufferKm(double value) {bufferKm.setValue(value); return this;}
    // termination
    public double getCoverageThresholdPct() {return coverageThreshold.getDoubleValue();}
    public TrackingConfiguration setCoverageThresholdPct(double value) {coverageThreshold.setValue(value); return this;}
    public boolean terminatePrevious() {return terminatePrevious.getSelected();}
    public TrackingConfiguration setTerminatePrevious(boolean value) {terminatePrevious.setSelected(value); return this;}
    // matching
    public double getDistanceWeight() {return distanceWeight.getDoubleValue();}
    public double getNumGatesWeight() {return numGatesWeight.getDoubleValue();}
    public double getReflectivityWeight() {return reflectivityWeight.getDoubleValue();}
    public TrackingConfiguration setWeights(double distance, double numGates, double reflectivity) {
        distanceWeight.setValue(distance);
        numGatesWeight.setValue(numGates);
        reflectivityWeight.setValue(reflectivity);
        return this;
    }
    public double getMaxGateKm() {return maxGateKm.getDoubleValue();}
    public TrackingConfiguration setMaxGateKm(double value) {maxGateKm.setValue(value); return this;}
    public double getDistanceNormDeg() {return distanceNormDeg.getDoubleValue();}
    public double getPenaltyCost() {return penaltyCost.getDoubleValue();}
    // motion
    public double getMaxDisplacementM() {return maxDisplacementM.getDoubleValue();}
    public TrackingConfiguration setMaxDisplacementM(double value) {maxDisplacementM.setValue(value); return this;}
    // persistence
    public int getFloatPrecision() {return floatPrecision.getIntValue();}

    @Override
    public JSONObject toJSONEntry() {
        return JSONUtils.toJSONMap(groups);
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Configuration must be a JSON object, found: "+jsonEntry);
        JSONUtils.fromJSONMap(groups, (Map)jsonEntry);
    }

    @Override
    public String toString() {
        return Utils.toStringList(groups);
    }
}
