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
package stormcell.core.enrichment;

/**
 * Fields written on history snapshots by enrichment sources.
 * Required fields always receive a value: the measurement or a {@link Sentinel} when the source is unavailable.
 * Optional fields are only written when a measurement exists.
 * @author Jean Ollion
 */
public enum EnrichmentField {
    CG_FLASH_RATE("CGFlashRate", true),
    ECHO_TOP_18("EchoTop18", true),
    ECHO_TOP_30("EchoTop30", true),
    PRECIP_RATE("PrecipRate", true),
    VIL_DENSITY("VILDensity", true),
    ROTATION_TRACK("RotationTrack", true),
    REFLECTIVITY_LOWEST_ALTITUDE("RALA", true),
    VII("VII", true),
    PROB_SEVERE("prob_severe", false),
    PROB_HAIL("prob_hail", false),
    PROB_WIND("prob_wind", false),
    PROB_TOR("prob_tor", false),
    PROBSEVERE_DISTANCE_KM("probsevere_distance_km", false);

    public enum Sentinel {
        /** no measurement within the cell */
        NOT_AVAILABLE("N/A"),
        /** source dataset could not be read */
        DATASET_LOAD_ERROR("DATASET_LOAD_ERROR"),
        /** source failed while processing */
        PROCESSING_ERROR("PROCESSING_ERROR");
        public final String value;
        Sentinel(String value) {
            this.value = value;
        }
        public static boolean isSentinel(Object value) {
            if (!(value instanceof String)) return false;
            for (Sentinel s : values()) if (s.value.equals(value)) return true;
            return false;
        }
    }

    public final String key;
    public final boolean required;

    EnrichmentField(String key, boolean required) {
        this.key = key;
        this.required = required;
    }
}
