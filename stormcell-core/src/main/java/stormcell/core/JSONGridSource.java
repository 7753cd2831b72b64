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

import stormcell.image.ReflectivityGrid;
import stormcell.utils.JSONUtils;
import stormcell.utils.TimestampUtils;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a scan from a JSON file: {@code {"timestamp": "...", "reflectivity": [[...]], "latitude": [...], "longitude": [...]}}.
 * Coordinates are either 1D (latitude per row, longitude per column) or 2D. Null reflectivity values are missing data.
 * If the timestamp is absent, it is extracted from the file name.
 * @author Jean Ollion
 */
public class JSONGridSource implements GridSource {
    public final static Logger logger = LoggerFactory.getLogger(JSONGridSource.class);
    public static final String TIMESTAMP = "timestamp", REFLECTIVITY = "reflectivity", LATITUDE = "latitude", LONGITUDE = "longitude", NO_DATA = "no_data_value";
    final Path file;
    double noDataValue = -9999;

    public JSONGridSource(Path file) {
        this.file = file;
    }

    public JSONGridSource setNoDataValue(double noDataValue) {
        this.noDataValue = noDataValue;
        return this;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public ReflectivityGrid getGrid() throws IOException {
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        JSONObject json;
        try {
            json = JSONUtils.parse(content);
        } catch (ParseException e) {
            throw new IOException("Invalid grid file: "+file+" : "+e, e);
        }
        ReflectivityGrid grid = parse(json, file.getFileName().toString(), noDataValue);
        logger.debug("read {} from {}", grid, file);
        return grid;
    }

    /**
     * @param fileName used to extract the timestamp if it is not set in {@param json}. may be null
     * @throws IllegalArgumentException if arrays are missing or shapes are inconsistent
     */
    public static ReflectivityGrid parse(JSONObject json, String fileName, double noDataValue) {
        Object refl = json.get(REFLECTIVITY);
        if (!(refl instanceof List)) throw new IllegalArgumentException("Missing reflectivity array");
        double[][] values = ((List)refl).isEmpty() ? new double[0][0] : JSONUtils.fromDoubleArray2D((List)refl);
        Object ts = json.get(TIMESTAMP);
        String timestamp = ts!=null ? ts.toString() : TimestampUtils.extractFromFilename(fileName);
        if (timestamp==null) logger.warn("no timestamp for grid {}", fileName);
        Object nd = json.get(NO_DATA);
        if (nd instanceof Number) noDataValue = ((Number)nd).doubleValue();
        return new ReflectivityGrid(values, getCoordinates(json, LATITUDE), getCoordinates(json, LONGITUDE), timestamp, noDataValue);
    }

    private static Object getCoordinates(JSONObject json, String key) {
        Object c = json.get(key);
        if (!(c instanceof List)) throw new IllegalArgumentException("Missing "+key+" array");
        List l = (List)c;
        if (JSONUtils.isArray2D(l)) return JSONUtils.fromDoubleArray2D(l);
        else return JSONUtils.fromDoubleArray(l);
    }
}
