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
package stormcell.utils;

import stormcell.configuration.parameters.Parameter;
import org.json.simple.JSONAware;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;
import org.json.simple.parser.ContainerFactory;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 *
 * @author Jean Ollion
 */
public class JSONUtils {
    public final static org.slf4j.Logger logger = LoggerFactory.getLogger(JSONUtils.class);

    public static String toJSONString(Object jsonObjectOrArray) {
        if (jsonObjectOrArray instanceof JSONAware) return ((JSONAware)jsonObjectOrArray).toJSONString();
        else if (jsonObjectOrArray instanceof Map || jsonObjectOrArray instanceof List) return JSONValue.toJSONString(jsonObjectOrArray);
        else if (jsonObjectOrArray instanceof String) return (String)jsonObjectOrArray;
        else throw new IllegalArgumentException("Object is not a JSON object or array");
    }

    public static JSONObject parse(String s) throws ParseException {
        Object res= new JSONParser().parse(s);
        if (!(res instanceof JSONObject)) throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, res);
        return (JSONObject)res;
    }

    /**
     * Parses {@param s} keeping the key order of JSON objects
     * @return a {@link LinkedHashMap} or a {@link List}
     */
    public static Object parseOrdered(String s) throws ParseException {
        return new JSONParser().parse(s, ORDERED);
    }

    private static final ContainerFactory ORDERED = new ContainerFactory() {
        @Override
        public Map createObjectContainer() {
            return new LinkedHashMap();
        }
        @Override
        public List creatArrayContainer() {
            return new ArrayList();
        }
    };

    public static double round(double value, int decimalPlaces) {
        if (decimalPlaces<0 || Double.isNaN(value) || Double.isInfinite(value)) return value;
        double f = Math.pow(10, decimalPlaces);
        return Math.round(value * f) / f;
    }

    /**
     * @return copy of a parsed JSON value: maps and lists are copied recursively, other values are immutable and returned as is
     */
    public static Object deepCopy(Object json) {
        if (json instanceof Map) {
            Map<Object, Object> res = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>)json).entrySet()) res.put(e.getKey(), deepCopy(e.getValue()));
            return res;
        } else if (json instanceof List) {
            List<Object> res = new ArrayList<>(((List<?>)json).size());
            for (Object o : (List<?>)json) res.add(deepCopy(o));
            return res;
        } else return json;
    }

    public static double[] fromDoubleArray(List array) {
        double[] res = new double[array.size()];
        for (int i = 0; i<res.length; ++i) {
            if (array.get(i)==null) {
                logger.debug("fromDoubleArrayError: {}", array);
                res[i] = Double.NaN;
            } else res[i]=((Number)array.get(i)).doubleValue();
        }
        return res;
    }

    /**
     * @return 2D array from a JSON array of arrays (row major). Null elements are converted to NaN
     */
    public static double[][] fromDoubleArray2D(List array) {
        double[][] res = new double[array.size()][];
        for (int i = 0; i<res.length; ++i) {
            Object row = array.get(i);
            if (!(row instanceof List)) throw new IllegalArgumentException("Row "+i+" is not an array");
            res[i] = fromDoubleArray((List)row);
        }
        return res;
    }

    public static boolean isArray2D(List array) {
        return !array.isEmpty() && array.get(0) instanceof List;
    }

    public static JSONObject toJSONMap(Collection<? extends Parameter> coll) {
        JSONObject res = new JSONObject();
        for (Parameter j : coll) res.put(j.getName(), j.toJSONEntry());
        return res;
    }

    /**
     * Initialize parameters from a JSON object keyed by parameter name. Parameters absent from {@param json} keep their value
     * @return number of initialized parameters
     */
    public static <P extends Parameter> int fromJSONMap(List<P> list, Map json) {
        if (list==null || list.isEmpty() || json==null || json.isEmpty()) return 0;
        Map<String, P> receiveMap = list.stream().collect(Collectors.toMap(Parameter::getName, Function.identity()));
        int count = 0;
        for (Object k : json.keySet()) {
            P r = receiveMap.get(k);
            if (r!=null) {
                r.initFromJSONEntry(json.get(k));
                ++count;
            } else logger.warn("Unknown parameter: {} (known: {})", k, receiveMap.keySet());
        }
        return count;
    }
}
