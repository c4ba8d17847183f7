/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of CurveFit
 *
 * CurveFit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * CurveFit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with CurveFit.  If not, see <http://www.gnu.org/licenses/>.
 */
package curvefit.utils;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 *
 * @author Jean Ollion
 */
public class JSONUtils {
    public final static org.slf4j.Logger logger = LoggerFactory.getLogger(JSONUtils.class);
    public static String toJSONString(Object jsonObjectOrArray) {
        if (jsonObjectOrArray instanceof JSONObject) return ((JSONObject)jsonObjectOrArray).toJSONString();
        else if (jsonObjectOrArray instanceof JSONArray) return ((JSONArray)jsonObjectOrArray).toJSONString();
        else if (jsonObjectOrArray instanceof String) return (String)jsonObjectOrArray;
        else throw new IllegalArgumentException("Object is not JSONObject or JSONArray");
    }

    /**
     * @return {@param value}, or its string representation if it is not finite
     */
    public static Object toJSONNumber(double value) {
        return Double.isFinite(value) ? (Object)value : Double.toString(value);
    }

    public static double[] fromDoubleArray(List array) {
        double[] res = new double[array.size()];
        for (int i = 0; i<res.length; ++i) {
            if (array.get(i)==null) {
                logger.debug("fromDoubleArrayError: {}", array);
                res[i] = Double.NaN;
            } else if (array.get(i) instanceof String) res[i] = Double.parseDouble((String)array.get(i)); // NaN / Infinity are stored as strings
            else res[i]=((Number)array.get(i)).doubleValue();
        }
        return res;
    }
    public static JSONArray toJSONArray(double[] array) {
        JSONArray res = new JSONArray();
        for (double d : array) res.add(Double.isFinite(d) ? (Object)d : Double.toString(d));
        return res;
    }
    public static JSONArray toJSONArray(String[] array) {
        JSONArray res = new JSONArray();
        for (String d : array) res.add(d);
        return res;
    }
    public static JSONArray toJSONArray(double[][] matrix) {
        JSONArray res = new JSONArray();
        for (double[] row : matrix) res.add(toJSONArray(row));
        return res;
    }
    public static Object parse(String json) throws ParseException {
        JSONParser parser = new JSONParser();
        return parser.parse(json);
    }
    public static JSONObject read(Path file) throws IOException, ParseException {
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        Object o = parse(content);
        if (!(o instanceof JSONObject)) throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, o);
        return (JSONObject)o;
    }
    public static void write(Path file, JSONObject object) throws IOException {
        Files.write(file, object.toJSONString().getBytes(StandardCharsets.UTF_8));
    }
}
