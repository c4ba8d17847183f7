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
package curvefit.data_structure;

import curvefit.processing.exceptions.InvalidRangeException;
import curvefit.utils.JSONSerializable;
import curvefit.utils.JSONUtils;
import org.json.simple.JSONArray;

/**
 * Inclusive interval [from ; to] on the x axis. A null range stands for the full dataset.
 * @author Jean Ollion
 */
public class DataRange implements JSONSerializable {
    double from, to;

    public DataRange(double from, double to) {
        this.from = from;
        this.to = to;
    }

    public static DataRange full() {
        return new DataRange(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public double getFrom() {
        return from;
    }

    public double getTo() {
        return to;
    }

    public boolean isFull() {
        return from == Double.NEGATIVE_INFINITY && to == Double.POSITIVE_INFINITY;
    }

    public boolean contains(double x) {
        return x>=from && x<=to;
    }

    /**
     * @throws InvalidRangeException if limits do not satisfy from &lt; to
     */
    public DataRange validate() {
        if (Double.isNaN(from) || Double.isNaN(to) || !(from < to)) throw new InvalidRangeException(from, to);
        return this;
    }

    @Override
    public JSONArray toJSONEntry() {
        return JSONUtils.toJSONArray(new double[]{from, to});
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        double[] bds = JSONUtils.fromDoubleArray((JSONArray)jsonEntry);
        from = bds[0];
        to = bds[1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataRange)) return false;
        DataRange other = (DataRange) o;
        return Double.compare(from, other.from) == 0 && Double.compare(to, other.to) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(from) + Double.hashCode(to);
    }

    @Override
    public String toString() {
        return "["+from+" ; "+to+"]";
    }
}
