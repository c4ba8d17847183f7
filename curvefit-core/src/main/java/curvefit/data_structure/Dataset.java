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

import curvefit.utils.ArrayUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Read-only view of a curve: ordered (x, y) values with optional y errors.
 * <p>
 * Error values may come from an error-bar curve attached to the data curve, and can thus have fewer rows than the data.
 * Arrays are copied at construction and never exposed, so a dataset is an immutable snapshot of the caller's data.
 * A filtered dataset remembers the row of each kept point in the source dataset.
 *
 * @author Jean Ollion
 */
public class Dataset {
    public static final Logger logger = LoggerFactory.getLogger(Dataset.class);
    final String name;
    final double[] x, y;
    final double[] yErrors;
    final int[] sourceRows;
    final int errorRowCount;

    public Dataset(String name, double[] x, double[] y) {
        this(name, x, y, null);
    }

    public Dataset(String name, double[] x, double[] y, double[] yErrors) {
        this(name, ArrayUtil.duplicate(x), ArrayUtil.duplicate(y), ArrayUtil.duplicate(yErrors), null, yErrors==null ? 0 : yErrors.length);
    }

    private Dataset(String name, double[] x, double[] y, double[] yErrors, int[] sourceRows, int errorRowCount) {
        if (x==null || y==null) throw new IllegalArgumentException("x & y values are required");
        if (x.length!=y.length) throw new IllegalArgumentException("x & y should be of same length: "+x.length+" vs "+y.length);
        this.name = name==null ? "" : name;
        this.x = x;
        this.y = y;
        this.yErrors = yErrors;
        this.sourceRows = sourceRows==null ? ArrayUtil.generateIntegerArray(0, x.length) : sourceRows;
        this.errorRowCount = errorRowCount;
    }

    public String getName() {
        return name;
    }

    public int size() {
        return x.length;
    }

    public double getX(int i) {
        return x[i];
    }

    public double getY(int i) {
        return y[i];
    }

    public double[] getX() {
        return ArrayUtil.duplicate(x);
    }

    public double[] getY() {
        return ArrayUtil.duplicate(y);
    }

    public boolean hasErrors() {
        return yErrors!=null;
    }

    /**
     * @return error values, or null if the dataset has no error data. Missing error rows are NaN
     */
    public double[] getErrors() {
        return ArrayUtil.duplicate(yErrors);
    }

    /**
     * @return error of the {@param i}-th point, NaN if the error data has no such row or if there is no error data
     */
    public double getError(int i) {
        if (yErrors==null || i>=yErrors.length) return Double.NaN;
        return yErrors[i];
    }

    /**
     * @return number of rows of the error data of the source dataset, 0 if there is no error data
     */
    public int errorRowCount() {
        return errorRowCount;
    }

    /**
     * @return row of the {@param i}-th point in the dataset this one was filtered from (identity for an unfiltered dataset)
     */
    public int getSourceRow(int i) {
        return sourceRows[i];
    }

    public int[] getSourceRows() {
        return Arrays.copyOf(sourceRows, sourceRows.length);
    }

    public double xMin() {
        return x.length==0 ? Double.NaN : x[ArrayUtil.min(x)];
    }

    public double xMax() {
        return x.length==0 ? Double.NaN : x[ArrayUtil.max(x)];
    }

    /**
     * Keeps points within {@param range} (inclusive) with finite x and y.
     * Error values are kept aligned with source rows, the returned dataset shares no array with this one
     * @param range null for full range
     * @return filtered dataset
     */
    public Dataset filter(DataRange range) {
        int[] kept = IntStream.range(0, x.length)
                .filter(i -> Double.isFinite(x[i]) && Double.isFinite(y[i]))
                .filter(i -> range==null || range.contains(x[i]))
                .toArray();
        if (kept.length < x.length) logger.debug("dataset {}: {} points kept out of {} in range {}", name, kept.length, x.length, range);
        int[] rows = Arrays.stream(kept).map(i -> sourceRows[i]).toArray();
        double[] errors = null;
        if (yErrors!=null) {
            errors = new double[kept.length];
            for (int i = 0; i<kept.length; ++i) errors[i] = kept[i]<yErrors.length ? yErrors[kept[i]] : Double.NaN;
        }
        return new Dataset(name, ArrayUtil.select(x, kept), ArrayUtil.select(y, kept), errors, rows, errorRowCount);
    }

    @Override
    public String toString() {
        return "Dataset: "+name+" (n="+x.length+(yErrors!=null ? ", with errors": "")+")";
    }
}
