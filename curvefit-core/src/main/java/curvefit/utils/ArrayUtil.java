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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

/**
 *
 * @author Jean Ollion
 */
public class ArrayUtil {
    public static final Logger logger = LoggerFactory.getLogger(ArrayUtil.class);

    public static DoubleStream stream(double[] array) {
        return DoubleStream.of(array);
    }

    public static int max(double[] array) {
        return max(array, 0, array.length);
    }
    /**
     *
     * @param array
     * @param start start of search index, inclusive
     * @param stop end of search index, exclusive
     * @return index of maximum value
     */
    public static int max(double[] array, int start, int stop) {
        if (start<0) start=0;
        if (stop>array.length) stop=array.length;
        if (stop<start) throw new IllegalArgumentException("Stop before start");
        int idxMax = start;
        for (int i = start+1; i<stop; ++i) if (array[i]>array[idxMax]) idxMax=i;
        return idxMax;
    }
    public static int min(double[] array) {
        return min(array, 0, array.length);
    }
    public static int min(double[] array, int start, int stop) {
        if (start<0) start=0;
        if (stop>array.length) stop=array.length;
        if (stop<start) throw new IllegalArgumentException("Stop before start");
        int idxMin = start;
        for (int i = start+1; i<stop; ++i) if (array[i]<array[idxMin]) idxMin=i;
        return idxMin;
    }
    public static double mean(double[] array) {
        return mean(array, 0, array.length);
    }
    public static double mean(double[] array, int start, int stop) {
        double sum=0;
        for (int i = start; i<stop; ++i) sum+=array[i];
        sum /= (stop-start);
        return sum;
    }
    /**
     * @return weighted mean of {@param values}. {@param weights} may be null
     */
    public static double weightedMean(double[] values, double[] weights) {
        if (weights==null) return mean(values);
        double sum = 0, sumW = 0;
        for (int i = 0; i<values.length; ++i) {
            sum += values[i] * weights[i];
            sumW += weights[i];
        }
        return sum / sumW;
    }
    public static double[] select(double[] data, int[] indices) {
        double[] res = new double[indices.length];
        for (int i = 0; i<indices.length; ++i) res[i] = data[indices[i]];
        return res;
    }
    public static double[] duplicate(double[] array) {
        if (array==null) return null;
        return Arrays.copyOf(array, array.length);
    }
    public static double[][] duplicate(double[][] matrix) {
        if (matrix==null) return null;
        double[][] res = new double[matrix.length][];
        for (int i = 0; i<matrix.length; ++i) res[i] = duplicate(matrix[i]);
        return res;
    }
    public static int[] generateIntegerArray(int start, int stopExcl) {
        if (stopExcl<start) return new int[0];
        return IntStream.range(start, stopExcl).toArray();
    }
    /**
     * @return {@param n} values regularly spaced from {@param start} to {@param end}, both included
     */
    public static double[] linspace(double start, double end, int n) {
        if (n<=0) return new double[0];
        if (n==1) return new double[]{start};
        double step = (end - start) / (n - 1);
        double[] res = new double[n];
        for (int i = 0; i<n; ++i) res[i] = start + i * step;
        res[n-1] = end;
        return res;
    }
    /**
     * @return indices of {@param array} ordered by increasing value
     */
    public static int[] sortedIndices(double[] array) {
        return IntStream.range(0, array.length).boxed().sorted((i1, i2) -> Double.compare(array[i1], array[i2])).mapToInt(Integer::intValue).toArray();
    }

    /**
     * Local maxima of {@param array} with a neighborhood of {@param scale} on each side, sorted by decreasing value.
     * Plateaus are reported once, at their first index
     */
    public static List<Integer> getRegionalMaxima(double[] array, int scale) {
        List<Integer> res = new ArrayList<>();
        for (int i = 0; i<array.length; ++i) {
            boolean max = true;
            for (int j = Math.max(0, i-scale); j<=Math.min(array.length-1, i+scale); ++j) {
                if (j==i) continue;
                if (array[j]>array[i] || (j<i && array[j]==array[i])) {
                    max = false;
                    break;
                }
            }
            if (max) res.add(i);
        }
        res.sort((i1, i2) -> Double.compare(array[i2], array[i1]));
        return res;
    }
}
