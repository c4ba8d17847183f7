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


/**
 *
 * @author adapted from http://introcs.cs.princeton.edu/java/97data/LinearRegression.java.html
 */
public class LinearRegression { 

    /**
     * Least-square fit of y = beta0 + beta1 * x
     * @return {beta0, beta1}, NaN values if less than 2 points
     */
    public static double[] run(double[] x, double[] y) { 
        return run(x, y, null);
    }

    /**
     * Weighted least-square fit of y = beta0 + beta1 * x
     * @param weights statistical weights, can be null
     * @return {beta0, beta1}, NaN values if less than 2 points
     */
    public static double[] run(double[] x, double[] y, double[] weights) {
        if (x.length!=y.length) throw new IllegalArgumentException("x & y should be of same length");
        if (weights!=null && weights.length!=x.length) throw new IllegalArgumentException("x & weights should be of same length");
        if (x.length<=1) return new double[]{Double.NaN, Double.NaN};
        // first pass: compute xbar and ybar
        double sumx = 0.0, sumy = 0.0, sumw = 0;
        for (int i =0; i<x.length; ++i) {
            double w = weights==null ? 1 : weights[i];
            sumx  += w * x[i];
            sumy  += w * y[i];
            sumw += w;
        }
        double xbar = sumx / sumw;
        double ybar = sumy / sumw;

        // second pass: compute summary statistics
        double xxbar = 0.0, xybar = 0.0;
        for (int i = 0; i < x.length; i++) {
            double w = weights==null ? 1 : weights[i];
            xxbar += w * (x[i] - xbar) * (x[i] - xbar);
            xybar += w * (x[i] - xbar) * (y[i] - ybar);
        }
        double beta1 = xybar / xxbar;
        double beta0 = ybar - beta1 * xbar;
        return new double[] {beta0, beta1};
    }

    /**
     * Least-square fit of y = beta1 * x (line through origin)
     */
    public static double runThroughOrigin(double[] x, double[] y) {
        double xy = 0, xx = 0;
        for (int i = 0; i<x.length; ++i) {
            xy += x[i] * y[i];
            xx += x[i] * x[i];
        }
        return xx==0 ? Double.NaN : xy / xx;
    }
}
