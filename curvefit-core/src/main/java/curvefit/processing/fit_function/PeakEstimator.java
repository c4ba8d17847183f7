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
package curvefit.processing.fit_function;

import curvefit.data_structure.Dataset;
import curvefit.utils.ArrayUtil;

/**
 * Estimates the parameters of a single peak function located around a given center, above a given baseline.
 * The height is read at the observation closest to the center, the width from the full width at half maximum.
 * @author Jean Ollion
 */
public class PeakEstimator implements StartPointEstimator {
    final PeakFunction peak;
    final double center, height, baseline;

    /**
     * @param peak peak function
     * @param center abscissa of the peak
     * @param height value at the top of the peak (baseline included), NaN to read it from the observations
     * @param baseline background level
     */
    public PeakEstimator(PeakFunction peak, double center, double height, double baseline) {
        this.peak = peak;
        this.center = center;
        this.height = height;
        this.baseline = baseline;
    }

    @Override
    public double[] initializeFit(Dataset data) {
        double[] x = data.getX();
        double[] y = data.getY();
        int[] sorted = ArrayUtil.sortedIndices(x);
        int pos = closest(x, sorted, center);
        double h = (Double.isFinite(height) ? height : y[sorted[pos]]) - baseline;
        if (!(h>0)) h = y[ArrayUtil.max(y)] - baseline;
        if (!(h>0)) h = 1;
        double fwhm = getFWHM(x, y, sorted, pos, baseline, h);
        double width = peak.getWidth(fwhm);
        double[] res = new double[3];
        res[PeakFunction.AREA] = peak.getArea(h, width);
        res[PeakFunction.CENTER] = center;
        res[PeakFunction.WIDTH] = width;
        return res;
    }

    static int closest(double[] x, int[] sorted, double value) {
        int best = 0;
        for (int i = 1; i<sorted.length; ++i) if (Math.abs(x[sorted[i]] - value) < Math.abs(x[sorted[best]] - value)) best = i;
        return best;
    }

    /**
     * Walks from the top of the peak on both sides until the signal falls below half of {@param height}.
     * @param sorted indices ordered by increasing x
     * @param pos position of the top in {@param sorted}
     * @return full width at half maximum
     */
    public static double getFWHM(double[] x, double[] y, int[] sorted, int pos, double baseline, double height) {
        double half = height / 2;
        double xc = x[sorted[pos]];
        double left = Double.NaN, right = Double.NaN;
        for (int i = pos-1; i>=0; --i) {
            double v = y[sorted[i]] - baseline;
            if (v <= half) {
                left = interpolate(x[sorted[i]], v, x[sorted[i+1]], y[sorted[i+1]] - baseline, half);
                break;
            }
        }
        for (int i = pos+1; i<sorted.length; ++i) {
            double v = y[sorted[i]] - baseline;
            if (v <= half) {
                right = interpolate(x[sorted[i]], v, x[sorted[i-1]], y[sorted[i-1]] - baseline, half);
                break;
            }
        }
        double fwhm;
        if (!Double.isNaN(left) && !Double.isNaN(right)) fwhm = right - left;
        else if (!Double.isNaN(left)) fwhm = 2 * (xc - left);
        else if (!Double.isNaN(right)) fwhm = 2 * (right - xc);
        else fwhm = (x[sorted[sorted.length-1]] - x[sorted[0]]) / 4;
        if (!(fwhm>0)) fwhm = x.length>1 ? (x[sorted[sorted.length-1]] - x[sorted[0]]) / x.length : 1;
        if (!(fwhm>0)) fwhm = 1;
        return fwhm;
    }

    private static double interpolate(double xa, double ya, double xb, double yb, double level) {
        if (ya==yb) return xa;
        return xa + (xb - xa) * (level - ya) / (yb - ya);
    }
}
