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
 * Estimates the parameters of sigmoid functions ({@link Boltzmann}, {@link Logistic}): initial and final values are read
 * at both ends of the curve, the center is the abscissa where the curve crosses the half-height.
 * @author Jean Ollion
 */
public class SigmoidEstimator implements StartPointEstimator {
    final boolean logistic;

    /**
     * @param logistic whether the estimated function is {@link Logistic}, otherwise {@link Boltzmann}
     */
    public SigmoidEstimator(boolean logistic) {
        this.logistic = logistic;
    }

    @Override
    public double[] initializeFit(Dataset data) {
        double[] x = data.getX();
        double[] y = data.getY();
        int iMin = ArrayUtil.min(x);
        int iMax = ArrayUtil.max(x);
        double A1 = y[iMin];
        double A2 = y[iMax];
        double x0 = halfCrossing(x, y, (A1 + A2) / 2);
        double span = x[iMax] - x[iMin];
        if (logistic) {
            if (!(x0>0)) x0 = ArrayUtil.stream(x).map(Math::abs).average().orElse(1);
            if (x0==0) x0 = 1;
            return new double[]{A1, A2, x0, 2};
        } else {
            if (Double.isNaN(x0)) x0 = (x[iMin] + x[iMax]) / 2;
            return new double[]{A1, A2, x0, span>0 ? span / 10 : 1};
        }
    }

    /**
     * @return abscissa of the first crossing of {@param level}, ordered by increasing x, linearly interpolated. NaN if the curve does not cross the level
     */
    static double halfCrossing(double[] x, double[] y, double level) {
        int[] sorted = ArrayUtil.sortedIndices(x);
        for (int i = 1; i<sorted.length; ++i) {
            double ya = y[sorted[i-1]] - level;
            double yb = y[sorted[i]] - level;
            if (ya==0) return x[sorted[i-1]];
            if (ya * yb < 0) {
                double xa = x[sorted[i-1]], xb = x[sorted[i]];
                return xa + (xb - xa) * ya / (ya - yb);
            }
        }
        return Double.NaN;
    }
}
