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
 * Estimates {@link GaussianAmplitude} parameters. The peak is the extremum that deviates the most from the mean,
 * so that negative peaks (dips) are also handled.
 */
public class GaussianAmplitudeEstimator implements StartPointEstimator {
    static final double FWHM_TO_SIGMA = 1 / (2 * Math.sqrt(2 * Math.log(2)));

    @Override
    public double[] initializeFit(Dataset data) {
        double[] x = data.getX();
        double[] y = data.getY();
        int iMax = ArrayUtil.max(y), iMin = ArrayUtil.min(y);
        double mean = ArrayUtil.mean(y);
        boolean dip = mean - y[iMin] > y[iMax] - mean;
        double y0 = dip ? y[iMax] : y[iMin];
        int iPeak = dip ? iMin : iMax;
        double A = y[iPeak] - y0;
        int[] sorted = ArrayUtil.sortedIndices(x);
        int pos = 0;
        while (sorted[pos]!=iPeak) ++pos;
        double[] yPos = dip ? ArrayUtil.stream(y).map(v -> -v).toArray() : y; // peak search on a positive peak
        double fwhm = PeakEstimator.getFWHM(x, yPos, sorted, pos, dip ? -y0 : y0, Math.abs(A));
        if (A==0) A = 1;
        return new double[]{y0, x[iPeak], fwhm * FWHM_TO_SIGMA, A};
    }
}
