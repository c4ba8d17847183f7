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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Initial parameters of a {@link MultipleIdenticalFitFunction} made of peaks plus a constant background.
 * Each peak is estimated by a {@link PeakEstimator} around a center that is either given (seeds) or
 * detected as one of the highest regional maxima of the observations. The background is estimated by {@link ConstantEstimator}.
 * @author Jean Ollion
 */
public class MultipleIdenticalEstimator implements StartPointEstimator {
    public static final Logger logger = LoggerFactory.getLogger(MultipleIdenticalEstimator.class);
    final PeakFunction peak;
    final int nPeaks;
    final double[] centers, heights;
    final StartPointEstimator backgroundEstimator = new ConstantEstimator();

    /**
     *
     * @param peak peak function
     * @param nPeaks number of peaks
     * @param centers seed centers (length {@param nPeaks}), null for automatic detection
     * @param heights seed heights (baseline included), null or NaN values to read them from the observations
     */
    public MultipleIdenticalEstimator(PeakFunction peak, int nPeaks, double[] centers, double[] heights) {
        if (nPeaks<1) throw new IllegalArgumentException("Needs at least one peak");
        if (centers!=null && centers.length!=nPeaks) throw new IllegalArgumentException("Expected "+nPeaks+" centers, got: "+centers.length);
        if (heights!=null && heights.length!=nPeaks) throw new IllegalArgumentException("Expected "+nPeaks+" heights, got: "+heights.length);
        this.peak = peak;
        this.nPeaks = nPeaks;
        this.centers = centers;
        this.heights = heights;
    }

    @Override
    public double[] initializeFit(Dataset data) {
        double baseline = backgroundEstimator.initializeFit(data)[0];
        double[] c = centers!=null ? centers : detectCenters(data);
        double[] allParams = new double[3 * nPeaks + 1];
        for (int i = 0; i<nPeaks; ++i) {
            double h = heights==null ? Double.NaN : heights[i];
            double[] params = new PeakEstimator(peak, c[i], h, baseline).initializeFit(data);
            System.arraycopy(params, 0, allParams, 3 * i, params.length);
        }
        allParams[3 * nPeaks] = baseline;
        return allParams;
    }

    protected double[] detectCenters(Dataset data) {
        double[] x = data.getX();
        double[] y = data.getY();
        int[] sorted = ArrayUtil.sortedIndices(x);
        double[] ySorted = ArrayUtil.select(y, sorted);
        List<Integer> maxima = ArrayUtil.getRegionalMaxima(ySorted, Math.max(1, x.length / (10 * nPeaks)));
        double[] res = new double[nPeaks];
        double xMin = x[sorted[0]], xMax = x[sorted[sorted.length-1]];
        for (int i = 0; i<nPeaks; ++i) {
            if (i<maxima.size()) res[i] = x[sorted[maxima.get(i)]];
            else res[i] = xMin + (xMax - xMin) * (i + 1) / (nPeaks + 1); // not enough maxima: spread evenly
        }
        Arrays.sort(res);
        logger.debug("detected peak centers: {}", Arrays.toString(res));
        return res;
    }
}
