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
import curvefit.utils.LinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Estimates exponential decay / growth parameters: the offset is the value at the asymptotic end of the curve,
 * amplitude and rate come from a linear regression of log(|y - y₀|) on x.
 * When several terms are requested, amplitude is shared equally and time constants are spread around the single-term estimation.
 * @author Jean Ollion
 */
public class ExponentialEstimator implements StartPointEstimator {
    public static final Logger logger = LoggerFactory.getLogger(ExponentialEstimator.class);
    final int nTerms;
    final boolean growth;

    public ExponentialEstimator(int nTerms, boolean growth) {
        this.nTerms = nTerms;
        this.growth = growth;
    }

    @Override
    public double[] initializeFit(Dataset data) {
        double[] x = data.getX();
        double[] y = data.getY();
        int iMin = ArrayUtil.min(x);
        int iMax = ArrayUtil.max(x);
        // asymptote is reached at large x for a decay, at small x for a growth
        double y0 = growth ? y[iMin] : y[iMax];
        double delta = (growth ? y[iMax] : y[iMin]) - y0;
        double sign = delta < 0 ? -1 : 1;
        List<double[]> logPoints = new ArrayList<>();
        for (int i = 0; i<x.length; ++i) {
            double v = sign * (y[i] - y0);
            if (v>0) logPoints.add(new double[]{x[i], Math.log(v)});
        }
        double A = Double.NaN, t = Double.NaN;
        if (logPoints.size()>=2) {
            double[] beta = LinearRegression.run(logPoints.stream().mapToDouble(p -> p[0]).toArray(), logPoints.stream().mapToDouble(p -> p[1]).toArray());
            t = growth ? 1 / beta[1] : -1 / beta[1];
            A = sign * Math.exp(beta[0]);
        }
        if (!Double.isFinite(t) || t<=0 || !Double.isFinite(A)) {
            double span = x[iMax] - x[iMin];
            t = span>0 ? span / 3 : 1;
            A = growth ? delta * Math.exp(- x[iMax] / t) : delta * Math.exp(x[iMin] / t);
            if (!Double.isFinite(A) || A==0) A = sign;
            logger.debug("log-linear estimation failed, fallback to t={}, A={}", t, A);
        }
        double[] res = new double[2 * nTerms + 1];
        for (int k = 0; k<nTerms; ++k) {
            res[2*k] = A / nTerms;
            res[2*k+1] = t * Math.pow(3, k - (nTerms - 1) / 2d);
        }
        res[2*nTerms] = y0;
        return res;
    }
}
