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

import java.util.Arrays;

/**
 * Estimator returning explicitly initialized values. Parameters with a NaN initial value are computed by a delegate estimator,
 * or set to {@link #DEFAULT_VALUE} if there is none.
 * @author Jean Ollion
 */
public class PreInitializedEstimator implements StartPointEstimator {
    public static final double DEFAULT_VALUE = 1;
    final double[] initializedParameters;
    final StartPointEstimator estimator;

    public PreInitializedEstimator(double[] initializedParameters, StartPointEstimator estimator) {
        this.initializedParameters = initializedParameters.clone();
        this.estimator = estimator;
    }

    @Override
    public double[] initializeFit(Dataset data) {
        double[] init = Arrays.copyOf(initializedParameters, initializedParameters.length);
        if (Arrays.stream(init).noneMatch(Double::isNaN)) return init;
        double[] estimated = estimator==null ? null : estimator.initializeFit(data);
        for (int i = 0; i<init.length; ++i) {
            if (Double.isNaN(init[i])) init[i] = estimated==null || i>=estimated.length || !Double.isFinite(estimated[i]) ? DEFAULT_VALUE : estimated[i];
        }
        return init;
    }
}
