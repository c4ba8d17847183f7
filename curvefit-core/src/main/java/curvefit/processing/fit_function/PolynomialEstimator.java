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

import Jama.Matrix;
import curvefit.data_structure.Dataset;
import curvefit.utils.ArrayUtil;
import curvefit.utils.LinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Least-square polynomial estimation, solved by QR decomposition of the Vandermonde matrix.
 * Order 1 reduces to a linear regression.
 * @author Jean Ollion
 */
public class PolynomialEstimator implements StartPointEstimator {
    public static final Logger logger = LoggerFactory.getLogger(PolynomialEstimator.class);
    final int order;

    public PolynomialEstimator(int order) {
        this.order = order;
    }

    @Override
    public double[] initializeFit(Dataset data) {
        double[] x = data.getX();
        double[] y = data.getY();
        double[] res = new double[order+1];
        if (order == 1) {
            double[] beta = LinearRegression.run(x, y);
            if (Double.isFinite(beta[0]) && Double.isFinite(beta[1])) {
                res[0] = beta[0];
                res[1] = beta[1];
                return res;
            }
        } else if (x.length > order) {
            double[][] vandermonde = new double[x.length][order+1];
            for (int i = 0; i<x.length; ++i) {
                double p = 1;
                for (int k = 0; k<=order; ++k) {
                    vandermonde[i][k] = p;
                    p *= x[i];
                }
            }
            try {
                return new Matrix(vandermonde).qr().solve(new Matrix(y, y.length)).getRowPackedCopy();
            } catch (RuntimeException e) { // rank deficient
                logger.debug("polynomial estimation failed: {}", e.getMessage());
            }
        }
        res[0] = ArrayUtil.mean(y);
        return res;
    }
}
