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
package curvefit.processing.optimizer;

import Jama.Matrix;
import curvefit.processing.fit_function.FitFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Weighted least-square quantities shared by the solvers and the fit orchestrator.
 * <pre>
 * rᵢ = √wᵢ × (yᵢ - f(xᵢ, a))
 * χ² = ∑ rᵢ²
 * </pre>
 * @author Jean Ollion
 */
public class WeightedLeastSquares {
    public static final Logger logger = LoggerFactory.getLogger(WeightedLeastSquares.class);

    /**
     * Calculate the current weighted sum-squared-error
     */
    public static double chiSquared(final double[] x, final double[] y, final double[] weights, final double[] a, final FitFunction f)  {
        double sum = 0.;
        for( int i = 0; i < y.length; i++ ) {
            double d = y[i] - f.val(x[i], a);
            sum += weights[i] * d * d;
        }
        return sum;
    }

    public static double[] residuals(final double[] x, final double[] y, final double[] weights, final double[] a, final FitFunction f) {
        double[] res = new double[y.length];
        for (int i = 0; i<y.length; ++i) res[i] = Math.sqrt(weights[i]) * (y[i] - f.val(x[i], a));
        return res;
    }

    /**
     * @return indices of the optimized parameters in the full parameter vector
     */
    public static int[] fitToOriginal(int nParameters, int[] fixedIndices) {
        if (fixedIndices==null || fixedIndices.length==0) return IntStream.range(0, nParameters).toArray();
        return IntStream.range(0, nParameters).filter(i -> Arrays.stream(fixedIndices).noneMatch(u -> u==i)).toArray();
    }

    /**
     * @return whether {@param a} lies within bounds (inclusive). null bounds are ignored
     */
    public static boolean isValid(double[] a, double[] lowerBounds, double[] upperBounds) {
        for (int i = 0; i<a.length; ++i) {
            if (lowerBounds!=null && a[i] < lowerBounds[i]) return false;
            if (upperBounds!=null && a[i] > upperBounds[i]) return false;
        }
        return true;
    }

    /**
     * Normal matrix JᵀWJ and gradient JᵀWr restricted to optimized parameters
     * @param JtJ output normal matrix (nFit × nFit)
     * @param g output gradient (nFit)
     * @return false if a non-finite value was encountered
     */
    public static boolean normalEquations(double[] x, double[] y, double[] weights, double[] a, FitFunction f, int[] fitToOriginal, double[][] JtJ, double[] g) {
        int nFit = fitToOriginal.length;
        for (int r = 0; r < nFit; r++) {
            g[r] = 0.;
            Arrays.fill(JtJ[r], 0.);
        }
        for (int i = 0; i < y.length; i++) {
            double[] jac = f.jacobian(x[i], a);
            double w = weights[i];
            double residual = y[i] - f.val(x[i], a);
            for (int r = 0; r < nFit; r++) {
                double jr = jac[fitToOriginal[r]];
                g[r] += w * residual * jr;
                for (int c = 0; c <= r; c++) JtJ[r][c] += w * jr * jac[fitToOriginal[c]];
            }
        }
        for (int r = 0; r < nFit; r++) {
            if (!Double.isFinite(g[r])) return false;
            for (int c = 0; c <= r; c++) {
                if (!Double.isFinite(JtJ[r][c])) return false;
                JtJ[c][r] = JtJ[r][c];
            }
        }
        return true;
    }

    /**
     * Covariance matrix of the parameters (JᵀWJ)⁻¹ at {@param a}. Rows and columns of fixed parameters are zero
     * @return covariance matrix, null if the normal matrix is singular
     */
    public static double[][] covariance(double[] x, double[] y, double[] weights, double[] a, FitFunction f, int[] fixedIndices) {
        int[] fitToOriginal = fitToOriginal(a.length, fixedIndices);
        int nFit = fitToOriginal.length;
        double[][] res = new double[a.length][a.length];
        if (nFit==0) return res;
        double[][] JtJ = new double[nFit][nFit];
        if (!normalEquations(x, y, weights, a, f, fitToOriginal, JtJ, new double[nFit])) return null;
        double[][] inv;
        try {
            inv = new Matrix(JtJ).inverse().getArray();
        } catch (RuntimeException e) { // Matrix is singular
            logger.debug("covariance: {}", e.getMessage());
            return null;
        }
        for (int r = 0; r<nFit; ++r) {
            for (int c = 0; c<nFit; ++c) {
                if (!Double.isFinite(inv[r][c])) return null;
                res[fitToOriginal[r]][fitToOriginal[c]] = inv[r][c];
            }
        }
        return res;
    }
}
