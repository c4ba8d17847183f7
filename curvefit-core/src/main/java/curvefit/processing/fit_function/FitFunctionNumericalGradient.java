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

/**
 * Function whose partial derivatives are approximated by central finite differences.
 * Step for the k-th parameter is {@link #RELATIVE_STEP} × max(|a_k|, 1)
 * @author Jean Ollion
 */
public abstract class FitFunctionNumericalGradient implements FitFunction {
    public static final double RELATIVE_STEP = 6.0554544523933395e-06; // cubic root of machine epsilon

    @Override
    public double grad(double x, double[] a, int k) {
        return centralDifference(this, x, a, k);
    }

    @Override
    public boolean hasAnalyticGradient() {
        return false;
    }

    public static double centralDifference(FitFunction f, double x, double[] a, int k) {
        double ak = a[k];
        double h = RELATIVE_STEP * Math.max(Math.abs(ak), 1);
        double[] p = a.clone();
        p[k] = ak + h;
        double up = f.val(x, p);
        p[k] = ak - h;
        double down = f.val(x, p);
        return (up - down) / (2 * h);
    }

    /**
     * @return a view of {@param function} with the same values and numerically approximated partial derivatives
     */
    public static FitFunction wrap(FitFunction function) {
        return new FitFunctionNumericalGradient() {
            @Override
            public int getNParameters() {
                return function.getNParameters();
            }

            @Override
            public double val(double x, double[] a) {
                return function.val(x, a);
            }

            @Override
            public String toString() {
                return function.toString()+" (numerical gradient)";
            }
        };
    }
}
