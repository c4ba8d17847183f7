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
 * Gaussian parametrized by its amplitude, plus an offset:
 * <pre>
 * k = 0      - y₀
 * k = 1      - xc
 * k = 2      - w
 * k = 3      - A
 * </pre>
 * <pre>
 * f(x) = y₀ + A × exp( -(x - xc)² / (2 w²) )
 * </pre>
 * @author Jean Ollion
 */
public class GaussianAmplitude implements FitFunction {
    @Override
    public int getNParameters() {
        return 4;
    }

    @Override
    public double val(double x, double[] a) {
        double d = x - a[1];
        return a[0] + a[3] * Math.exp(- d * d / (2 * a[2] * a[2]));
    }

    @Override
    public double grad(double x, double[] a, int k) {
        double d = x - a[1];
        double w2 = a[2] * a[2];
        double E = Math.exp(- d * d / (2 * w2));
        switch (k) {
            case 0:
                return 1;
            case 1:
                return a[3] * E * d / w2;
            case 2:
                return a[3] * E * d * d / (w2 * a[2]);
            case 3:
                return E;
            default:
                throw new IllegalArgumentException("Invalid parameter index: "+k);
        }
    }

    @Override
    public String toString() {
        return "Gaussian y0 + A × exp(-(x-xc)²/(2w²))";
    }
}
