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
 * Boltzmann sigmoid, defined by the parameters:
 * <pre>
 * k = 0      - A₁ (initial value)
 * k = 1      - A₂ (final value)
 * k = 2      - x₀ (center)
 * k = 3      - dx (time constant)
 * </pre>
 * <pre>
 * f(x) = (A₁ - A₂) / (1 + exp( (x - x₀) / dx )) + A₂
 * </pre>
 * @author Jean Ollion
 */
public class Boltzmann implements FitFunction {
    @Override
    public int getNParameters() {
        return 4;
    }

    @Override
    public double val(double x, double[] a) {
        return (a[0] - a[1]) / (1 + Math.exp((x - a[2]) / a[3])) + a[1];
    }

    @Override
    public double grad(double x, double[] a, int k) {
        double e = Math.exp((x - a[2]) / a[3]);
        double s = 1 / (1 + e);
        switch (k) {
            case 0:
                return s;
            case 1:
                return 1 - s;
            case 2:
                return (a[0] - a[1]) * e * s * s / a[3];
            case 3:
                return (a[0] - a[1]) * e * s * s * (x - a[2]) / (a[3] * a[3]);
            default:
                throw new IllegalArgumentException("Invalid parameter index: "+k);
        }
    }

    @Override
    public String toString() {
        return "Boltzmann (A1-A2)/(1+exp((x-x0)/dx))+A2";
    }
}
