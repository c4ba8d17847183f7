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
 * Polynomial of order <code>n</code>, defined by the <code>n+1</code> parameters a₀..aₙ:
 * <pre>
 * f(x) = a₀ + a₁ × x + ... + aₙ × xⁿ
 * </pre>
 * @author Jean Ollion
 */
public class Polynomial implements FitFunction {
    final int order;

    public Polynomial(int order) {
        if (order<0) throw new IllegalArgumentException("Order should be positive");
        this.order = order;
    }

    public int getOrder() {
        return order;
    }

    @Override
    public int getNParameters() {
        return order + 1;
    }

    @Override
    public double val(double x, double[] a) {
        double res = a[order];
        for (int k = order-1; k>=0; --k) res = res * x + a[k]; // horner
        return res;
    }

    @Override
    public double grad(double x, double[] a, int k) {
        if (k<0 || k>order) throw new IllegalArgumentException("Invalid parameter index: "+k);
        return Math.pow(x, k);
    }

    @Override
    public String toString() {
        return "Polynomial of order "+order;
    }
}
