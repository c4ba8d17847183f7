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
 * Sum of <code>n</code> exponentials plus an offset, defined by <code>2n+1</code> parameters:
 * <pre>
 * k = 2i     - Aᵢ
 * k = 2i+1   - tᵢ
 * k = 2n     - y₀
 * </pre>
 * with
 * <pre>
 * f(x) = ∑ Aᵢ × exp( s × x / tᵢ ) + y₀
 * </pre>
 * s = -1 for decay, s = 1 for growth. Decay and growth thus only differ by the sign of the rate.
 * @author Jean Ollion
 */
public class Exponential implements FitFunction {
    final int nTerms;
    final double sign;

    public Exponential(int nTerms, boolean growth) {
        if (nTerms<1) throw new IllegalArgumentException("At least one exponential term is required");
        this.nTerms = nTerms;
        this.sign = growth ? 1 : -1;
    }

    public boolean isGrowth() {
        return sign>0;
    }

    public int getNTerms() {
        return nTerms;
    }

    @Override
    public int getNParameters() {
        return 2 * nTerms + 1;
    }

    @Override
    public double val(double x, double[] a) {
        double res = a[2*nTerms];
        for (int i = 0; i<nTerms; ++i) res += a[2*i] * Math.exp(sign * x / a[2*i+1]);
        return res;
    }

    @Override
    public double grad(double x, double[] a, int k) {
        if (k==2*nTerms) return 1;
        int i = k/2;
        double t = a[2*i+1];
        double e = Math.exp(sign * x / t);
        if (k%2==0) return e; // amplitude
        else return - a[2*i] * e * sign * x / (t * t);
    }

    @Override
    public String toString() {
        return (sign>0 ? "Exponential growth" : "Exponential decay") + " ("+nTerms+" term"+(nTerms>1?"s":"")+")";
    }
}
