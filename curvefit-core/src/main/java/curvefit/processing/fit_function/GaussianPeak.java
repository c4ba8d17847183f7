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
 * Gaussian peak parametrized by its area:
 * <pre>
 * f(x) = √(2/π) × A / w × exp( -2 (x - xc)² / w² )
 * </pre>
 * w is twice the standard deviation.
 * @author Jean Ollion
 */
public class GaussianPeak implements PeakFunction {
    static final double NORM = Math.sqrt(2 / Math.PI);
    static final double FWHM_TO_WIDTH = 1 / Math.sqrt(2 * Math.log(2));

    @Override
    public double val(double x, double[] a) {
        double d = x - a[CENTER];
        double w = a[WIDTH];
        return NORM * a[AREA] / w * Math.exp(-2 * d * d / (w * w));
    }

    @Override
    public double grad(double x, double[] a, int k) {
        double d = x - a[CENTER];
        double w = a[WIDTH];
        double E = NORM / w * Math.exp(-2 * d * d / (w * w));
        switch (k) {
            case AREA:
                return E;
            case CENTER:
                return a[AREA] * E * 4 * d / (w * w);
            case WIDTH:
                return a[AREA] * E * (4 * d * d / (w * w) - 1) / w;
            default:
                throw new IllegalArgumentException("Invalid parameter index: "+k);
        }
    }

    @Override
    public double getHeight(double area, double width) {
        return NORM * area / width;
    }

    @Override
    public double getArea(double height, double width) {
        return height * width / NORM;
    }

    @Override
    public double getWidth(double fwhm) {
        return fwhm * FWHM_TO_WIDTH;
    }

    @Override
    public String toString() {
        return "Gauss √(2/π)·A/w·exp(-2(x-xc)²/w²)";
    }
}
