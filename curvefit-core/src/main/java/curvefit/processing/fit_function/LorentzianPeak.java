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
 * Lorentzian peak parametrized by its area:
 * <pre>
 * f(x) = 2A / π × w / (4 (x - xc)² + w²)
 * </pre>
 * w is the full width at half maximum.
 * @author Jean Ollion
 */
public class LorentzianPeak implements PeakFunction {
    @Override
    public double val(double x, double[] a) {
        double d = x - a[CENTER];
        double w = a[WIDTH];
        return 2 * a[AREA] / Math.PI * w / (4 * d * d + w * w);
    }

    @Override
    public double grad(double x, double[] a, int k) {
        double d = x - a[CENTER];
        double w = a[WIDTH];
        double D = 4 * d * d + w * w;
        switch (k) {
            case AREA:
                return 2 / Math.PI * w / D;
            case CENTER:
                return 2 * a[AREA] / Math.PI * w * 8 * d / (D * D);
            case WIDTH:
                return 2 * a[AREA] / Math.PI * (4 * d * d - w * w) / (D * D);
            default:
                throw new IllegalArgumentException("Invalid parameter index: "+k);
        }
    }

    @Override
    public double getHeight(double area, double width) {
        return 2 * area / (Math.PI * width);
    }

    @Override
    public double getArea(double height, double width) {
        return height * Math.PI * width / 2;
    }

    @Override
    public double getWidth(double fwhm) {
        return fwhm;
    }

    @Override
    public String toString() {
        return "Lorentz 2A/π·w/(4(x-xc)²+w²)";
    }
}
