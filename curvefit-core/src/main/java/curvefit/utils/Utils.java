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
package curvefit.utils;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;

/**
 *
 * @author Jean Ollion
 */
public class Utils {
    public static final String NA_STRING = "NA";

    /**
     * @return {@param number} with {@param significantDigits} significant digits, in plain or scientific notation depending on its magnitude
     */
    public static String format(double number, int significantDigits) {
        if (Double.isNaN(number) || Double.isInfinite(number)) return NA_STRING;
        if (number == 0) return "0";
        if (significantDigits<1) significantDigits = 1;
        double abs = Math.abs(number);
        if (abs >= 1e5 || abs < 1e-4) {
            return String.format(Locale.US, "%." + (significantDigits-1) + "E", number);
        } else {
            return new BigDecimal(number).round(new MathContext(significantDigits)).stripTrailingZeros().toPlainString();
        }
    }

    public static String padRight(String s, int size) {
        if (s.length()>=size) return s;
        StringBuilder sb = new StringBuilder(s);
        while (sb.length()<size) sb.append(' ');
        return sb.toString();
    }
}
