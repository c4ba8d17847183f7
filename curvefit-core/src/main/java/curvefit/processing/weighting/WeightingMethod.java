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
package curvefit.processing.weighting;

/**
 * Weighting policies of a fit
 * @author Jean Ollion
 */
public enum WeightingMethod {
    NONE("No weighting"),
    INSTRUMENTAL("Instrumental"),
    STATISTICAL("Statistical"),
    ARBITRARY_DATASET("Arbitrary Dataset");

    public final String displayName;
    WeightingMethod(String displayName) {
        this.displayName = displayName;
    }

    public static WeightingMethod get(String name) {
        for (WeightingMethod m : values()) if (m.name().equals(name) || m.displayName.equals(name)) return m;
        throw new IllegalArgumentException("Unknown weighting method: "+name);
    }
}
