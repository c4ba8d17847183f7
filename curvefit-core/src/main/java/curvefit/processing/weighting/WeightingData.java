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

import curvefit.utils.ArrayUtil;

/**
 * External column used for {@link WeightingMethod#ARBITRARY_DATASET} weighting. Values are standard deviations, read in order
 * for the points of the fitted range.
 */
public class WeightingData {
    final String name;
    final double[] values;

    public WeightingData(String name, double[] values) {
        if (values==null) throw new IllegalArgumentException("Weighting data values are required");
        this.name = name==null ? "" : name;
        this.values = ArrayUtil.duplicate(values);
    }

    public String getName() {
        return name;
    }

    public int size() {
        return values.length;
    }

    public double get(int row) {
        return values[row];
    }

    public double[] getValues() {
        return ArrayUtil.duplicate(values);
    }
}
