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

import curvefit.data_structure.Dataset;
import curvefit.processing.exceptions.InvalidWeightException;
import curvefit.processing.exceptions.MissingErrorColumnException;
import curvefit.processing.exceptions.RowCountMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Computes the statistical weights w = 1/σ² of the points of a (filtered) dataset.
 * <ul>
 *     <li>{@link WeightingMethod#NONE}: w = 1</li>
 *     <li>{@link WeightingMethod#INSTRUMENTAL}: σ read from the error data of the dataset</li>
 *     <li>{@link WeightingMethod#STATISTICAL}: Poisson variance σ² = |y|; points with no signal get w = 1</li>
 *     <li>{@link WeightingMethod#ARBITRARY_DATASET}: σ read from an external column, one row per fitted point</li>
 * </ul>
 * @author Jean Ollion
 */
public class Weighting {
    public static final Logger logger = LoggerFactory.getLogger(Weighting.class);

    /**
     *
     * @param data filtered dataset
     * @param method weighting policy
     * @param weightingData external column, only used for {@link WeightingMethod#ARBITRARY_DATASET}
     * @return weight vector aligned with {@param data}
     * @throws MissingErrorColumnException if error data required by {@param method} is missing
     * @throws RowCountMismatchException if error data has fewer rows than required
     * @throws InvalidWeightException if an error value is not finite or not strictly positive
     */
    public static double[] computeWeights(Dataset data, WeightingMethod method, WeightingData weightingData) {
        int n = data.size();
        double[] weights = new double[n];
        switch (method==null ? WeightingMethod.NONE : method) {
            case NONE:
            default:
                Arrays.fill(weights, 1);
                break;
            case INSTRUMENTAL: {
                if (!data.hasErrors()) throw new MissingErrorColumnException(data.getName());
                int required = n==0 ? 0 : Arrays.stream(data.getSourceRows()).max().getAsInt() + 1;
                if (data.errorRowCount() < required) throw new RowCountMismatchException(data.getName()+" errors", required, data.errorRowCount());
                for (int i = 0; i<n; ++i) weights[i] = toWeight(data.getError(i), data.getName()+" errors", data.getSourceRow(i));
                break;
            }
            case STATISTICAL:
                for (int i = 0; i<n; ++i) {
                    double variance = Math.abs(data.getY(i));
                    weights[i] = variance>0 ? 1/variance : 1;
                }
                break;
            case ARBITRARY_DATASET: {
                if (weightingData==null) throw new MissingErrorColumnException(data.getName()+" (no weighting dataset selected)");
                if (weightingData.size() < n) throw new RowCountMismatchException(weightingData.getName(), n, weightingData.size());
                for (int i = 0; i<n; ++i) weights[i] = toWeight(weightingData.get(i), weightingData.getName(), i);
                break;
            }
        }
        logger.debug("weighting: {} on {} points", method, n);
        return weights;
    }

    private static double toWeight(double sigma, String columnName, int row) {
        if (!Double.isFinite(sigma) || sigma<=0) throw new InvalidWeightException(columnName, row, sigma);
        return 1 / (sigma * sigma);
    }
}
