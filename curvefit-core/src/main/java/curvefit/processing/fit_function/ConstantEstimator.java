package curvefit.processing.fit_function;

import curvefit.data_structure.Dataset;
import curvefit.utils.ArrayUtil;

/**
 * Estimates a constant background as the minimal value of the observations
 */
public class ConstantEstimator implements StartPointEstimator {
    @Override
    public double[] initializeFit(Dataset data) {
        double[] y = data.getY();
        return new double[]{y[ArrayUtil.min(y)]};
    }
}
