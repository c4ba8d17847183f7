package curvefit.processing.fit_function;

import curvefit.data_structure.Dataset;

/**
 * Computes initial parameters of a fit from the observations
 * @author Jean Ollion
 */
public interface StartPointEstimator {
    /**
     * @param data filtered observations, not empty
     * @return initial parameters, one per parameter of the fitted function
     */
    double[] initializeFit(Dataset data);
}
