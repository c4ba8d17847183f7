package curvefit.processing.optimizer;

import curvefit.processing.fit_function.FitFunction;

/**
 * Weighted least-square fitter. Minimizes ∑ wᵢ × (yᵢ - f(xᵢ, a))²
 * A fitter instance is meant for a single call of {@link #fit(double[], double[], double[], double[], FitFunction)}
 */
public interface FunctionFitter {
    /**
     *
     * @param x abscissa of observations
     * @param y observed values
     * @param weights statistical weights of observations
     * @param a initial parameters. Modified in place: contains the best parameters found when the method returns
     * @param f fitted function
     * @return outcome of the optimization, in a terminal state
     */
    OptimizationResult fit(double[] x, double[] y, double[] weights, double[] a, FitFunction f);

    OptimizerState getState();
}
