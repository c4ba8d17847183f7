package curvefit.processing.fit_function;

/**
 * A parametric function of one variable, to be fitted on (x, y) observations
 * @author Jean Ollion
 */
public interface FitFunction {
    /**
     * @return number of parameters of the function
     */
    int getNParameters();

    /**
     * @return value of the function at {@param x} for parameters {@param a}
     */
    double val(double x, double[] a);

    /**
     * @return partial derivative of the function at {@param x} with respect to the {@param k}-th parameter
     */
    double grad(double x, double[] a, int k);

    /**
     * Partial derivatives with respect to all parameters. Functions that compute all derivatives at once should override this method.
     */
    default double[] jacobian(double x, double[] a) {
        double[] res = new double[a.length];
        for (int k = 0; k<a.length; ++k) res[k] = grad(x, a, k);
        return res;
    }

    /**
     * @return false if partial derivatives are approximated numerically
     */
    default boolean hasAnalyticGradient() {
        return true;
    }
}
