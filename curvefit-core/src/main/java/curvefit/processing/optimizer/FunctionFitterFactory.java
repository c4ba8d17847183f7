package curvefit.processing.optimizer;

/**
 * Creates the solver of a fit
 */
@FunctionalInterface
public interface FunctionFitterFactory {
    FunctionFitterFactory DEFAULT = FitAlgorithm::createFitter;

    FunctionFitter create(FitAlgorithm algorithm, int[] fixedIndices, double[] lowerBounds, double[] upperBounds, int maxIterations, double tolerance);
}
