package curvefit.processing.fit;

import curvefit.processing.optimizer.OptimizerState;

/**
 * Terminal status of a fit
 */
public enum FitStatus {
    CONVERGED, MAX_ITERATIONS_REACHED, FAILED;

    public static FitStatus fromOptimizerState(OptimizerState state) {
        switch (state) {
            case CONVERGED: return CONVERGED;
            case MAX_ITERATIONS_REACHED: return MAX_ITERATIONS_REACHED;
            case FAILED: return FAILED;
            default: throw new IllegalArgumentException("Optimizer state: "+state+" is not terminal");
        }
    }
}
