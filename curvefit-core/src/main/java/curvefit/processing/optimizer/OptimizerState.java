package curvefit.processing.optimizer;

/**
 * Lifecycle of an optimization: INITIALIZED → ITERATING → one of the terminal states
 */
public enum OptimizerState {
    INITIALIZED, ITERATING, CONVERGED, MAX_ITERATIONS_REACHED, FAILED;

    public boolean isTerminal() {
        return this==CONVERGED || this==MAX_ITERATIONS_REACHED || this==FAILED;
    }
}
