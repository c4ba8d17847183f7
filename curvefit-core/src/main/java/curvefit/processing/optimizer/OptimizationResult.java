package curvefit.processing.optimizer;

/**
 * Outcome of an optimization
 */
public class OptimizationResult {
    final OptimizerState state;
    final int iterations;
    final double chiSquared;
    final String message;

    public OptimizationResult(OptimizerState state, int iterations, double chiSquared, String message) {
        if (!state.isTerminal()) throw new IllegalArgumentException("Optimization result requires a terminal state, got: "+state);
        this.state = state;
        this.iterations = iterations;
        this.chiSquared = chiSquared;
        this.message = message==null ? "" : message;
    }

    public OptimizerState getState() {
        return state;
    }

    public int getIterations() {
        return iterations;
    }

    public double getChiSquared() {
        return chiSquared;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return state+" after "+iterations+" iterations, chi²="+chiSquared+(message.isEmpty() ? "" : " ("+message+")");
    }
}
