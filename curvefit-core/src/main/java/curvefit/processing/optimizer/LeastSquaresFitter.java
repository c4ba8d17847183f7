package curvefit.processing.optimizer;

import curvefit.processing.fit_function.FitFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Base class of solvers: holds the parameters that are not optimized, the parameter bounds, the iteration cap and the tolerance.
 * An exception thrown by the fit function ends the optimization in the {@link OptimizerState#FAILED} state.
 */
public abstract class LeastSquaresFitter implements FunctionFitter {
    public static final Logger logger = LoggerFactory.getLogger(LeastSquaresFitter.class);
    protected final int[] fixedIndices;
    protected final double[] lowerBounds, upperBounds;
    protected final int maxIterations;
    protected final double tolerance;
    protected OptimizerState state = OptimizerState.INITIALIZED;

    protected LeastSquaresFitter(int[] fixedIndices, double[] lowerBounds, double[] upperBounds, int maxIterations, double tolerance) {
        if (maxIterations<1) throw new IllegalArgumentException("Max iterations should be at least 1");
        if (!(tolerance>0)) throw new IllegalArgumentException("Tolerance should be strictly positive");
        this.fixedIndices = fixedIndices==null ? new int[0] : Arrays.copyOf(fixedIndices, fixedIndices.length);
        this.lowerBounds = lowerBounds;
        this.upperBounds = upperBounds;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    @Override
    public OptimizerState getState() {
        return state;
    }

    @Override
    public OptimizationResult fit(double[] x, double[] y, double[] weights, double[] a, FitFunction f) {
        if (state!=OptimizerState.INITIALIZED) throw new IllegalStateException("Solver has already been used");
        if (x.length!=y.length || y.length!=weights.length) throw new IllegalArgumentException("x, y and weights should have same length");
        if (a.length!=f.getNParameters()) throw new IllegalArgumentException("Expected "+f.getNParameters()+" parameters, got: "+a.length);
        if (lowerBounds!=null && lowerBounds.length!=a.length || upperBounds!=null && upperBounds.length!=a.length) throw new IllegalArgumentException("Bounds should have one value per parameter");
        state = OptimizerState.ITERATING;
        OptimizationResult res;
        try {
            res = solve(x, y, weights, a, f);
        } catch (RuntimeException e) { // error raised by the fit function during evaluation
            logger.warn("error while evaluating {}: {}", f, e.getMessage());
            res = new OptimizationResult(OptimizerState.FAILED, 0, Double.NaN, "evaluation error: "+e.getMessage());
        }
        state = res.getState();
        return res;
    }

    protected abstract OptimizationResult solve(double[] x, double[] y, double[] weights, double[] a, FitFunction f);
}
