package curvefit.processing.optimizer;

import Jama.Matrix;
import curvefit.processing.fit_function.FitFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * adapted from LevenbergMarquardtSolver by Jean-Yves Tinevez 2011 - 2013.
 * Weighted version, with parameters excluded from the optimization and parameter bounds.
 * <p>
 * Scaled version boosts the diagonal of the normal matrix: JᵀJ(r,r) × (1 + λ), i.e. the step of each parameter is normalized by the curvature along this parameter.
 * Unscaled version adds λ × I to the normal matrix.
 * @author Jean Ollion
 */
public class LevenbergMarquardtSolver extends LeastSquaresFitter {
    public static final Logger logger = LoggerFactory.getLogger(LevenbergMarquardtSolver.class);
    public static final double INITIAL_LAMBDA = 1e-3;
    static final double MAX_LAMBDA = 1e16; // no step can decrease chi² anymore
    static final double MAX_LAMBDA_SINGULAR = 1e20;
    static final int CONSECUTIVE_SMALL_STEPS = 2;
    private final boolean scaled;

    /**
     * Creates a new Levenberg-Marquardt solver for least-square curve fitting problems.
     * @param fixedIndices indices of parameters that are not optimized
     * @param lowerBounds lower bounds of parameters, may be null
     * @param upperBounds upper bounds of parameters, may be null
     * @param scaled damping proportional to the diagonal of the normal matrix if true, damping added as λ × I otherwise
     * @param maxIteration stop and return after this many iterations if not done
     * @param tolerance termination accuracy
     */
    public LevenbergMarquardtSolver(int[] fixedIndices, double[] lowerBounds, double[] upperBounds, boolean scaled, int maxIteration, double tolerance) {
        super(fixedIndices, lowerBounds, upperBounds, maxIteration, tolerance);
        this.scaled = scaled;
    }

    public boolean isScaled() {
        return scaled;
    }

    @Override
    public String toString() {
        return (scaled ? "Scaled" : "Unscaled")+" Levenberg-Marquardt least-square curve fitting algorithm";
    }

    /**
     * Minimize E = sum {w[k] × (y[k] - f(x[k],a))²}
     * Note that function implements the value and gradient of f(x,a),
     * NOT the value and gradient of E with respect to a!
     */
    @Override
    protected OptimizationResult solve(double[] x, double[] y, double[] weights, double[] a, FitFunction f) {
        int nparm = a.length;
        int[] fitToOriginal = WeightedLeastSquares.fitToOriginal(nparm, fixedIndices);
        int nparmFit = fitToOriginal.length;
        double lambda = INITIAL_LAMBDA;
        double e0 = WeightedLeastSquares.chiSquared(x, y, weights, a, f);
        if (Double.isNaN(e0) || Double.isInfinite(e0)) return new OptimizationResult(OptimizerState.FAILED, 0, e0, "chi² cannot be computed at initial parameters");
        if (nparmFit==0) return new OptimizationResult(OptimizerState.CONVERGED, 0, e0, "no free parameter");
        if (e0==0) return new OptimizationResult(OptimizerState.CONVERGED, 0, e0, "exact fit");
        double[] na = Arrays.copyOf(a, nparm); // next parameters

        // g = gradient, JtJ = jacobian, d = step to minimum
        // JtJ d = g, solve for d
        double[][] JtJ0 = new double[nparmFit][nparmFit];
        double[][] JtJ = new double[nparmFit][nparmFit];
        double[] g = new double[nparmFit];
        boolean computeNormalEquations = true;
        int iter = 0;
        int term = 0;	// termination count test
        int rejections = 0; // since last accepted step
        boolean onlyNaNRejections = true;

        while (true) {
            if (iter >= maxIterations) return new OptimizationResult(OptimizerState.MAX_ITERATIONS_REACHED, iter, e0, "maximum number of iterations reached");
            ++iter;
            if (computeNormalEquations) {
                if (!WeightedLeastSquares.normalEquations(x, y, weights, a, f, fitToOriginal, JtJ0, g)) {
                    return new OptimizationResult(OptimizerState.FAILED, iter, e0, "non-finite value in jacobian");
                }
                computeNormalEquations = false;
            }
            // boost diagonal towards gradient descent
            for (int r = 0; r < nparmFit; r++) {
                System.arraycopy(JtJ0[r], 0, JtJ[r], 0, nparmFit);
                if (scaled && JtJ0[r][r]!=0) JtJ[r][r] *= (1. + lambda);
                else JtJ[r][r] += lambda;
            }

            double[] d;
            try {
                d = (new Matrix(JtJ)).lu().solve(new Matrix(g, nparmFit)).getRowPackedCopy();
            } catch (RuntimeException re) { // Matrix is singular
                logger.trace("iteration {}: {} (lambda={})", iter, re.getMessage(), lambda);
                d = null;
            }
            if (d==null || Arrays.stream(d).anyMatch(v -> !Double.isFinite(v))) {
                lambda *= 10.;
                if (lambda > MAX_LAMBDA_SINGULAR) return new OptimizationResult(OptimizerState.FAILED, iter, e0, "singular normal equations");
                continue;
            }
            System.arraycopy(a, 0, na, 0, nparm);
            for (int i = 0; i<nparmFit; ++i) na[fitToOriginal[i]] += d[i];
            boolean valid = true;
            if (!WeightedLeastSquares.isValid(na, lowerBounds, upperBounds)) {
                double[] params = Arrays.copyOf(a, nparm);
                int change = 0;
                for (int i = 0; i<params.length; ++i) { // inspect parameters one by one to revert those that make the fit invalid
                    if (na[i]!=a[i]) {
                        params[i] = na[i]; // try this parameter
                        if (!WeightedLeastSquares.isValid(params, lowerBounds, upperBounds)) params[i] = a[i]; // change back
                        else ++change;
                    }
                }
                System.arraycopy(params, 0, na, 0, nparm);
                valid = change>0;
            }
            double e1 = WeightedLeastSquares.chiSquared(x, y, weights, na, f);
            if (e1 > e0 || Double.isNaN(e1) || !valid) { // new location worse than before
                ++rejections;
                if (!Double.isNaN(e1)) onlyNaNRejections = false;
                lambda *= 10.;
                if (lambda > MAX_LAMBDA) {
                    if (onlyNaNRejections) return new OptimizationResult(OptimizerState.FAILED, iter, e0, "evaluation produces NaN around current parameters");
                    return new OptimizationResult(OptimizerState.CONVERGED, iter, e0, "chi² cannot be decreased anymore");
                }
            } else { // new location better, accept new parameters
                if (rejections>0 && onlyNaNRejections && Arrays.equals(na, a)) return new OptimizationResult(OptimizerState.FAILED, iter, e0, "evaluation produces NaN around current parameters");
                boolean smallChange = e0 - e1 <= tolerance * e0;
                boolean smallStep = true;
                for (int i = 0; i<nparm; ++i) {
                    if (Math.abs(na[i] - a[i]) > tolerance * (Math.abs(a[i]) + tolerance)) {
                        smallStep = false;
                        break;
                    }
                }
                lambda *= 0.1;
                rejections = 0;
                onlyNaNRejections = true;
                e0 = e1;
                // simply assigning a = na will not get results copied back to caller
                System.arraycopy(na, 0, a, 0, nparm);
                computeNormalEquations = true;
                if (smallChange || smallStep) ++term;
                else term = 0;
                if (logger.isTraceEnabled()) logger.trace("iteration {}: chi²={}, lambda={}, params: {}", iter, e0, lambda, Arrays.toString(a));
                if (term >= CONSECUTIVE_SMALL_STEPS || e0==0) return new OptimizationResult(OptimizerState.CONVERGED, iter, e0, "");
            }
        }
    }
}
