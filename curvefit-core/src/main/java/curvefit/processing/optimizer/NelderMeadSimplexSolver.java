/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of CurveFit
 *
 * CurveFit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * CurveFit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with CurveFit.  If not, see <http://www.gnu.org/licenses/>.
 */
package curvefit.processing.optimizer;

import curvefit.processing.fit_function.FitFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.function.ToDoubleFunction;

/**
 * Nelder-Mead downhill simplex minimization of the weighted chi², gradient free.
 * The initial simplex is built around the initial parameters by perturbing each optimized parameter by 5%.
 * Terminates when the relative spread of chi² values across vertices falls below the tolerance:
 * <pre>
 * 2 × |χ²ₕ - χ²ₗ| / (|χ²ₕ| + |χ²ₗ| + ε) < tolerance
 * </pre>
 * Points outside the parameter bounds have an infinite chi².
 * @author Jean Ollion
 */
public class NelderMeadSimplexSolver extends LeastSquaresFitter {
    public static final Logger logger = LoggerFactory.getLogger(NelderMeadSimplexSolver.class);
    static final double ALPHA = 1.0; // reflection
    static final double GAMMA = 2.0; // expansion
    static final double RHO = 0.5; // contraction
    static final double SIGMA = 0.5; // shrink
    static final double PERTURBATION = 0.05;
    static final double TINY = 1e-10;

    public NelderMeadSimplexSolver(int[] fixedIndices, double[] lowerBounds, double[] upperBounds, int maxIterations, double tolerance) {
        super(fixedIndices, lowerBounds, upperBounds, maxIterations, tolerance);
    }

    @Override
    public String toString() {
        return "Nelder-Mead simplex least-square curve fitting algorithm";
    }

    @Override
    protected OptimizationResult solve(double[] x, double[] y, double[] weights, double[] a, FitFunction f) {
        int[] fitToOriginal = WeightedLeastSquares.fitToOriginal(a.length, fixedIndices);
        int dimensions = fitToOriginal.length;
        double[] params = Arrays.copyOf(a, a.length);
        ToDoubleFunction<double[]> function = vertex -> {
            for (int i = 0; i<dimensions; ++i) params[fitToOriginal[i]] = vertex[i];
            if (!WeightedLeastSquares.isValid(params, lowerBounds, upperBounds)) return Double.POSITIVE_INFINITY;
            double chi2 = WeightedLeastSquares.chiSquared(x, y, weights, params, f);
            return Double.isNaN(chi2) ? Double.POSITIVE_INFINITY : chi2;
        };
        double[] initialGuess = new double[dimensions];
        for (int i = 0; i<dimensions; ++i) initialGuess[i] = a[fitToOriginal[i]];
        double f0 = function.applyAsDouble(initialGuess);
        if (Double.isInfinite(f0)) return new OptimizationResult(OptimizerState.FAILED, 0, WeightedLeastSquares.chiSquared(x, y, weights, a, f), "chi² cannot be computed at initial parameters");
        if (dimensions==0) return new OptimizationResult(OptimizerState.CONVERGED, 0, f0, "no free parameter");

        // Initialize simplex
        double[][] simplex = new double[dimensions + 1][];
        double[] fSimplex = new double[dimensions + 1];
        simplex[0] = initialGuess;
        fSimplex[0] = f0;
        // Create other points by perturbing the initial guess along each axis
        for (int i = 0; i < dimensions; i++) {
            simplex[i + 1] = Arrays.copyOf(initialGuess, dimensions);
            if (Math.abs(simplex[i + 1][i]) > 1e-9) simplex[i + 1][i] *= (1.0 + PERTURBATION);
            else simplex[i + 1][i] = PERTURBATION;
            fSimplex[i + 1] = function.applyAsDouble(simplex[i + 1]);
        }
        Integer[] order = new Integer[dimensions + 1];
        int iteration = 0;
        OptimizerState endState = OptimizerState.MAX_ITERATIONS_REACHED;
        while (true) {
            // Order simplex points by function value (best to worst)
            for (int i = 0; i <= dimensions; i++) order[i] = i;
            Arrays.sort(order, Comparator.comparingDouble(i -> fSimplex[i]));
            int bestIdx = order[0];
            int secondWorstIdx = order[dimensions - 1];
            int worstIdx = order[dimensions];
            double fl = fSimplex[bestIdx], fh = fSimplex[worstIdx];
            if (2 * Math.abs(fh - fl) / (Math.abs(fh) + Math.abs(fl) + TINY) < tolerance) {
                endState = OptimizerState.CONVERGED;
                break;
            }
            if (iteration >= maxIterations) break;
            ++iteration;

            // Centroid (excluding the worst point)
            double[] centroid = new double[dimensions];
            for (int j = 0; j <= dimensions; j++) {
                if (j == worstIdx) continue;
                for (int i = 0; i < dimensions; i++) centroid[i] += simplex[j][i];
            }
            for (int i = 0; i < dimensions; i++) centroid[i] /= dimensions;

            // Reflection
            double[] reflected = new double[dimensions];
            for (int i = 0; i < dimensions; i++) reflected[i] = centroid[i] + ALPHA * (centroid[i] - simplex[worstIdx][i]);
            double fReflected = function.applyAsDouble(reflected);
            if (fReflected >= fl && fReflected < fSimplex[secondWorstIdx]) {
                replace(simplex, fSimplex, worstIdx, reflected, fReflected);
                continue;
            }
            // Expansion
            if (fReflected < fl) {
                double[] expanded = new double[dimensions];
                for (int i = 0; i < dimensions; i++) expanded[i] = centroid[i] + GAMMA * (reflected[i] - centroid[i]);
                double fExpanded = function.applyAsDouble(expanded);
                if (fExpanded < fReflected) replace(simplex, fSimplex, worstIdx, expanded, fExpanded);
                else replace(simplex, fSimplex, worstIdx, reflected, fReflected);
                continue;
            }
            // Contraction
            double[] contracted = new double[dimensions];
            boolean outside = fReflected < fh;
            for (int i = 0; i < dimensions; i++) {
                if (outside) contracted[i] = centroid[i] + RHO * (reflected[i] - centroid[i]);
                else contracted[i] = centroid[i] - RHO * (centroid[i] - simplex[worstIdx][i]);
            }
            double fContracted = function.applyAsDouble(contracted);
            if (fContracted < Math.min(fReflected, fh)) {
                replace(simplex, fSimplex, worstIdx, contracted, fContracted);
                continue;
            }
            // Shrink towards the best point
            for (int j = 0; j <= dimensions; j++) {
                if (j == bestIdx) continue;
                for (int i = 0; i < dimensions; i++) simplex[j][i] = simplex[bestIdx][i] + SIGMA * (simplex[j][i] - simplex[bestIdx][i]);
                fSimplex[j] = function.applyAsDouble(simplex[j]);
            }
        }
        int best = 0;
        for (int j = 1; j <= dimensions; j++) if (fSimplex[j] < fSimplex[best]) best = j;
        for (int i = 0; i<dimensions; ++i) a[fitToOriginal[i]] = simplex[best][i];
        logger.debug("simplex: {} after {} iterations, chi²={}", endState, iteration, fSimplex[best]);
        return new OptimizationResult(endState, iteration, fSimplex[best], endState==OptimizerState.MAX_ITERATIONS_REACHED ? "maximum number of iterations reached" : "");
    }

    private static void replace(double[][] simplex, double[] fSimplex, int idx, double[] vertex, double value) {
        System.arraycopy(vertex, 0, simplex[idx], 0, vertex.length);
        fSimplex[idx] = value;
    }
}
