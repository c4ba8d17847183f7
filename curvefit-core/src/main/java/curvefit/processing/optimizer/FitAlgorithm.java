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

/**
 * Optimization algorithms
 * @author Jean Ollion
 */
public enum FitAlgorithm {
    SIMPLEX("Nelder-Mead Simplex", false),
    SCALED_LEVENBERG_MARQUARDT("Scaled Levenberg-Marquardt", true),
    UNSCALED_LEVENBERG_MARQUARDT("Unscaled Levenberg-Marquardt", true);

    public final String displayName;
    private final boolean requiresJacobian;

    FitAlgorithm(String displayName, boolean requiresJacobian) {
        this.displayName = displayName;
        this.requiresJacobian = requiresJacobian;
    }

    public boolean requiresJacobian() {
        return requiresJacobian;
    }

    /**
     * Creates a new solver for this algorithm
     * @param fixedIndices indices of parameters that are not optimized
     * @param lowerBounds lower bounds of parameters, null for no bounds
     * @param upperBounds upper bounds of parameters, null for no bounds
     * @param maxIterations iteration cap
     * @param tolerance relative convergence tolerance
     */
    public FunctionFitter createFitter(int[] fixedIndices, double[] lowerBounds, double[] upperBounds, int maxIterations, double tolerance) {
        switch (this) {
            case SIMPLEX:
                return new NelderMeadSimplexSolver(fixedIndices, lowerBounds, upperBounds, maxIterations, tolerance);
            case SCALED_LEVENBERG_MARQUARDT:
                return new LevenbergMarquardtSolver(fixedIndices, lowerBounds, upperBounds, true, maxIterations, tolerance);
            case UNSCALED_LEVENBERG_MARQUARDT:
            default:
                return new LevenbergMarquardtSolver(fixedIndices, lowerBounds, upperBounds, false, maxIterations, tolerance);
        }
    }

    public static FitAlgorithm get(String name) {
        for (FitAlgorithm a : values()) if (a.name().equals(name) || a.displayName.equals(name)) return a;
        throw new IllegalArgumentException("Unknown fit algorithm: "+name);
    }
}
