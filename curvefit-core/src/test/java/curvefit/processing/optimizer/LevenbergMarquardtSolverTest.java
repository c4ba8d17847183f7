package curvefit.processing.optimizer;

import curvefit.processing.fit_function.Exponential;
import curvefit.processing.fit_function.FitFunction;
import curvefit.processing.fit_function.Polynomial;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class LevenbergMarquardtSolverTest {
    static double[][] expDecayData(double A, double t, double y0) {
        double[] x = new double[101];
        double[] y = new double[101];
        for (int i = 0; i<x.length; ++i) {
            x[i] = i * 0.1;
            y[i] = A * Math.exp(-x[i] / t) + y0;
        }
        return new double[][]{x, y};
    }

    static double[] ones(int n) {
        double[] w = new double[n];
        Arrays.fill(w, 1);
        return w;
    }

    @Test
    public void scaledRecoversExponentialDecay() {
        recoverExponentialDecay(true);
    }

    @Test
    public void unscaledRecoversExponentialDecay() {
        recoverExponentialDecay(false);
    }

    private void recoverExponentialDecay(boolean scaled) {
        double[][] data = expDecayData(5, 2, 1);
        double[] a = {4, 1.5, 0.5};
        LevenbergMarquardtSolver solver = new LevenbergMarquardtSolver(null, null, null, scaled, 1000, 1e-10);
        assertEquals(OptimizerState.INITIALIZED, solver.getState());
        OptimizationResult res = solver.fit(data[0], data[1], ones(data[0].length), a, new Exponential(1, false));
        assertEquals(OptimizerState.CONVERGED, res.getState());
        assertEquals(OptimizerState.CONVERGED, solver.getState());
        assertEquals(5, a[0], 1e-6);
        assertEquals(2, a[1], 1e-6);
        assertEquals(1, a[2], 1e-6);
        assertTrue(res.getChiSquared() < 1e-10);
    }

    @Test
    public void fixedParameterIsNotModified() {
        double[][] data = expDecayData(5, 2, 1);
        double[] a = {4, 1.5, 1};
        OptimizationResult res = new LevenbergMarquardtSolver(new int[]{2}, null, null, true, 1000, 1e-10).fit(data[0], data[1], ones(data[0].length), a, new Exponential(1, false));
        assertEquals(OptimizerState.CONVERGED, res.getState());
        assertEquals(1, a[2], 0);
        assertEquals(5, a[0], 1e-6);
    }

    @Test
    public void boundsAreRespected() {
        double[][] data = expDecayData(5, 2, 1);
        double[] a = {4, 1.5, 0.5};
        double[] lower = {Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY};
        double[] upper = {4.5, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY};
        new LevenbergMarquardtSolver(null, lower, upper, true, 1000, 1e-10).fit(data[0], data[1], ones(data[0].length), a, new Exponential(1, false));
        assertTrue(Arrays.toString(a), a[0] <= 4.5);
    }

    @Test
    public void iterationCap() {
        double[][] data = expDecayData(5, 2, 1);
        double[] a = {1, 10, 0};
        OptimizationResult res = new LevenbergMarquardtSolver(null, null, null, true, 2, 1e-12).fit(data[0], data[1], ones(data[0].length), a, new Exponential(1, false));
        assertEquals(OptimizerState.MAX_ITERATIONS_REACHED, res.getState());
        assertEquals(2, res.getIterations());
    }

    @Test
    public void nonFiniteInitialChiSquared() {
        FitFunction f = new Polynomial(1);
        double[] a = {Double.NaN, 1};
        OptimizationResult res = new LevenbergMarquardtSolver(null, null, null, true, 100, 1e-6).fit(new double[]{0, 1, 2}, new double[]{0, 1, 2}, ones(3), a, f);
        assertEquals(OptimizerState.FAILED, res.getState());
    }

    @Test
    public void weightsAreApplied() {
        // outlier with negligible weight has no effect on the fit
        double[] x = {0, 1, 2, 3, 4};
        double[] y = {1, 3, 5, 7, 100};
        double[] w = {1, 1, 1, 1, 1e-12};
        double[] a = {0, 1};
        new LevenbergMarquardtSolver(null, null, null, false, 1000, 1e-12).fit(x, y, w, a, new Polynomial(1));
        assertEquals(1, a[0], 1e-3);
        assertEquals(2, a[1], 1e-3);
    }

    @Test(expected = IllegalStateException.class)
    public void singleUse() {
        LevenbergMarquardtSolver solver = new LevenbergMarquardtSolver(null, null, null, true, 100, 1e-6);
        double[] x = {0, 1, 2};
        solver.fit(x, x, ones(3), new double[]{0, 1}, new Polynomial(1));
        solver.fit(x, x, ones(3), new double[]{0, 1}, new Polynomial(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void parameterCountMismatch() {
        double[] x = {0, 1, 2};
        new LevenbergMarquardtSolver(null, null, null, true, 100, 1e-6).fit(x, x, ones(3), new double[]{0}, new Polynomial(1));
    }

    @Test
    public void covariance() {
        // straight line with unit weights: covariance is the inverse of the normal matrix
        double[] x = {0, 1, 2};
        double[] y = {0, 1, 2};
        double[][] cov = WeightedLeastSquares.covariance(x, y, ones(3), new double[]{0, 1}, new Polynomial(1), new int[0]);
        // JtJ = [[3, 3], [3, 5]], inverse = 1/6 * [[5, -3], [-3, 3]]
        assertEquals(5/6d, cov[0][0], 1e-12);
        assertEquals(-0.5, cov[0][1], 1e-12);
        assertEquals(0.5, cov[1][1], 1e-12);
        double[][] covFixed = WeightedLeastSquares.covariance(x, y, ones(3), new double[]{0, 1}, new Polynomial(1), new int[]{0});
        assertEquals(0, covFixed[0][0], 0);
        assertEquals(0.2, covFixed[1][1], 1e-12);
    }

    // slope model that is only defined for a <= 1
    static final FitFunction BOUNDED_SLOPE = new FitFunction() {
        @Override
        public int getNParameters() {
            return 1;
        }

        @Override
        public double val(double x, double[] a) {
            return a[0] <= 1 ? a[0] * x : Double.NaN;
        }

        @Override
        public double grad(double x, double[] a, int k) {
            return x;
        }
    };

    @Test
    public void nanAroundParametersFails() {
        double[] x = {1, 2, 3, 4, 5};
        double[] y = {2, 4, 6, 8, 10};
        for (boolean scaled : new boolean[]{true, false}) {
            double[] a = {1};
            LevenbergMarquardtSolver solver = new LevenbergMarquardtSolver(null, null, null, scaled, 1000, 1e-10);
            OptimizationResult res = solver.fit(x, y, ones(x.length), a, BOUNDED_SLOPE);
            assertEquals("scaled="+scaled, OptimizerState.FAILED, res.getState());
            assertEquals(OptimizerState.FAILED, solver.getState());
            assertEquals(1, a[0], 1e-10);
        }
    }

    @Test
    public void evaluationErrorFails() {
        FitFunction throwing = new Polynomial(1) {
            @Override
            public double val(double x, double[] a) {
                if (a[1] > 1.5) throw new IllegalStateException("slope out of domain");
                return super.val(x, a);
            }
        };
        double[] x = {0, 1, 2, 3, 4};
        double[] y = {1, 3, 5, 7, 9};
        LevenbergMarquardtSolver solver = new LevenbergMarquardtSolver(null, null, null, true, 1000, 1e-10);
        OptimizationResult res = solver.fit(x, y, ones(x.length), new double[]{0, 1}, throwing);
        assertEquals(OptimizerState.FAILED, res.getState());
        assertEquals(OptimizerState.FAILED, solver.getState());
        assertTrue(res.getMessage(), res.getMessage().contains("slope out of domain"));
    }
}
