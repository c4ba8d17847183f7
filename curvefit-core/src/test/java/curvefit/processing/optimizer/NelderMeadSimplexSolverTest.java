package curvefit.processing.optimizer;

import curvefit.processing.fit_function.Exponential;
import curvefit.processing.fit_function.Polynomial;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class NelderMeadSimplexSolverTest {
    static final double[] X = {0, 1, 2, 3, 4};
    static final double[] Y = {1, 3, 5, 7, 9};
    static final double[] W = {1, 1, 1, 1, 1};

    @Test
    public void fitsLine() {
        double[] a = {0, 1};
        NelderMeadSimplexSolver solver = new NelderMeadSimplexSolver(null, null, null, 1000, 1e-4);
        OptimizationResult res = solver.fit(X, Y, W, a, new Polynomial(1));
        assertEquals(OptimizerState.CONVERGED, res.getState());
        assertEquals(OptimizerState.CONVERGED, solver.getState());
        assertEquals(1, a[0], 1e-3);
        assertEquals(2, a[1], 1e-3);
    }

    @Test
    public void fixedParameter() {
        double[] a = {1, 1};
        OptimizationResult res = new NelderMeadSimplexSolver(new int[]{0}, null, null, 1000, 1e-8).fit(X, Y, W, a, new Polynomial(1));
        assertEquals(OptimizerState.CONVERGED, res.getState());
        assertEquals(1, a[0], 0);
        assertEquals(2, a[1], 1e-3);
    }

    @Test
    public void bounds() {
        double[] a = {0, 1};
        double[] lower = {Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY};
        double[] upper = {Double.POSITIVE_INFINITY, 1.5};
        new NelderMeadSimplexSolver(null, lower, upper, 1000, 1e-8).fit(X, Y, W, a, new Polynomial(1));
        assertTrue(Arrays.toString(a), a[1] <= 1.5);
    }

    @Test
    public void exponentialDecay() {
        double[] x = new double[50];
        double[] y = new double[50];
        double[] w = new double[50];
        for (int i = 0; i<x.length; ++i) {
            x[i] = 0.2 * i;
            y[i] = 5 * Math.exp(-x[i] / 2) + 1;
            w[i] = 1;
        }
        double[] a = {4, 1.5, 0.8};
        OptimizationResult res = new NelderMeadSimplexSolver(null, null, null, 5000, 1e-10).fit(x, y, w, a, new Exponential(1, false));
        assertNotEquals(OptimizerState.FAILED, res.getState());
        assertEquals(5, a[0], 1e-2);
        assertEquals(2, a[1], 1e-2);
        assertEquals(1, a[2], 1e-2);
    }

    @Test
    public void iterationCap() {
        double[] a = {0, 1};
        OptimizationResult res = new NelderMeadSimplexSolver(null, null, null, 3, 1e-12).fit(X, Y, W, a, new Polynomial(1));
        assertEquals(OptimizerState.MAX_ITERATIONS_REACHED, res.getState());
        assertEquals(3, res.getIterations());
    }

    @Test
    public void invalidInitialParameters() {
        double[] a = {0, 1};
        double[] lower = {1, Double.NEGATIVE_INFINITY};
        OptimizationResult res = new NelderMeadSimplexSolver(null, lower, null, 100, 1e-4).fit(X, Y, W, a, new Polynomial(1));
        assertEquals(OptimizerState.FAILED, res.getState());
    }
}
