package curvefit.models;

import curvefit.data_structure.Dataset;
import curvefit.processing.exceptions.ExpressionParseException;
import curvefit.processing.exceptions.ModelException;
import curvefit.processing.exceptions.NameCollisionException;
import curvefit.processing.exceptions.RecursiveDefinitionException;
import curvefit.processing.fit_function.FitFunction;
import curvefit.processing.fit_function.FitFunctionNumericalGradient;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class ModelCatalogTest {
    ModelCatalog catalog;

    @Before
    public void setUp() {
        catalog = new ModelCatalog();
    }

    @Test
    public void builtInModels() {
        for (String name : ModelCatalog.BUILT_IN_NAMES) {
            FitModel m = catalog.getModel(name);
            assertEquals(name, m.getName());
            assertEquals(FitModel.Category.BUILT_IN, m.getCategory());
            assertEquals(m.getNParameters(), m.getFunction().getNParameters());
            assertTrue(name, m.isJacobianAvailable());
        }
        assertEquals(Arrays.asList("A1", "t1", "y0"), ModelCatalog.expDecay(1).parameterNames());
        assertEquals(Arrays.asList("A1", "xc1", "w1", "A2", "xc2", "w2", "y0"), ModelCatalog.gauss(2).parameterNames());
        assertEquals(Arrays.asList("y0", "xc", "w", "A"), ModelCatalog.gaussAmp().parameterNames());
    }

    @Test
    public void polynomialOrderIsClamped() {
        assertEquals(10, ModelCatalog.polynomial(12).getNParameters());
        assertEquals(2, ModelCatalog.polynomial(0).getNParameters());
        assertEquals(4, ModelCatalog.polynomial(3).getNParameters());
    }

    @Test
    public void exponentialSign() {
        FitModel decay = ModelCatalog.expDecay(1), growth = ModelCatalog.expGrowth();
        double[] p = {2, 3, 1};
        assertEquals(2 * Math.exp(-1) + 1, decay.evaluate(3, p), 1e-12);
        assertEquals(2 * Math.exp(1) + 1, growth.evaluate(3, p), 1e-12);
    }

    @Test
    public void analyticGradientsMatchNumericalGradients() {
        double[][] params = {
                {1, 2}, // Line
                {3}, // LinearSlope
                {1, -2, 0.5}, // Polynomial
                {5, 2, 1}, // ExpDecay1
                {5, 2, -1, 7, 1}, // ExpDecay2
                {5, 2, -1, 7, 3, 0.5, 1}, // ExpDecay3
                {2, 4, 1}, // ExpGrowth
                {1, 5, 2, 0.7}, // Boltzmann
                {1, 5, 2, 1.5}, // Logistic
                {1, 2, 1.5, 4}, // GaussAmp
                {10, 2, 1.5, 0.3}, // Gauss
                {10, 2, 1.5, 0.3}, // Lorentz
        };
        double[] xs = {0.5, 1.3, 2.2, 3.7};
        for (int m = 0; m<ModelCatalog.BUILT_IN_NAMES.size(); ++m) {
            String name = ModelCatalog.BUILT_IN_NAMES.get(m);
            FitFunction f = ModelCatalog.getBuiltIn(name).getFunction();
            assertEquals(name, f.getNParameters(), params[m].length);
            for (double x : xs) {
                for (int k = 0; k<params[m].length; ++k) {
                    double num = FitFunctionNumericalGradient.centralDifference(f, x, params[m], k);
                    double an = f.grad(x, params[m], k);
                    assertEquals(name+" x="+x+" k="+k, num, an, 1e-6 * Math.max(1, Math.abs(num)));
                }
            }
        }
    }

    @Test
    public void registerUserFunction() {
        FitModel m = catalog.registerUserFunction("myLine", "a + b*x", "a", "b");
        assertEquals(FitModel.Category.USER_DEFINED, m.getCategory());
        assertEquals(7, m.evaluate(2, new double[]{1, 3}), 1e-12);
        assertSame(m, catalog.getModel("myLine"));
        assertTrue(catalog.getModelNames().contains("myLine"));
        assertFalse(m.getFunction().hasAnalyticGradient());
        assertEquals("d/db = x", 5, m.getFunction().grad(5, new double[]{1, 3}, 1), 1e-6);
    }

    @Test
    public void userFunctionReferencingAnother() {
        catalog.registerUserFunction("base", "a*x", "a");
        FitModel m = catalog.registerUserFunction("shifted", "base + c", "a", "c");
        assertEquals(2 * 3 + 4, m.evaluate(3, new double[]{2, 4}), 1e-12);
    }

    @Test(expected = NameCollisionException.class)
    public void builtInNameCollision() {
        catalog.registerUserFunction("Gauss", "a*x", "a");
    }

    @Test(expected = NameCollisionException.class)
    public void basicFunctionNameCollision() {
        catalog.registerUserFunction("sin", "a*x", "a");
    }

    @Test(expected = RecursiveDefinitionException.class)
    public void directRecursion() {
        catalog.registerUserFunction("f", "a*f", "a");
    }

    @Test
    public void transitiveRecursion() {
        catalog.registerUserFunction("g", "a*x", "a");
        catalog.registerUserFunction("f", "g+1", "a");
        try {
            catalog.registerUserFunction("g", "f*2", "a");
            fail("recursive definition should be rejected");
        } catch (RecursiveDefinitionException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("g -> f -> g"));
        }
        // rejected definition does not replace the previous one
        assertEquals(6, catalog.getModel("g").evaluate(2, new double[]{3}), 1e-12);
    }

    @Test(expected = ExpressionParseException.class)
    public void parseError() {
        catalog.registerUserFunction("h", "a*(x+", "a");
    }

    @Test(expected = ExpressionParseException.class)
    public void duplicateParameters() {
        catalog.registerUserFunction("h", "a*x", "a", "a");
    }

    @Test(expected = ModelException.class)
    public void unknownModel() {
        catalog.getModel("NoSuchModel");
    }

    @Test
    public void parameterSettings() {
        FitModel m = ModelCatalog.expDecay(1).withFixed("y0", 1).withBounds("t1", 0, 100).withInitialGuess("A1", 4);
        assertArrayEquals(new int[]{2}, m.getFixedIndices());
        assertEquals(2, m.minPoints());
        assertArrayEquals(new double[]{Double.NEGATIVE_INFINITY, 0, Double.NEGATIVE_INFINITY}, m.getLowerBounds(), 0);
        double[] x = {0, 1, 2, 3, 4};
        double[] y = new double[x.length];
        for (int i = 0; i<x.length; ++i) y[i] = 3 * Math.exp(-x[i] / 2) + 1;
        double[] init = m.initialGuess(new Dataset("d", x, y));
        assertEquals(4, init[0], 0);
        assertEquals(1, init[2], 0);
        assertTrue(Double.isFinite(init[1]));
        assertNull(ModelCatalog.line().getLowerBounds());
    }

    @Test
    public void estimatorsGiveFiniteGuesses() {
        double[] x = new double[50];
        double[] y = new double[50];
        for (int i = 0; i<x.length; ++i) {
            x[i] = 0.2 * (i+1);
            y[i] = 1 + 4 * Math.exp(-(x[i]-5)*(x[i]-5) / 2);
        }
        Dataset d = new Dataset("d", x, y);
        for (String name : ModelCatalog.BUILT_IN_NAMES) {
            double[] init = ModelCatalog.getBuiltIn(name).initialGuess(d);
            for (double v : init) assertTrue(name+": "+Arrays.toString(init), Double.isFinite(v));
        }
    }
}
