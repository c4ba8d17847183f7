package curvefit.processing.fit;

import curvefit.data_structure.Dataset;
import curvefit.dummy_plugins.DummyThrowingPlugin;
import curvefit.models.FitModel;
import curvefit.models.ModelCatalog;
import curvefit.output.CurveSink;
import curvefit.output.ParameterTable;
import curvefit.output.TableSink;
import curvefit.plugins.PluginFunction;
import curvefit.processing.exceptions.InsufficientDataException;
import curvefit.processing.exceptions.InvalidConfigurationException;
import curvefit.processing.exceptions.InvalidRangeException;
import curvefit.processing.exceptions.MissingErrorColumnException;
import curvefit.processing.exceptions.PluginMissingSymbolException;
import curvefit.processing.fit_function.Polynomial;
import curvefit.processing.optimizer.FitAlgorithm;
import curvefit.processing.optimizer.FunctionFitterFactory;
import curvefit.processing.weighting.WeightingMethod;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class CurveFitterTest {
    static final Dataset LINE = new Dataset("line", new double[]{0, 1, 2, 3, 4}, new double[]{1, 3, 5, 7, 9});

    static Dataset expDecay(double A, double t, double y0) {
        double[] x = new double[101];
        double[] y = new double[101];
        for (int i = 0; i<x.length; ++i) {
            x[i] = i * 0.1;
            y[i] = A * Math.exp(-x[i] / t) + y0;
        }
        return new Dataset("decay", x, y);
    }

    static FitConfig quiet() {
        return new FitConfig().setWriteParametersToLog(false);
    }

    @Test
    public void simplexFitsLine() {
        FitResult res = new CurveFitter().fit(LINE, ModelCatalog.line(), quiet().setAlgorithm(FitAlgorithm.SIMPLEX));
        assertEquals(FitStatus.CONVERGED, res.getStatus());
        assertTrue(res.isSuccessful());
        assertEquals(1, res.getParameter("A"), 1e-3);
        assertEquals(2, res.getParameter("B"), 1e-3);
        assertEquals(1, res.getRSquared(), 1e-6);
        assertEquals(5, res.getNPoints());
        assertEquals(3, res.getDegreesOfFreedom());
        assertEquals(FitAlgorithm.SIMPLEX, res.getAlgorithm());
    }

    @Test
    public void levenbergMarquardtRecoversExponentialDecay() {
        for (FitAlgorithm algo : new FitAlgorithm[]{FitAlgorithm.SCALED_LEVENBERG_MARQUARDT, FitAlgorithm.UNSCALED_LEVENBERG_MARQUARDT}) {
            FitResult res = new CurveFitter().fit(expDecay(5, 2, 1), ModelCatalog.expDecay(1), quiet().setAlgorithm(algo).setTolerance(1e-10));
            assertEquals(algo.name(), FitStatus.CONVERGED, res.getStatus());
            assertEquals(5, res.getParameter("A1"), 1e-6);
            assertEquals(2, res.getParameter("t1"), 1e-6);
            assertEquals(1, res.getParameter("y0"), 1e-6);
            assertTrue(res.getRSquared() >= 0.999999);
        }
    }

    @Test
    public void tooFewPointsForLine() {
        Dataset d = new Dataset("d", new double[]{1}, new double[]{2});
        try {
            new CurveFitter().fit(d, ModelCatalog.line(), quiet());
            fail("a single point cannot be fitted by a line");
        } catch (InsufficientDataException e) {
            assertEquals(2, e.getRequired());
            assertEquals(1, e.getAvailable());
        }
    }

    @Test
    public void tooFewPointsForExponential() {
        Dataset d = new Dataset("d", new double[]{1, 2}, new double[]{2, 1});
        try {
            new CurveFitter().fit(d, ModelCatalog.expDecay(1), quiet());
            fail("two points cannot be fitted by a 3 parameter model");
        } catch (InsufficientDataException e) {
            assertEquals(3, e.getRequired());
            assertTrue(e.getMessage(), e.getMessage().contains("3"));
        }
    }

    @Test
    public void rangeFiltersPoints() {
        try {
            new CurveFitter().fit(LINE, ModelCatalog.line(), quiet().setRange(3.5, 10));
            fail("only one point in range");
        } catch (InsufficientDataException e) {
            assertEquals(1, e.getAvailable());
        }
        FitResult res = new CurveFitter().fit(LINE, ModelCatalog.line(), quiet().setRange(1, 3));
        assertEquals(3, res.getNPoints());
        FitCurve curve = res.getFitCurve();
        assertEquals(100, curve.size());
        assertEquals(1, curve.getX(0), 0);
        assertEquals(3, curve.getX(99), 0);
        assertEquals(7, curve.getY(99), 1e-6);
    }

    @Test(expected = InvalidRangeException.class)
    public void invalidRange() {
        new CurveFitter().fit(LINE, ModelCatalog.line(), quiet().setRange(3, 1));
    }

    @Test(expected = InvalidConfigurationException.class)
    public void invalidConfiguration() {
        new CurveFitter().fit(LINE, ModelCatalog.line(), quiet().setTolerance(0));
    }

    @Test
    public void inputErrorsAreRaisedBeforeOptimization() {
        AtomicInteger calls = new AtomicInteger();
        FunctionFitterFactory counting = (algo, fixed, lower, upper, maxIt, tol) -> {
            calls.incrementAndGet();
            return FunctionFitterFactory.DEFAULT.create(algo, fixed, lower, upper, maxIt, tol);
        };
        CurveFitter fitter = new CurveFitter(counting);
        try {
            fitter.fit(LINE, ModelCatalog.line(), quiet().setWeighting(WeightingMethod.INSTRUMENTAL));
            fail("instrumental weighting requires errors");
        } catch (MissingErrorColumnException e) {
            assertEquals(0, calls.get());
        }
        fitter.fit(LINE, ModelCatalog.line(), quiet());
        assertEquals(1, calls.get());
    }

    @Test
    public void instrumentalWeighting() {
        Dataset d = new Dataset("d", new double[]{0, 1, 2, 3, 4}, new double[]{1.1, 2.9, 5.2, 6.8, 9.1}, new double[]{0.1, 0.1, 0.1, 0.1, 0.1});
        FitResult weighted = new CurveFitter().fit(d, ModelCatalog.line(), quiet().setWeighting(WeightingMethod.INSTRUMENTAL));
        FitResult unweighted = new CurveFitter().fit(d, ModelCatalog.line(), quiet());
        assertEquals(WeightingMethod.INSTRUMENTAL, weighted.getWeighting());
        // uniform weights do not change parameters but scale chi² and covariance
        assertEquals(unweighted.getParameter("B"), weighted.getParameter("B"), 1e-6);
        assertEquals(unweighted.getChiSquared() * 100, weighted.getChiSquared(), 1e-6);
        assertEquals(unweighted.getError("B") / 10, weighted.getError("B"), 1e-9);
    }

    @Test
    public void fitsAreIdempotent() {
        CurveFitter fitter = new CurveFitter();
        FitConfig config = quiet().setTolerance(1e-8);
        FitResult r1 = fitter.fit(expDecay(5, 2, 1), ModelCatalog.expDecay(1), config);
        FitResult r2 = fitter.fit(expDecay(5, 2, 1), ModelCatalog.expDecay(1), config);
        assertEquals(r1, r2);
    }

    @Test
    public void fixedParameters() {
        FitModel model = ModelCatalog.expDecay(1).withFixed("y0", 1);
        FitResult res = new CurveFitter().fit(expDecay(5, 2, 1), model, quiet().setTolerance(1e-10));
        assertEquals(1, res.getParameter("y0"), 0);
        assertEquals(0, res.getError("y0"), 0);
        assertEquals(5, res.getParameter("A1"), 1e-6);
        assertEquals(101 - 2, res.getDegreesOfFreedom());
    }

    @Test
    public void boundedParameters() {
        FitModel model = ModelCatalog.expDecay(1).withBounds("A1", 0, 4).withInitialGuess("A1", 3);
        for (FitAlgorithm algo : FitAlgorithm.values()) {
            FitResult res = new CurveFitter().fit(expDecay(5, 2, 1), model, quiet().setAlgorithm(algo));
            assertNotEquals(algo.name(), FitStatus.FAILED, res.getStatus());
            assertTrue(algo.name()+": "+res.getParameter("A1"), res.getParameter("A1") <= 4);
        }
    }

    @Test
    public void scaledErrors() {
        Dataset d = new Dataset("d", new double[]{0, 1, 2, 3, 4}, new double[]{1.1, 2.9, 5.2, 6.8, 9.1});
        FitResult raw = new CurveFitter().fit(d, ModelCatalog.line(), quiet());
        FitResult scaled = new CurveFitter().fit(d, ModelCatalog.line(), quiet().setScaleErrors(true));
        double factor = Math.sqrt(raw.getChiSquared() / raw.getDegreesOfFreedom());
        assertEquals(raw.getError("B") * factor, scaled.getError("B"), 1e-12);
        assertEquals(raw.getCovariance()[1][1], scaled.getCovariance()[1][1], 0);
        double[][] limits = scaled.getConfidenceLimits(0.95);
        assertTrue(limits[1][0] < scaled.getParameter("B") && scaled.getParameter("B") < limits[1][1]);
    }

    @Test
    public void pluginWithoutJacobianIsRejectedByLevenbergMarquardt() {
        FitModel noJacobian = new FitModel("NoJacobian", FitModel.Category.PLUGIN, Arrays.asList("a", "b"), new Polynomial(1), null, null, false);
        try {
            new CurveFitter().fit(LINE, noJacobian, quiet());
            fail("gradient-based fit requires a jacobian");
        } catch (PluginMissingSymbolException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("jacobian"));
        }
        FitResult res = new CurveFitter().fit(LINE, noJacobian.withInitialGuesses(0, 1), quiet().setAlgorithm(FitAlgorithm.SIMPLEX));
        assertEquals(2, res.getParameter("b"), 1e-3);
    }

    @Test
    public void userFunction() {
        ModelCatalog catalog = new ModelCatalog();
        FitModel model = catalog.registerUserFunction("Decay", "A*exp(-x/t) + c", "A", "t", "c").withInitialGuesses(4, 1.5, 0.5);
        FitResult res = new CurveFitter().fit(expDecay(5, 2, 1), model, quiet().setTolerance(1e-10));
        assertEquals(FitStatus.CONVERGED, res.getStatus());
        assertEquals(5, res.getParameter("A"), 1e-4);
        assertEquals(2, res.getParameter("t"), 1e-4);
    }

    @Test
    public void iterationLimitIsNotAnError() {
        FitResult res = new CurveFitter().fit(expDecay(5, 2, 1), ModelCatalog.expDecay(1).withInitialGuesses(1, 10, 0), quiet().setMaxIterations(1).setTolerance(1e-12));
        assertEquals(FitStatus.MAX_ITERATIONS_REACHED, res.getStatus());
        assertFalse(res.isSuccessful());
        assertNotNull(res.getFitCurve());
    }

    @Test
    public void sameXAsSource() {
        FitResult res = new CurveFitter().fit(LINE, ModelCatalog.line(), quiet().setSameXAsSource(true));
        assertArrayEquals(LINE.getX(), res.getFitCurve().getX(), 0);
        FitResult noCurve = new CurveFitter().fit(LINE, ModelCatalog.line(), quiet().setGenerateFitCurve(false));
        assertNull(noCurve.getFitCurve());
    }

    @Test
    public void outputs() {
        List<FitCurve> curves = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        List<ParameterTable> tables = new ArrayList<>();
        List<String> covariances = new ArrayList<>();
        List<String> logs = new ArrayList<>();
        CurveFitter fitter = new CurveFitter()
                .setCurveSink(new CurveSink() {
                    @Override
                    public void addFitCurve(FitCurve curve) {
                        curves.add(curve);
                    }

                    @Override
                    public void addLabel(String label) {
                        labels.add(label);
                    }
                })
                .setTableSink(new TableSink() {
                    @Override
                    public void writeParameterTable(ParameterTable table) {
                        tables.add(table);
                    }

                    @Override
                    public void writeCovarianceMatrix(String name, String[] parameterNames, double[][] covariance) {
                        covariances.add(name);
                    }
                })
                .setLogSink(logs::add);
        FitConfig config = new FitConfig().setPasteParametersToPlot(true).setGlobalParameterTable(true).setWriteCovarianceMatrix(true);
        fitter.fit(LINE, ModelCatalog.line(), config);
        fitter.fit(new Dataset("line2", new double[]{0, 1, 2}, new double[]{0, 1, 2}), ModelCatalog.line(), config);
        assertEquals(2, curves.size());
        assertEquals(2, labels.size());
        assertTrue(labels.get(0), labels.get(0).contains("B = "));
        assertEquals(2, logs.size());
        assertTrue(logs.get(0), logs.get(0).contains("R^2"));
        assertEquals(2, covariances.size());
        assertEquals(2, tables.size());
        assertSame(tables.get(0), tables.get(1));
        ParameterTable shared = fitter.getSharedParameterTable();
        assertEquals(2, shared.getRowCount());
        assertEquals(2, shared.getValue(0, "B"), 1e-6);
        assertEquals(1, shared.getValue(1, "B"), 1e-6);

        // other model: a new shared table is created
        fitter.fit(expDecay(5, 2, 1), ModelCatalog.expDecay(1), config);
        assertNotSame(shared, fitter.getSharedParameterTable());
        assertEquals(1, fitter.getSharedParameterTable().getRowCount());

        // per-fit tables
        tables.clear();
        FitConfig perFit = config.duplicate().setGlobalParameterTable(false);
        fitter.fit(LINE, ModelCatalog.line(), perFit);
        fitter.fit(LINE, ModelCatalog.line(), perFit);
        assertEquals(2, tables.size());
        assertNotSame(tables.get(0), tables.get(1));
        assertEquals(1, tables.get(1).getRowCount());
    }

    @Test
    public void evaluationErrorGivesFailedResult() throws NoSuchMethodException {
        PluginFunction function = new PluginFunction("Throwing", null, 1, DummyThrowingPlugin.class.getMethod("eval", double.class, double[].class), null);
        FitModel model = new FitModel("Throwing", FitModel.Category.PLUGIN, Arrays.asList("a"), function, null, null, true);
        double[] x = {0, 1, 2, 3, 4, 5};
        double[] y = new double[x.length];
        for (int i = 0; i<x.length; ++i) y[i] = 2 * x[i] * x[i];
        Dataset data = new Dataset("square", x, y);
        for (FitAlgorithm algo : FitAlgorithm.values()) {
            List<String> logs = new ArrayList<>();
            List<FitCurve> curves = new ArrayList<>();
            CurveFitter fitter = new CurveFitter().setLogSink(logs::add).setCurveSink(new CurveSink() {
                @Override
                public void addFitCurve(FitCurve curve) {
                    curves.add(curve);
                }

                @Override
                public void addLabel(String text) {
                }
            });
            FitResult res = fitter.fit(data, model, new FitConfig().setAlgorithm(algo));
            assertEquals(algo.name(), FitStatus.FAILED, res.getStatus());
            assertFalse(res.isSuccessful());
            assertEquals(1, res.getParameters().length);
            assertEquals(1, logs.size());
            assertTrue(curves.isEmpty());
        }
    }
}
