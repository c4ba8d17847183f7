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
package curvefit.processing.fit;

import curvefit.data_structure.DataRange;
import curvefit.data_structure.Dataset;
import curvefit.models.FitModel;
import curvefit.output.CurveSink;
import curvefit.output.LogSink;
import curvefit.output.ParameterTable;
import curvefit.output.TableSink;
import curvefit.processing.exceptions.InsufficientDataException;
import curvefit.processing.exceptions.PluginMissingSymbolException;
import curvefit.processing.fit_function.FitFunction;
import curvefit.processing.fit_function.MultipleIdenticalFitFunction;
import curvefit.processing.fit_function.PeakFunction;
import curvefit.processing.optimizer.FunctionFitter;
import curvefit.processing.optimizer.FunctionFitterFactory;
import curvefit.processing.optimizer.OptimizationResult;
import curvefit.processing.optimizer.WeightedLeastSquares;
import curvefit.processing.weighting.Weighting;
import curvefit.utils.ArrayUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fits a model on a dataset: filters the dataset, computes weights, estimates initial parameters, runs the selected
 * optimization algorithm and packages the result with its statistics. Results are then sent to the configured outputs.
 * <p>
 * Input errors ({@link curvefit.processing.exceptions.InputException}) and model errors ({@link curvefit.processing.exceptions.ModelException})
 * are thrown before the optimizer runs. Convergence problems and errors raised while evaluating the model during the fit do not throw:
 * they are reported by {@link FitResult#getStatus()}.
 * <p>
 * A fitter can be used concurrently: each call builds its own solver. The shared parameter table is the only state kept between fits.
 * @author Jean Ollion
 */
public class CurveFitter {
    public static final Logger logger = LoggerFactory.getLogger(CurveFitter.class);
    final FunctionFitterFactory fitterFactory;
    CurveSink curveSink;
    TableSink tableSink;
    LogSink logSink;
    ParameterTable sharedTable;
    final AtomicInteger tableCount = new AtomicInteger(0);

    public CurveFitter() {
        this(FunctionFitterFactory.DEFAULT);
    }

    /**
     * @param fitterFactory creates the solver of each fit
     */
    public CurveFitter(FunctionFitterFactory fitterFactory) {
        this.fitterFactory = fitterFactory;
    }

    public CurveFitter setCurveSink(CurveSink curveSink) {
        this.curveSink = curveSink;
        return this;
    }

    public CurveFitter setTableSink(TableSink tableSink) {
        this.tableSink = tableSink;
        return this;
    }

    public CurveFitter setLogSink(LogSink logSink) {
        this.logSink = logSink;
        return this;
    }

    /**
     * @return table accumulating parameters of fits performed with {@link FitConfig#globalParameterTable}, null if there is none
     */
    public synchronized ParameterTable getSharedParameterTable() {
        return sharedTable;
    }

    public synchronized void resetSharedParameterTable() {
        sharedTable = null;
    }

    /**
     *
     * @param dataset observations
     * @param model fitted model
     * @param config fit options
     * @return fit result, in a terminal state
     * @throws curvefit.processing.exceptions.InvalidConfigurationException if {@param config} is not valid
     * @throws curvefit.processing.exceptions.InvalidRangeException if the range of {@param config} is not valid
     * @throws InsufficientDataException if less than {@link FitModel#minPoints()} points lie in the fitted range
     * @throws curvefit.processing.exceptions.MissingErrorColumnException if the weighting method requires error data that is missing
     * @throws curvefit.processing.exceptions.RowCountMismatchException if error data has not enough rows
     * @throws curvefit.processing.exceptions.InvalidWeightException if error data contains invalid values
     * @throws PluginMissingSymbolException if a gradient-based algorithm is selected and the model has no jacobian
     */
    public FitResult fit(Dataset dataset, FitModel model, FitConfig config) {
        if (dataset==null || model==null || config==null) throw new IllegalArgumentException("Dataset, model and configuration are required");
        config.validate();
        DataRange range = config.range;
        if (range!=null) range.validate();
        Dataset data = dataset.filter(range);
        int minPoints = Math.max(1, model.minPoints());
        if (data.size() < minPoints) throw new InsufficientDataException(minPoints, data.size());
        double[] weights = Weighting.computeWeights(data, config.weighting, config.weightingData);
        if (config.algorithm.requiresJacobian() && !model.isJacobianAvailable()) {
            throw new PluginMissingSymbolException(model.getName(), "jacobian", config.algorithm.displayName+" requires a jacobian: provide a jacobian method or set NUMERIC_JACOBIAN");
        }
        double[] x = data.getX(), y = data.getY();
        FitFunction function = model.getFunction();
        double[] init = model.initialGuess(data);
        if (init.length!=model.getNParameters()) throw new IllegalStateException("Initial guess of "+model.getName()+" has "+init.length+" values for "+model.getNParameters()+" parameters");
        double[] params = init.clone();
        int[] fixed = model.getFixedIndices();
        logger.debug("fit of {} ({} points) with {}: initial parameters: {}", data.getName(), data.size(), model.getName(), Arrays.toString(init));
        FunctionFitter fitter = fitterFactory.create(config.algorithm, fixed, model.getLowerBounds(), model.getUpperBounds(), config.maxIterations, config.tolerance);
        OptimizationResult opt = fitter.fit(x, y, weights, params, function);

        // statistics
        int dof = data.size() - model.getNFreeParameters();
        FitStatus status = FitStatus.fromOptimizerState(opt.getState());
        String message = opt.getMessage();
        double chi2, rSquared;
        double[][] covariance;
        FitCurve curve;
        try {
            chi2 = WeightedLeastSquares.chiSquared(x, y, weights, params, function);
            rSquared = rSquared(y, weights, chi2);
            covariance = WeightedLeastSquares.covariance(x, y, weights, params, function, fixed);
            if (covariance==null) logger.warn("fit of {} with {}: covariance matrix is singular, parameter errors cannot be computed", data.getName(), model.getName());
            curve = config.generateFitCurve ? generateCurve(data, model, params, config) : null;
        } catch (RuntimeException e) { // evaluation error at the final parameters
            logger.warn("fit of {} with {}: statistics cannot be computed: {}", data.getName(), model.getName(), e.getMessage());
            status = FitStatus.FAILED;
            if (message.isEmpty()) message = "evaluation error: "+e.getMessage();
            chi2 = Double.NaN;
            rSquared = Double.NaN;
            covariance = null;
            curve = null;
        }
        if (covariance==null) {
            covariance = new double[params.length][params.length];
            for (double[] row : covariance) Arrays.fill(row, Double.NaN);
        }
        double[] errors = new double[params.length];
        double errorScale = config.scaleErrors && dof>0 ? Math.sqrt(chi2 / dof) : 1;
        for (int i = 0; i<params.length; ++i) errors[i] = Math.sqrt(covariance[i][i]) * errorScale;
        FitResult result = new FitResult(model.getName(), dataset.getName(), config.algorithm, config.weighting, model.parameterNames().toArray(new String[0]),
                params, errors, covariance, status, message, opt.getIterations(),
                data.size(), dof, chi2, rSquared, curve, getPeaks(function, params));
        if (result.getStatus()==FitStatus.FAILED) logger.warn("fit of {} with {} failed: {}", data.getName(), model.getName(), message);
        else logger.info("fit of {} with {}: {} after {} iterations, chi²={}, R²={}", data.getName(), model.getName(), result.getStatus(), result.getIterations(), chi2, rSquared);
        output(result, model, init, config);
        return result;
    }

    /**
     * R² = 1 - SSres / SStot with weighted sums of squares
     */
    static double rSquared(double[] y, double[] weights, double chi2) {
        double mean = ArrayUtil.weightedMean(y, weights);
        double ssTot = 0;
        for (int i = 0; i<y.length; ++i) ssTot += weights[i] * (y[i] - mean) * (y[i] - mean);
        if (ssTot>0) return 1 - chi2 / ssTot;
        return chi2==0 ? 1 : Double.NaN;
    }

    static FitCurve generateCurve(Dataset data, FitModel model, double[] params, FitConfig config) {
        double[] x;
        if (config.sameXAsSource) x = data.getX();
        else x = ArrayUtil.linspace(data.xMin(), data.xMax(), config.outputPoints);
        double[] y = new double[x.length];
        for (int i = 0; i<x.length; ++i) y[i] = model.evaluate(x[i], params);
        return new FitCurve(model.getName()+"Fit_"+data.getName(), x, y);
    }

    static List<PeakParameters> getPeaks(FitFunction function, double[] params) {
        List<PeakParameters> res = new ArrayList<>();
        if (!(function instanceof MultipleIdenticalFitFunction)) return res;
        MultipleIdenticalFitFunction multi = (MultipleIdenticalFitFunction)function;
        if (!(multi.getFunction() instanceof PeakFunction)) return res;
        PeakFunction peak = (PeakFunction)multi.getFunction();
        for (int i = 0; i<multi.getNFunctions(); ++i) {
            double[] p = multi.getFunctionParameters(params, i);
            double area = p[PeakFunction.AREA], width = p[PeakFunction.WIDTH];
            res.add(new PeakParameters(i+1, p[PeakFunction.CENTER], width, peak.getHeight(area, width), area));
        }
        return res;
    }

    void output(FitResult result, FitModel model, double[] init, FitConfig config) {
        if (config.writeParametersToLog) {
            String report = FitReport.report(result, model, init, config.range, config.significantDigits, config.scaleErrors, config.confidenceLevel);
            if (logSink!=null) logSink.log(report);
            else logger.info("\n{}", report);
        }
        if (result.getStatus()==FitStatus.FAILED) return;
        if (curveSink!=null) {
            if (result.getFitCurve()!=null) curveSink.addFitCurve(result.getFitCurve());
            if (config.pasteParametersToPlot) curveSink.addLabel(FitReport.label(result, config.significantDigits));
        }
        if (tableSink!=null) {
            ParameterTable table;
            if (config.globalParameterTable) {
                synchronized (this) {
                    if (sharedTable==null || !sharedTable.accepts(result)) {
                        if (sharedTable!=null) logger.info("parameters of {} do not match shared table {}: a new table is created", result.getModelName(), sharedTable.getName());
                        sharedTable = new ParameterTable("FitParameters"+tableCount.incrementAndGet(), result.getParameterNames());
                    }
                    table = sharedTable.addRow(result);
                }
            } else {
                table = new ParameterTable(result.getModelName()+"Parameters"+tableCount.incrementAndGet(), result.getParameterNames()).addRow(result);
            }
            tableSink.writeParameterTable(table);
            if (config.writeCovarianceMatrix) tableSink.writeCovarianceMatrix("Covariance"+result.getModelName()+"_"+result.getDatasetName(), result.getParameterNames(), result.getCovariance());
        }
    }
}
