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
import curvefit.processing.exceptions.InvalidConfigurationException;
import curvefit.processing.optimizer.FitAlgorithm;
import curvefit.processing.weighting.WeightingData;
import curvefit.processing.weighting.WeightingMethod;
import curvefit.utils.JSONSerializable;
import curvefit.utils.JSONUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Options of a fit: algorithm and its termination criteria, weighting, fitted range and outputs.
 * @author Jean Ollion
 */
public class FitConfig implements JSONSerializable {
    public static final int MAX_ITERATIONS_LIMIT = 1000000;
    public FitAlgorithm algorithm = FitAlgorithm.SCALED_LEVENBERG_MARQUARDT;
    public double tolerance = 1e-4;
    public int maxIterations = 1000;
    public WeightingMethod weighting = WeightingMethod.NONE;
    public WeightingData weightingData;
    public DataRange range;
    public boolean generateFitCurve = true;
    public int outputPoints = 100;
    public boolean sameXAsSource = false;
    public int significantDigits = 6;
    public boolean scaleErrors = false;
    public boolean writeParametersToLog = true;
    public boolean pasteParametersToPlot = false;
    public boolean globalParameterTable = false;
    public boolean writeCovarianceMatrix = false;
    public double confidenceLevel = 0.95;

    /**
     * Default configuration:
     * <ul>
     *     <li>Scaled Levenberg-Marquardt, tolerance 1e-4, at most 1000 iterations</li>
     *     <li>no weighting, full range</li>
     *     <li>fit curve of 100 uniformly spaced points, parameters written to the log with 6 significant digits</li>
     * </ul>
     */
    public FitConfig() { }

    public FitConfig duplicate() {
        return new FitConfig()
                .setAlgorithm(algorithm).setTolerance(tolerance).setMaxIterations(maxIterations)
                .setWeighting(weighting, weightingData)
                .setRange(range==null ? null : new DataRange(range.getFrom(), range.getTo()))
                .setGenerateFitCurve(generateFitCurve).setOutputPoints(outputPoints).setSameXAsSource(sameXAsSource)
                .setSignificantDigits(significantDigits).setScaleErrors(scaleErrors)
                .setWriteParametersToLog(writeParametersToLog).setPasteParametersToPlot(pasteParametersToPlot)
                .setGlobalParameterTable(globalParameterTable).setWriteCovarianceMatrix(writeCovarianceMatrix)
                .setConfidenceLevel(confidenceLevel);
    }

    /**
     * @throws InvalidConfigurationException if an option is out of its range of validity
     */
    public FitConfig validate() {
        if (algorithm==null) throw new InvalidConfigurationException("No fit algorithm selected");
        if (!(tolerance>0 && tolerance<1)) throw new InvalidConfigurationException("Tolerance should be in ]0; 1[, got: "+tolerance);
        if (maxIterations<1 || maxIterations>MAX_ITERATIONS_LIMIT) throw new InvalidConfigurationException("Maximum number of iterations should be in [1; "+MAX_ITERATIONS_LIMIT+"], got: "+maxIterations);
        if (generateFitCurve && !sameXAsSource && outputPoints<2) throw new InvalidConfigurationException("Fit curve needs at least 2 points, got: "+outputPoints);
        if (significantDigits<1 || significantDigits>16) throw new InvalidConfigurationException("Significant digits should be in [1; 16], got: "+significantDigits);
        if (!(confidenceLevel>0 && confidenceLevel<1)) throw new InvalidConfigurationException("Confidence level should be in ]0; 1[, got: "+confidenceLevel);
        return this;
    }

    public FitConfig setAlgorithm(FitAlgorithm algorithm) {
        this.algorithm = algorithm;
        return this;
    }

    public FitConfig setTolerance(double tolerance) {
        this.tolerance = tolerance;
        return this;
    }

    public FitConfig setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
        return this;
    }

    public FitConfig setWeighting(WeightingMethod weighting) {
        this.weighting = weighting;
        return this;
    }

    /**
     * @param weightingData external standard deviations, used by {@link WeightingMethod#ARBITRARY_DATASET}
     */
    public FitConfig setWeighting(WeightingMethod weighting, WeightingData weightingData) {
        this.weighting = weighting;
        this.weightingData = weightingData;
        return this;
    }

    /**
     * @param range fitted range of x values, null for the full range
     */
    public FitConfig setRange(DataRange range) {
        this.range = range;
        return this;
    }

    public FitConfig setRange(double from, double to) {
        return setRange(new DataRange(from, to));
    }

    public FitConfig setGenerateFitCurve(boolean generateFitCurve) {
        this.generateFitCurve = generateFitCurve;
        return this;
    }

    public FitConfig setOutputPoints(int outputPoints) {
        this.outputPoints = outputPoints;
        return this;
    }

    public FitConfig setSameXAsSource(boolean sameXAsSource) {
        this.sameXAsSource = sameXAsSource;
        return this;
    }

    public FitConfig setSignificantDigits(int significantDigits) {
        this.significantDigits = significantDigits;
        return this;
    }

    /**
     * @param scaleErrors whether parameter errors are multiplied by sqrt(chi²/dof)
     */
    public FitConfig setScaleErrors(boolean scaleErrors) {
        this.scaleErrors = scaleErrors;
        return this;
    }

    public FitConfig setWriteParametersToLog(boolean writeParametersToLog) {
        this.writeParametersToLog = writeParametersToLog;
        return this;
    }

    public FitConfig setPasteParametersToPlot(boolean pasteParametersToPlot) {
        this.pasteParametersToPlot = pasteParametersToPlot;
        return this;
    }

    /**
     * @param globalParameterTable if true, parameters of successive fits are appended to a single table. Otherwise a new table is created at each fit
     */
    public FitConfig setGlobalParameterTable(boolean globalParameterTable) {
        this.globalParameterTable = globalParameterTable;
        return this;
    }

    public FitConfig setWriteCovarianceMatrix(boolean writeCovarianceMatrix) {
        this.writeCovarianceMatrix = writeCovarianceMatrix;
        return this;
    }

    public FitConfig setConfidenceLevel(double confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
        return this;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("algorithm", algorithm.name());
        res.put("tolerance", tolerance);
        res.put("maxIterations", maxIterations);
        res.put("weighting", weighting.name());
        if (weightingData!=null) {
            JSONObject wd = new JSONObject();
            wd.put("name", weightingData.getName());
            wd.put("values", JSONUtils.toJSONArray(weightingData.getValues()));
            res.put("weightingData", wd);
        }
        if (range!=null) res.put("range", range.toJSONEntry());
        res.put("generateFitCurve", generateFitCurve);
        res.put("outputPoints", outputPoints);
        res.put("sameXAsSource", sameXAsSource);
        res.put("significantDigits", significantDigits);
        res.put("scaleErrors", scaleErrors);
        res.put("writeParametersToLog", writeParametersToLog);
        res.put("pasteParametersToPlot", pasteParametersToPlot);
        res.put("globalParameterTable", globalParameterTable);
        res.put("writeCovarianceMatrix", writeCovarianceMatrix);
        res.put("confidenceLevel", confidenceLevel);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        JSONObject json = (JSONObject)jsonEntry;
        if (json.containsKey("algorithm")) algorithm = FitAlgorithm.get((String)json.get("algorithm"));
        if (json.containsKey("tolerance")) tolerance = ((Number)json.get("tolerance")).doubleValue();
        if (json.containsKey("maxIterations")) maxIterations = ((Number)json.get("maxIterations")).intValue();
        if (json.containsKey("weighting")) weighting = WeightingMethod.get((String)json.get("weighting"));
        if (json.containsKey("weightingData")) {
            JSONObject wd = (JSONObject)json.get("weightingData");
            weightingData = new WeightingData((String)wd.get("name"), JSONUtils.fromDoubleArray((JSONArray)wd.get("values")));
        } else weightingData = null;
        if (json.containsKey("range")) {
            range = DataRange.full();
            range.initFromJSONEntry(json.get("range"));
        } else range = null;
        if (json.containsKey("generateFitCurve")) generateFitCurve = (Boolean)json.get("generateFitCurve");
        if (json.containsKey("outputPoints")) outputPoints = ((Number)json.get("outputPoints")).intValue();
        if (json.containsKey("sameXAsSource")) sameXAsSource = (Boolean)json.get("sameXAsSource");
        if (json.containsKey("significantDigits")) significantDigits = ((Number)json.get("significantDigits")).intValue();
        if (json.containsKey("scaleErrors")) scaleErrors = (Boolean)json.get("scaleErrors");
        if (json.containsKey("writeParametersToLog")) writeParametersToLog = (Boolean)json.get("writeParametersToLog");
        if (json.containsKey("pasteParametersToPlot")) pasteParametersToPlot = (Boolean)json.get("pasteParametersToPlot");
        if (json.containsKey("globalParameterTable")) globalParameterTable = (Boolean)json.get("globalParameterTable");
        if (json.containsKey("writeCovarianceMatrix")) writeCovarianceMatrix = (Boolean)json.get("writeCovarianceMatrix");
        if (json.containsKey("confidenceLevel")) confidenceLevel = ((Number)json.get("confidenceLevel")).doubleValue();
    }

    @Override
    public String toString() {
        return "FitConfig: "+toJSONEntry().toJSONString();
    }
}
