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

import curvefit.processing.optimizer.FitAlgorithm;
import curvefit.processing.weighting.WeightingMethod;
import curvefit.utils.ArrayUtil;
import curvefit.utils.JSONUtils;
import org.apache.commons.math3.distribution.TDistribution;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a fit: fitted parameters with their standard errors and covariance, goodness of fit statistics,
 * termination status, generated fit curve and per-peak parameters for multi-peak models.
 * Immutable
 * @author Jean Ollion
 */
public class FitResult {
    final String modelName;
    final String datasetName;
    final FitAlgorithm algorithm;
    final WeightingMethod weighting;
    final String[] parameterNames;
    final double[] parameters, errors;
    final double[][] covariance;
    final FitStatus status;
    final String statusMessage;
    final int iterations, nPoints, degreesOfFreedom;
    final double chiSquared, rSquared;
    final FitCurve fitCurve;
    final List<PeakParameters> peaks;

    FitResult(String modelName, String datasetName, FitAlgorithm algorithm, WeightingMethod weighting, String[] parameterNames, double[] parameters, double[] errors, double[][] covariance, FitStatus status, String statusMessage, int iterations, int nPoints, int degreesOfFreedom, double chiSquared, double rSquared, FitCurve fitCurve, List<PeakParameters> peaks) {
        this.modelName = modelName;
        this.datasetName = datasetName;
        this.algorithm = algorithm;
        this.weighting = weighting;
        this.parameterNames = parameterNames.clone();
        this.parameters = ArrayUtil.duplicate(parameters);
        this.errors = ArrayUtil.duplicate(errors);
        this.covariance = ArrayUtil.duplicate(covariance);
        this.status = status;
        this.statusMessage = statusMessage==null ? "" : statusMessage;
        this.iterations = iterations;
        this.nPoints = nPoints;
        this.degreesOfFreedom = degreesOfFreedom;
        this.chiSquared = chiSquared;
        this.rSquared = rSquared;
        this.fitCurve = fitCurve;
        this.peaks = peaks==null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(peaks));
    }

    public String getModelName() {
        return modelName;
    }

    public String getDatasetName() {
        return datasetName;
    }

    public FitAlgorithm getAlgorithm() {
        return algorithm;
    }

    public WeightingMethod getWeighting() {
        return weighting;
    }

    public int getNParameters() {
        return parameters.length;
    }

    public String[] getParameterNames() {
        return parameterNames.clone();
    }

    public double[] getParameters() {
        return ArrayUtil.duplicate(parameters);
    }

    public double getParameter(String name) {
        return parameters[indexOf(name)];
    }

    public double[] getErrors() {
        return ArrayUtil.duplicate(errors);
    }

    public double getError(String name) {
        return errors[indexOf(name)];
    }

    private int indexOf(String name) {
        for (int i = 0; i<parameterNames.length; ++i) if (parameterNames[i].equals(name)) return i;
        throw new IllegalArgumentException("No parameter named: "+name+" in model "+modelName);
    }

    /**
     * @return covariance matrix of the parameters (NaN values if it could not be computed)
     */
    public double[][] getCovariance() {
        return ArrayUtil.duplicate(covariance);
    }

    public FitStatus getStatus() {
        return status;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public int getIterations() {
        return iterations;
    }

    /**
     * @return number of fitted observations
     */
    public int getNPoints() {
        return nPoints;
    }

    public int getDegreesOfFreedom() {
        return degreesOfFreedom;
    }

    public double getChiSquared() {
        return chiSquared;
    }

    public double getReducedChiSquared() {
        return degreesOfFreedom>0 ? chiSquared / degreesOfFreedom : Double.NaN;
    }

    public double getRSquared() {
        return rSquared;
    }

    public double getAdjustedRSquared() {
        if (degreesOfFreedom<=0) return Double.NaN;
        return 1 - (1 - rSquared) * (nPoints - 1) / degreesOfFreedom;
    }

    /**
     * @return root mean square of weighted residuals
     */
    public double getRms() {
        return nPoints>0 ? Math.sqrt(chiSquared / nPoints) : Double.NaN;
    }

    /**
     * @return generated fit curve, null if not requested
     */
    public FitCurve getFitCurve() {
        return fitCurve;
    }

    /**
     * @return fitted peaks (empty list if the model is not a sum of peaks)
     */
    public List<PeakParameters> getPeaks() {
        return peaks;
    }

    /**
     * Confidence limits of parameters, using the Student distribution with {@link #getDegreesOfFreedom()} degrees of freedom
     * @param confidenceLevel in ]0; 1[
     * @return array of [lower limit, upper limit] for each parameter, NaN if there is no degree of freedom
     */
    public double[][] getConfidenceLimits(double confidenceLevel) {
        if (!(confidenceLevel>0 && confidenceLevel<1)) throw new IllegalArgumentException("Confidence level should be in ]0; 1[");
        double[][] res = new double[parameters.length][2];
        double t = degreesOfFreedom>0 ? new TDistribution(degreesOfFreedom).inverseCumulativeProbability((1 + confidenceLevel) / 2) : Double.NaN;
        for (int i = 0; i<parameters.length; ++i) {
            res[i][0] = parameters[i] - t * errors[i];
            res[i][1] = parameters[i] + t * errors[i];
        }
        return res;
    }

    public boolean isSuccessful() {
        return status!=FitStatus.FAILED;
    }

    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("model", modelName);
        res.put("dataset", datasetName);
        res.put("algorithm", algorithm.name());
        res.put("weighting", weighting.name());
        res.put("parameterNames", JSONUtils.toJSONArray(parameterNames));
        res.put("parameters", JSONUtils.toJSONArray(parameters));
        res.put("errors", JSONUtils.toJSONArray(errors));
        res.put("covariance", JSONUtils.toJSONArray(covariance));
        res.put("status", status.name());
        res.put("statusMessage", statusMessage);
        res.put("iterations", iterations);
        res.put("nPoints", nPoints);
        res.put("dof", degreesOfFreedom);
        res.put("chi2", JSONUtils.toJSONNumber(chiSquared));
        res.put("r2", JSONUtils.toJSONNumber(rSquared));
        if (!peaks.isEmpty()) {
            JSONArray p = new JSONArray();
            for (PeakParameters peak : peaks) p.add(peak.toJSONEntry());
            res.put("peaks", p);
        }
        return res;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FitResult)) return false;
        FitResult other = (FitResult) o;
        return iterations == other.iterations && nPoints == other.nPoints && degreesOfFreedom == other.degreesOfFreedom
                && Double.compare(chiSquared, other.chiSquared) == 0 && Double.compare(rSquared, other.rSquared) == 0
                && modelName.equals(other.modelName) && status == other.status && statusMessage.equals(other.statusMessage)
                && Arrays.equals(parameterNames, other.parameterNames) && Arrays.equals(parameters, other.parameters)
                && Arrays.equals(errors, other.errors) && Arrays.deepEquals(covariance, other.covariance);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(parameters) + Double.hashCode(chiSquared);
    }

    @Override
    public String toString() {
        return "FitResult: "+modelName+" on "+datasetName+" "+status+" params: "+Arrays.toString(parameters)+" chi²="+chiSquared+" R²="+rSquared;
    }
}
