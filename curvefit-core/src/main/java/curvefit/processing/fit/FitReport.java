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
import curvefit.models.FitModel;
import curvefit.utils.Utils;

import java.util.Arrays;

/**
 * Text outputs of a fit: report written to the result log and parameter label pasted onto the plot
 * @author Jean Ollion
 */
public class FitReport {
    static final String SEPARATOR = "---------------------------------------------------------------------------------------";

    /**
     * @param result fit result
     * @param model fitted model, with the initial values of parameters
     * @param initialValues initial parameters actually used
     * @param range fitted range, null for full range
     * @param significantDigits number of significant digits of values
     * @param scaledErrors whether errors were scaled with sqrt(chi²/dof)
     * @param confidenceLevel level of displayed confidence limits
     */
    public static String report(FitResult result, FitModel model, double[] initialValues, DataRange range, int significantDigits, boolean scaledErrors, double confidenceLevel) {
        StringBuilder sb = new StringBuilder();
        sb.append(result.getAlgorithm().displayName).append(" fit of dataset: ").append(result.getDatasetName())
                .append(", using function: ").append(model.getFormula()).append('\n');
        sb.append("Weighting Method: ").append(result.getWeighting().displayName).append('\n');
        if (range!=null && !range.isFull()) sb.append("From x = ").append(Utils.format(range.getFrom(), significantDigits)).append(" to x = ").append(Utils.format(range.getTo(), significantDigits)).append('\n');
        String[] names = result.getParameterNames();
        int width = Math.max(12, Arrays.stream(names).mapToInt(String::length).max().orElse(0) + 2);
        for (int i = 0; i<names.length; ++i) {
            sb.append(names[i]).append(" (init) = ").append(Utils.format(initialValues[i], significantDigits));
            if (model.getParameters().get(i).isFixed()) sb.append(" (fixed)");
            sb.append('\n');
        }
        sb.append(SEPARATOR).append('\n');
        int valueWidth = significantDigits + 10;
        double[][] limits = result.getConfidenceLimits(confidenceLevel);
        String level = Utils.format(confidenceLevel * 100, 3)+"%";
        sb.append(Utils.padRight("Parameter", width)).append(Utils.padRight("Value", valueWidth)).append(Utils.padRight("Error", valueWidth))
                .append(Utils.padRight("Lower "+level, valueWidth)).append("Upper ").append(level).append('\n');
        double[] values = result.getParameters(), errors = result.getErrors();
        for (int i = 0; i<names.length; ++i) {
            sb.append(Utils.padRight(names[i], width))
                    .append(Utils.padRight(Utils.format(values[i], significantDigits), valueWidth))
                    .append(Utils.padRight(Utils.format(errors[i], significantDigits), valueWidth))
                    .append(Utils.padRight(Utils.format(limits[i][0], significantDigits), valueWidth))
                    .append(Utils.format(limits[i][1], significantDigits)).append('\n');
        }
        sb.append(SEPARATOR).append('\n');
        sb.append("Chi^2 = ").append(Utils.format(result.getChiSquared(), significantDigits)).append('\n');
        sb.append("Reduced Chi^2 = ").append(Utils.format(result.getReducedChiSquared(), significantDigits)).append('\n');
        sb.append("Degrees of freedom = ").append(result.getDegreesOfFreedom()).append('\n');
        sb.append("R^2 = ").append(Utils.format(result.getRSquared(), significantDigits)).append('\n');
        sb.append("Adjusted R^2 = ").append(Utils.format(result.getAdjustedRSquared(), significantDigits)).append('\n');
        sb.append("RMS = ").append(Utils.format(result.getRms(), significantDigits)).append('\n');
        if (scaledErrors) sb.append("Errors were scaled with sqrt(Chi^2/doF)").append('\n');
        if (!result.getPeaks().isEmpty()) {
            sb.append(SEPARATOR).append('\n');
            sb.append(Utils.padRight("Peak", 6)).append(Utils.padRight("Center", valueWidth)).append(Utils.padRight("Width", valueWidth))
                    .append(Utils.padRight("Height", valueWidth)).append("Area").append('\n');
            for (PeakParameters p : result.getPeaks()) {
                sb.append(Utils.padRight(String.valueOf(p.getIndex()), 6))
                        .append(Utils.padRight(Utils.format(p.getCenter(), significantDigits), valueWidth))
                        .append(Utils.padRight(Utils.format(p.getWidth(), significantDigits), valueWidth))
                        .append(Utils.padRight(Utils.format(p.getHeight(), significantDigits), valueWidth))
                        .append(Utils.format(p.getArea(), significantDigits)).append('\n');
            }
        }
        sb.append("Iterations = ").append(result.getIterations()).append('\n');
        sb.append("Status = ").append(status(result)).append('\n');
        sb.append(SEPARATOR).append('\n');
        return sb.toString();
    }

    static String status(FitResult result) {
        switch (result.getStatus()) {
            case CONVERGED: return "success";
            case MAX_ITERATIONS_REACHED: return "iteration limit reached: "+result.getStatusMessage();
            case FAILED:
            default: return "failed: "+result.getStatusMessage();
        }
    }

    /**
     * @return one line per parameter: name = value +/- error
     */
    public static String label(FitResult result, int significantDigits) {
        StringBuilder sb = new StringBuilder();
        sb.append(result.getModelName()).append(" fit of ").append(result.getDatasetName());
        String[] names = result.getParameterNames();
        double[] values = result.getParameters(), errors = result.getErrors();
        for (int i = 0; i<names.length; ++i) {
            sb.append('\n').append(names[i]).append(" = ").append(Utils.format(values[i], significantDigits))
                    .append(" +/- ").append(Utils.format(errors[i], significantDigits));
        }
        sb.append("\nR^2 = ").append(Utils.format(result.getRSquared(), significantDigits));
        return sb.toString();
    }
}
