package curvefit.output;

import curvefit.processing.fit.FitCurve;

/**
 * Receives the curves and labels produced by fits, typically a plot
 */
public interface CurveSink {
    void addFitCurve(FitCurve curve);

    /**
     * @param text parameters of a fit, to be pasted onto the plot
     */
    void addLabel(String text);
}
