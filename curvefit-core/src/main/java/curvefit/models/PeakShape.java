package curvefit.models;

import curvefit.processing.fit_function.GaussianPeak;
import curvefit.processing.fit_function.LorentzianPeak;
import curvefit.processing.fit_function.PeakFunction;

/**
 * Shape of the peaks of a multi-peak model
 */
public enum PeakShape {
    GAUSS(ModelCatalog.GAUSS), LORENTZ(ModelCatalog.LORENTZ);

    public final String modelName;

    PeakShape(String modelName) {
        this.modelName = modelName;
    }

    public PeakFunction createFunction() {
        return this==GAUSS ? new GaussianPeak() : new LorentzianPeak();
    }

    /**
     * @return model made of {@param nPeaks} peaks of this shape plus an offset
     */
    public FitModel createModel(int nPeaks) {
        return this==GAUSS ? ModelCatalog.gauss(nPeaks) : ModelCatalog.lorentz(nPeaks);
    }
}
