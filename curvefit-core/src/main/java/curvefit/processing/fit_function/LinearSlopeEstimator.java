package curvefit.processing.fit_function;

import curvefit.data_structure.Dataset;
import curvefit.utils.LinearRegression;

public class LinearSlopeEstimator implements StartPointEstimator {
    @Override
    public double[] initializeFit(Dataset data) {
        double slope = LinearRegression.runThroughOrigin(data.getX(), data.getY());
        return new double[]{Double.isFinite(slope) ? slope : 1};
    }
}
