package curvefit.processing.fit_function;

/**
 * Line through the origin: f(x) = A × x
 */
public class LinearSlope implements FitFunction {
    @Override
    public int getNParameters() {
        return 1;
    }

    @Override
    public double val(double x, double[] a) {
        return a[0] * x;
    }

    @Override
    public double grad(double x, double[] a, int k) {
        if (k==0) return x;
        throw new IllegalArgumentException("K < 1");
    }

    @Override
    public String toString() {
        return "A × x";
    }
}
