package curvefit.dummy_plugins;

/**
 * Plugin without jacobian that allows numerical approximation: a * x²
 */
public class DummyNumericSquarePlugin {
    public static final boolean NUMERIC_JACOBIAN = true;

    public static String name() {
        return "NumericSquare";
    }

    public static String[] parameters() {
        return new String[]{"a"};
    }

    public static double eval(double x, double[] p) {
        return p[0] * x * x;
    }
}
