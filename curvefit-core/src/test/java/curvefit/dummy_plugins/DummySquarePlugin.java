package curvefit.dummy_plugins;

/**
 * Plugin without jacobian: a * x²
 */
public class DummySquarePlugin {
    public static String[] parameters() {
        return new String[]{"a"};
    }

    public static double eval(double x, double[] p) {
        return p[0] * x * x;
    }
}
