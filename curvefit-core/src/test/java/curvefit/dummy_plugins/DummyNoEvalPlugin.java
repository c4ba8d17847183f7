package curvefit.dummy_plugins;

public class DummyNoEvalPlugin {
    public static String[] parameters() {
        return new String[]{"a"};
    }

    public static double value(double x, double[] p) {
        return p[0];
    }
}
