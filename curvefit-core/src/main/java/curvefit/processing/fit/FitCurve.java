package curvefit.processing.fit;

import curvefit.utils.ArrayUtil;

/**
 * Values of a fitted model, evaluated at uniformly spaced abscissa or at the abscissa of the source data
 */
public class FitCurve {
    final String name;
    final double[] x, y;

    public FitCurve(String name, double[] x, double[] y) {
        if (x.length!=y.length) throw new IllegalArgumentException("x & y should be of same length");
        this.name = name;
        this.x = ArrayUtil.duplicate(x);
        this.y = ArrayUtil.duplicate(y);
    }

    public String getName() {
        return name;
    }

    public int size() {
        return x.length;
    }

    public double[] getX() {
        return ArrayUtil.duplicate(x);
    }

    public double[] getY() {
        return ArrayUtil.duplicate(y);
    }

    public double getX(int i) {
        return x[i];
    }

    public double getY(int i) {
        return y[i];
    }

    @Override
    public String toString() {
        return "FitCurve: "+name+" (n="+x.length+")";
    }
}
