package curvefit.processing.fit_function;

/**
 * A constant function.
 * <p>
 * This fitting target function is defined by the following <code>1</code> parameter:
 *
 * <pre>
 * k = 0      - C
 * </pre>
 *
 * @author Jean Ollion
 */
public class Constant implements FitFunction {
	public Constant() {
	}

	@Override
	public String toString() {
		return "Constant function C";
	}

	@Override
	public int getNParameters() {
		return 1;
	}

	@Override
	public final double val(final double x, final double[] a) {
		return a[0];
	}

	@Override
	public final double grad(final double x, final double[] a, final int k) {
		if (k==0) return 1; // constant
		throw new IllegalArgumentException("K < 1");
	}
}
