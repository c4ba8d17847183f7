package curvefit.processing.fit_function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;
import java.util.stream.IntStream;

/**
 * Sum of <code>n</code> identical functions plus a background function.
 * Parameters of the i-th function are located at indices [i × p, (i+1) × p[ with p the number of parameters of the function,
 * background parameters come last.
 * Parameters are copied to a per-thread bucket, so that a single instance can be evaluated concurrently.
 */
public class MultipleIdenticalFitFunction implements FitFunction {
    public static final Logger logger = LoggerFactory.getLogger(MultipleIdenticalFitFunction.class);
    final FitFunction function;
    final FitFunction backgroundFunction;
    final int nFunctions, nParams;
    final ThreadLocal<double[][]> parameterBucket;

    /**
     *
     * @param nFunctions number of functions in the sum
     * @param function function to sum
     * @param backgroundFunction background function, may be null
     */
    public MultipleIdenticalFitFunction(int nFunctions, FitFunction function, FitFunction backgroundFunction) {
        if (nFunctions<1) throw new IllegalArgumentException("At least one function is required");
        this.function = function;
        this.nParams = function.getNParameters();
        this.nFunctions = nFunctions;
        this.backgroundFunction=backgroundFunction;
        Supplier<double[][]> paramBucketSupplier = () -> {
            if (backgroundFunction!=null) {
                double[][] bucket = new double[this.nFunctions +1][];
                IntStream.range(0, this.nFunctions).forEach(i->bucket[i]=new double[nParams]);
                bucket[this.nFunctions] = new double[backgroundFunction.getNParameters()];
                return bucket;
            } else return new double[this.nFunctions][nParams];
        };
        parameterBucket = ThreadLocal.withInitial(paramBucketSupplier);
    }

    public FitFunction getFunction() {
        return function;
    }

    public FitFunction getBackgroundFunction() {
        return backgroundFunction;
    }

    public int getNFunctions() {
        return nFunctions;
    }

    /**
     * @return parameters of the {@param functionIdx}-th function (index {@link #getNFunctions()} for the background)
     */
    public double[] getFunctionParameters(double[] parameters, int functionIdx) {
        double[] res = new double[functionIdx==nFunctions ? backgroundFunction.getNParameters() : nParams];
        System.arraycopy(parameters, functionIdx * nParams, res, 0, res.length);
        return res;
    }

    private void copyToBucket(double[] parameters, int functionIdx, double[][] bucket) {
        System.arraycopy(parameters, functionIdx * nParams, bucket[functionIdx], 0, bucket[functionIdx].length);
    }

    private void copyParametersToBucket(double[] params, double[][] bucket) {
        for (int functionIdx = 0; functionIdx<bucket.length; ++functionIdx) copyToBucket(params, functionIdx, bucket);
    }

    @Override
    public int getNParameters() {
        return nFunctions * nParams + (backgroundFunction==null? 0 : backgroundFunction.getNParameters());
    }

    @Override
    public double val(double x, double[] params) {
        double[][] bucket = parameterBucket.get();
        copyParametersToBucket(params, bucket);
        double res = backgroundFunction==null? 0 : backgroundFunction.val(x, bucket[nFunctions]);
        for (int i = 0; i<nFunctions; ++i) res += function.val(x, bucket[i]);
        return res;
    }

    @Override
    public double grad(double x, double[] params, int i) {
        double[][] bucket = parameterBucket.get();
        int funIdx = i/nParams;
        copyToBucket(params, funIdx, bucket);
        if (funIdx== nFunctions) return backgroundFunction.grad(x, bucket[funIdx], i - nParams * nFunctions);
        return function.grad(x, bucket[funIdx], i% nParams);
    }

    @Override
    public boolean hasAnalyticGradient() {
        return function.hasAnalyticGradient() && (backgroundFunction==null || backgroundFunction.hasAnalyticGradient());
    }

    @Override
    public String toString() {
        return "Sum of "+nFunctions+" × "+function+(backgroundFunction==null ? "" : " + "+backgroundFunction);
    }
}
