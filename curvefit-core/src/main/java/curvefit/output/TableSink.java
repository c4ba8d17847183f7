package curvefit.output;

/**
 * Receives the tables produced by fits
 */
public interface TableSink {
    /**
     * Called after each fit with the table the fit was written to. A shared table is sent again each time a row is appended
     */
    void writeParameterTable(ParameterTable table);

    void writeCovarianceMatrix(String name, String[] parameterNames, double[][] covariance);
}
