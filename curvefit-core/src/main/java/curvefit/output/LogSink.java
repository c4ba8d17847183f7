package curvefit.output;

/**
 * Receives fit reports, typically a result log window
 */
@FunctionalInterface
public interface LogSink {
    void log(String report);
}
