package curvefit.processing.fit_function;

/**
 * Peak-shaped function parametrized by its area, center and width:
 * <pre>
 * k = 0      - A (area)
 * k = 1      - xc (center)
 * k = 2      - w (width)
 * </pre>
 * @author Jean Ollion
 */
public interface PeakFunction extends FitFunction {
    int AREA = 0, CENTER = 1, WIDTH = 2;

    @Override
    default int getNParameters() {
        return 3;
    }

    /**
     * @return maximal value of the peak
     */
    double getHeight(double area, double width);

    /**
     * @return area of the peak of height {@param height}
     */
    double getArea(double height, double width);

    /**
     * @return width parameter of a peak of full width at half maximum {@param fwhm}
     */
    double getWidth(double fwhm);
}
