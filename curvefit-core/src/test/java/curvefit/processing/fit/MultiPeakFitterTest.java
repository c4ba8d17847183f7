package curvefit.processing.fit;

import curvefit.data_structure.DataRange;
import curvefit.data_structure.Dataset;
import curvefit.models.PeakShape;
import curvefit.processing.exceptions.InsufficientDataException;
import curvefit.processing.fit_function.PeakFunction;
import org.junit.Test;

import static org.junit.Assert.*;

public class MultiPeakFitterTest {
    static final double[] CENTERS = {10, 25, 40}, WIDTHS = {3, 4, 2.5}, AREAS = {30, 50, 20};
    static final double OFFSET = 1;

    static Dataset peaks(PeakShape shape) {
        PeakFunction peak = shape.createFunction();
        double[] x = new double[201];
        double[] y = new double[x.length];
        for (int i = 0; i<x.length; ++i) {
            x[i] = i * 0.25;
            y[i] = OFFSET;
            for (int p = 0; p<CENTERS.length; ++p) y[i] += peak.val(x[i], new double[]{AREAS[p], CENTERS[p], WIDTHS[p]});
        }
        return new Dataset(shape.modelName+"Peaks", x, y);
    }

    static FitConfig config() {
        return new FitConfig().setWriteParametersToLog(false).setTolerance(1e-10);
    }

    @Test
    public void fitsThreeGaussianPeaksFromClickedPoints() {
        Dataset data = peaks(PeakShape.GAUSS);
        MultiPeakFitter fitter = new MultiPeakFitter(PeakShape.GAUSS, 3, new CurveFitter());
        assertEquals(MultiPeakFitter.State.COLLECTING_PEAKS, fitter.getState());
        // seeds are not given in order
        fitter.addPeak(40.5, 4.5).addPeak(9.5, 8.5);
        assertEquals(MultiPeakFitter.State.COLLECTING_PEAKS, fitter.getState());
        assertEquals(2, fitter.getCollectedPeaks());
        fitter.addPeak(25.5, 10);
        assertEquals(MultiPeakFitter.State.READY, fitter.getState());
        FitResult res = fitter.fit(data, config());
        assertEquals(MultiPeakFitter.State.DONE, fitter.getState());
        assertSame(res, fitter.getResult());
        assertEquals(FitStatus.CONVERGED, res.getStatus());
        assertEquals(10, res.getNParameters());
        assertEquals(3, res.getPeaks().size());
        for (int p = 0; p<3; ++p) {
            PeakParameters peak = res.getPeaks().get(p);
            assertEquals(p+1, peak.getIndex());
            assertEquals(CENTERS[p], peak.getCenter(), 1e-4);
            assertEquals(WIDTHS[p], peak.getWidth(), 1e-4);
            assertEquals(AREAS[p], peak.getArea(), 1e-3);
            assertEquals(PeakShape.GAUSS.createFunction().getHeight(AREAS[p], WIDTHS[p]), peak.getHeight(), 1e-3);
        }
        assertEquals(OFFSET, res.getParameter("y0"), 1e-4);
    }

    @Test
    public void fitsLorentzianPeaksFromCenters() {
        Dataset data = peaks(PeakShape.LORENTZ);
        MultiPeakFitter fitter = new MultiPeakFitter(PeakShape.LORENTZ, 3, null);
        fitter.setPeakCenters(10.5, 24.5, 40);
        assertEquals(MultiPeakFitter.State.READY, fitter.getState());
        FitResult res = fitter.fit(data, config());
        assertNotEquals(FitStatus.FAILED, res.getStatus());
        for (int p = 0; p<3; ++p) assertEquals(CENTERS[p], res.getPeaks().get(p).getCenter(), 1e-3);
        assertEquals("Lorentz", res.getModelName());
    }

    @Test
    public void illegalTransitions() {
        MultiPeakFitter fitter = new MultiPeakFitter(PeakShape.GAUSS, 1, new CurveFitter());
        try {
            fitter.fit(peaks(PeakShape.GAUSS), config());
            fail("cannot fit before peaks are collected");
        } catch (IllegalStateException e) {
            assertEquals(MultiPeakFitter.State.COLLECTING_PEAKS, fitter.getState());
        }
        fitter.addPeak(10, 5);
        try {
            fitter.addPeak(20, 5);
            fail("all peaks already collected");
        } catch (IllegalStateException e) {
            assertEquals(MultiPeakFitter.State.READY, fitter.getState());
        }
        fitter.fit(peaks(PeakShape.GAUSS).filter(new DataRange(0, 17)), config());
        assertEquals(MultiPeakFitter.State.DONE, fitter.getState());
        try {
            fitter.setPeakCenters(10);
            fail("peaks cannot be changed after fit");
        } catch (IllegalStateException e) {
            assertEquals(MultiPeakFitter.State.DONE, fitter.getState());
        }
        fitter.reset();
        assertEquals(MultiPeakFitter.State.COLLECTING_PEAKS, fitter.getState());
        assertEquals(0, fitter.getCollectedPeaks());
        assertNull(fitter.getResult());
    }

    @Test
    public void inputErrorReturnsToReady() {
        MultiPeakFitter fitter = new MultiPeakFitter(PeakShape.GAUSS, 2, new CurveFitter());
        fitter.setPeakCenters(1, 2);
        try {
            fitter.fit(new Dataset("small", new double[]{1, 2, 3}, new double[]{1, 2, 1}), config());
            fail("7 parameters cannot be fitted with 3 points");
        } catch (InsufficientDataException e) {
            assertEquals(MultiPeakFitter.State.READY, fitter.getState());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void wrongNumberOfCenters() {
        new MultiPeakFitter(PeakShape.GAUSS, 2, null).setPeakCenters(1, 2, 3);
    }
}
