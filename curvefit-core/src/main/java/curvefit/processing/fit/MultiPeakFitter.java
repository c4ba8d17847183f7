/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of CurveFit
 *
 * CurveFit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * CurveFit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with CurveFit.  If not, see <http://www.gnu.org/licenses/>.
 */
package curvefit.processing.fit;

import curvefit.data_structure.Dataset;
import curvefit.models.FitModel;
import curvefit.models.PeakShape;
import curvefit.processing.fit_function.MultipleIdenticalEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Interactive fit of N identical peaks: peak seeds are collected (from clicked points or given centers), then a single fit
 * of the sum of N peaks plus a constant offset is performed.
 * <p>
 * States: COLLECTING_PEAKS → (N seeds) → READY → fit → FITTING → DONE. {@link #reset()} goes back to COLLECTING_PEAKS from any state.
 * An input error thrown during the fit returns to READY.
 * @author Jean Ollion
 */
public class MultiPeakFitter {
    public static final Logger logger = LoggerFactory.getLogger(MultiPeakFitter.class);
    public enum State {COLLECTING_PEAKS, READY, FITTING, DONE}
    final PeakShape shape;
    final int nPeaks;
    final CurveFitter curveFitter;
    final List<double[]> seeds = new ArrayList<>();
    State state = State.COLLECTING_PEAKS;
    FitResult result;

    public MultiPeakFitter(PeakShape shape, int nPeaks, CurveFitter curveFitter) {
        if (shape==null) throw new IllegalArgumentException("Peak shape is required");
        if (nPeaks<1) throw new IllegalArgumentException("At least one peak is required");
        this.shape = shape;
        this.nPeaks = nPeaks;
        this.curveFitter = curveFitter==null ? new CurveFitter() : curveFitter;
    }

    public PeakShape getShape() {
        return shape;
    }

    public int getNPeaks() {
        return nPeaks;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized int getCollectedPeaks() {
        return seeds.size();
    }

    /**
     * Adds a peak seed: {@param x} is used as initial center and {@param y} as initial height
     * @return this
     * @throws IllegalStateException if N peaks have already been collected, or a fit has been performed
     */
    public synchronized MultiPeakFitter addPeak(double x, double y) {
        if (state!=State.COLLECTING_PEAKS) throw new IllegalStateException("Cannot add peak in state: "+state+ (state==State.READY ? " ("+nPeaks+" peaks already collected)" : ""));
        if (!Double.isFinite(x)) throw new IllegalArgumentException("Invalid peak position: "+x);
        seeds.add(new double[]{x, y});
        logger.debug("peak {}/{} added at x={} y={}", seeds.size(), nPeaks, x, y);
        if (seeds.size()==nPeaks) state = State.READY;
        return this;
    }

    /**
     * Replaces collected seeds by {@param centers}. Heights are estimated from the data.
     * @return this
     */
    public synchronized MultiPeakFitter setPeakCenters(double... centers) {
        if (state!=State.COLLECTING_PEAKS && state!=State.READY) throw new IllegalStateException("Cannot set peak centers in state: "+state);
        if (centers==null || centers.length!=nPeaks) throw new IllegalArgumentException("Expected "+nPeaks+" peak centers, got: "+(centers==null ? 0 : centers.length));
        for (double c : centers) if (!Double.isFinite(c)) throw new IllegalArgumentException("Invalid peak center: "+c);
        seeds.clear();
        for (double c : centers) seeds.add(new double[]{c, Double.NaN});
        state = State.READY;
        return this;
    }

    /**
     * @return model fitted by {@link #fit(Dataset, FitConfig)}, initialized from the collected seeds
     */
    public synchronized FitModel getModel() {
        if (seeds.size()!=nPeaks) throw new IllegalStateException("Only "+seeds.size()+"/"+nPeaks+" peaks collected");
        List<double[]> sorted = new ArrayList<>(seeds);
        sorted.sort(Comparator.comparingDouble(s -> s[0]));
        double[] centers = new double[nPeaks];
        double[] heights = new double[nPeaks];
        for (int i = 0; i<nPeaks; ++i) {
            centers[i] = sorted.get(i)[0];
            heights[i] = sorted.get(i)[1];
        }
        return shape.createModel(nPeaks).withEstimator(new MultipleIdenticalEstimator(shape.createFunction(), nPeaks, centers, heights));
    }

    public synchronized FitResult fit(Dataset dataset, FitConfig config) {
        if (state!=State.READY) throw new IllegalStateException("Cannot fit in state: "+state+" ("+seeds.size()+"/"+nPeaks+" peaks collected)");
        FitModel model = getModel();
        state = State.FITTING;
        try {
            result = curveFitter.fit(dataset, model, config);
        } catch (RuntimeException e) {
            state = State.READY;
            throw e;
        }
        state = State.DONE;
        return result;
    }

    /**
     * @return result of the last fit, null if no fit was performed since the last reset
     */
    public synchronized FitResult getResult() {
        return result;
    }

    public synchronized void reset() {
        seeds.clear();
        result = null;
        state = State.COLLECTING_PEAKS;
    }
}
