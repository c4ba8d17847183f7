package curvefit.processing.fit;

import curvefit.processing.exceptions.InvalidConfigurationException;
import curvefit.processing.optimizer.FitAlgorithm;
import curvefit.processing.weighting.WeightingData;
import curvefit.processing.weighting.WeightingMethod;
import curvefit.utils.JSONUtils;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;
import org.junit.Test;

import static org.junit.Assert.*;

public class FitConfigTest {
    @Test
    public void defaults() {
        FitConfig config = new FitConfig().validate();
        assertEquals(FitAlgorithm.SCALED_LEVENBERG_MARQUARDT, config.algorithm);
        assertEquals(1e-4, config.tolerance, 0);
        assertEquals(1000, config.maxIterations);
        assertEquals(WeightingMethod.NONE, config.weighting);
        assertNull(config.range);
        assertEquals(100, config.outputPoints);
    }

    @Test
    public void invalidOptions() {
        FitConfig[] invalid = {
                new FitConfig().setTolerance(0),
                new FitConfig().setTolerance(1),
                new FitConfig().setMaxIterations(0),
                new FitConfig().setMaxIterations(FitConfig.MAX_ITERATIONS_LIMIT + 1),
                new FitConfig().setOutputPoints(1),
                new FitConfig().setSignificantDigits(0),
                new FitConfig().setConfidenceLevel(1),
                new FitConfig().setAlgorithm(null)
        };
        for (FitConfig c : invalid) {
            try {
                c.validate();
                fail("should be invalid: "+c);
            } catch (InvalidConfigurationException e) {
                assertNotNull(e.getMessage());
            }
        }
        new FitConfig().setOutputPoints(1).setSameXAsSource(true).validate();
    }

    @Test
    public void jsonRoundTrip() throws ParseException {
        FitConfig config = new FitConfig().setAlgorithm(FitAlgorithm.SIMPLEX).setTolerance(1e-6).setMaxIterations(500)
                .setWeighting(WeightingMethod.ARBITRARY_DATASET, new WeightingData("sigma", new double[]{1, 2, 3}))
                .setRange(Double.NEGATIVE_INFINITY, 5).setScaleErrors(true).setGlobalParameterTable(true).setConfidenceLevel(0.99);
        String json = JSONUtils.toJSONString(config.toJSONEntry());
        FitConfig restored = new FitConfig();
        restored.initFromJSONEntry((JSONObject)new JSONParser().parse(json));
        assertEquals(config.toJSONEntry(), restored.toJSONEntry());
        assertEquals(FitAlgorithm.SIMPLEX, restored.algorithm);
        assertEquals(Double.NEGATIVE_INFINITY, restored.range.getFrom(), 0);
        assertArrayEquals(new double[]{1, 2, 3}, restored.weightingData.getValues(), 0);
    }

    @Test
    public void duplicate() {
        FitConfig config = new FitConfig().setRange(0, 1).setOutputPoints(20);
        FitConfig dup = config.duplicate();
        assertEquals(config.toJSONEntry(), dup.toJSONEntry());
        assertNotSame(config.range, dup.range);
    }
}
