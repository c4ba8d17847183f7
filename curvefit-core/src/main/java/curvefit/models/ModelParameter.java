package curvefit.models;

import org.json.simple.JSONObject;

import java.util.Objects;

/**
 * Parameter of a fit model: name, initial value (NaN: estimated from data), fixed flag and optional [lower, upper] range.
 * Immutable
 */
public class ModelParameter {
    final String name;
    final double initialValue;
    final boolean fixed;
    final double lowerBound, upperBound;

    public ModelParameter(String name) {
        this(name, Double.NaN, false, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public ModelParameter(String name, double initialValue, boolean fixed, double lowerBound, double upperBound) {
        if (name==null || name.isEmpty()) throw new IllegalArgumentException("Parameter name is required");
        if (Double.isNaN(lowerBound) || Double.isNaN(upperBound) || lowerBound > upperBound) throw new IllegalArgumentException("Invalid range for parameter "+name+": ["+lowerBound+"; "+upperBound+"]");
        this.name = name;
        this.initialValue = initialValue;
        this.fixed = fixed;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public String getName() {
        return name;
    }

    /**
     * @return initial value, NaN if it should be estimated from data
     */
    public double getInitialValue() {
        return initialValue;
    }

    public boolean isFixed() {
        return fixed;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    public boolean isBounded() {
        return lowerBound!=Double.NEGATIVE_INFINITY || upperBound!=Double.POSITIVE_INFINITY;
    }

    public ModelParameter withInitialValue(double value) {
        return new ModelParameter(name, value, fixed, lowerBound, upperBound);
    }

    /**
     * @param fixed whether the parameter is held constant during the fit. A fixed parameter keeps its initial value, or the estimated value if it has none
     */
    public ModelParameter withFixed(boolean fixed) {
        return new ModelParameter(name, initialValue, fixed, lowerBound, upperBound);
    }

    public ModelParameter withBounds(double lowerBound, double upperBound) {
        return new ModelParameter(name, initialValue, fixed, lowerBound, upperBound);
    }

    public Object toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("name", name);
        if (!Double.isNaN(initialValue)) res.put("value", initialValue);
        if (fixed) res.put("fixed", true);
        if (lowerBound!=Double.NEGATIVE_INFINITY) res.put("from", lowerBound);
        if (upperBound!=Double.POSITIVE_INFINITY) res.put("to", upperBound);
        return res;
    }

    public static ModelParameter fromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof String) return new ModelParameter((String)jsonEntry);
        JSONObject json = (JSONObject)jsonEntry;
        double value = json.containsKey("value") ? ((Number)json.get("value")).doubleValue() : Double.NaN;
        boolean fixed = Boolean.TRUE.equals(json.get("fixed"));
        double from = json.containsKey("from") ? ((Number)json.get("from")).doubleValue() : Double.NEGATIVE_INFINITY;
        double to = json.containsKey("to") ? ((Number)json.get("to")).doubleValue() : Double.POSITIVE_INFINITY;
        return new ModelParameter((String)json.get("name"), value, fixed, from, to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelParameter)) return false;
        ModelParameter that = (ModelParameter) o;
        return Double.compare(that.initialValue, initialValue) == 0 && fixed == that.fixed && Double.compare(that.lowerBound, lowerBound) == 0 && Double.compare(that.upperBound, upperBound) == 0 && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, initialValue, fixed, lowerBound, upperBound);
    }

    @Override
    public String toString() {
        return name + (Double.isNaN(initialValue) ? "" : "="+initialValue) + (fixed ? " (fixed)" : "") + (isBounded() ? " in ["+lowerBound+"; "+upperBound+"]" : "");
    }
}
