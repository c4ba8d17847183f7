package curvefit.processing.fit;

import curvefit.utils.JSONUtils;
import org.json.simple.JSONObject;

/**
 * Fitted parameters of one peak of a multi-peak fit
 */
public class PeakParameters {
    final int index;
    final double center, width, height, area;

    /**
     * @param index index of the peak, starting from 1
     */
    public PeakParameters(int index, double center, double width, double height, double area) {
        this.index = index;
        this.center = center;
        this.width = width;
        this.height = height;
        this.area = area;
    }

    public int getIndex() {
        return index;
    }

    public double getCenter() {
        return center;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getArea() {
        return area;
    }

    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("peak", index);
        res.put("center", JSONUtils.toJSONNumber(center));
        res.put("width", JSONUtils.toJSONNumber(width));
        res.put("height", JSONUtils.toJSONNumber(height));
        res.put("area", JSONUtils.toJSONNumber(area));
        return res;
    }

    @Override
    public String toString() {
        return "Peak "+index+": center="+center+", width="+width+", height="+height+", area="+area;
    }
}
