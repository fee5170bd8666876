package io.marketlens.analytics.attribution;

/**
 * Every window entry earns equal credit.
 */
public class LinearAttribution implements WeightingScheme {
    @Override
    public AttributionModel model() {
        return AttributionModel.MULTI_TOUCH_LINEAR;
    }

    @Override
    public double rawWeight(WindowEntry entry) {
        return 1.0;
    }
}
