package io.marketlens.analytics.attribution;

/**
 * Credit decays exponentially with distance from the order date: {@code exp(-rate * days)}.
 */
public class TimeDecayAttribution implements WeightingScheme {
    private final double decayRate;

    public TimeDecayAttribution(double decayRate) {
        this.decayRate = decayRate;
    }

    @Override
    public AttributionModel model() {
        return AttributionModel.TIME_DECAY;
    }

    @Override
    public double rawWeight(WindowEntry entry) {
        return Math.exp(-decayRate * entry.daysBeforeOrder());
    }
}
