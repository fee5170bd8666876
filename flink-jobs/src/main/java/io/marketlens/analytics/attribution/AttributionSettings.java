package io.marketlens.analytics.attribution;

import io.marketlens.analytics.config.PipelineConfig;

import java.io.Serializable;

/**
 * Window length and decay rate for the multi-touch models.
 */
public final class AttributionSettings implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_WINDOW_DAYS = 7;
    public static final double DEFAULT_DECAY_RATE = 0.5;

    private final int windowDays;
    private final double decayRate;

    public AttributionSettings(int windowDays, double decayRate) {
        if (windowDays < 0) {
            throw new IllegalArgumentException("windowDays must be >= 0, was " + windowDays);
        }
        if (decayRate < 0 || Double.isNaN(decayRate) || Double.isInfinite(decayRate)) {
            throw new IllegalArgumentException("decayRate must be a finite value >= 0, was " + decayRate);
        }
        this.windowDays = windowDays;
        this.decayRate = decayRate;
    }

    public static AttributionSettings defaults() {
        return new AttributionSettings(DEFAULT_WINDOW_DAYS, DEFAULT_DECAY_RATE);
    }

    public static AttributionSettings fromConfig(PipelineConfig config) {
        return new AttributionSettings(config.attributionWindowDays, config.timeDecayRate);
    }

    public int windowDays() {
        return windowDays;
    }

    public double decayRate() {
        return decayRate;
    }
}
