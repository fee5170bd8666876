package io.marketlens.analytics.attribution;

/**
 * Raw, unnormalized credit of one window entry under a multi-touch model.
 */
public interface WeightingScheme {
    AttributionModel model();

    double rawWeight(WindowEntry entry);
}
