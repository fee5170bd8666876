package io.marketlens.analytics.attribution;

/**
 * Attribution model names as written on attribution records.
 */
public enum AttributionModel {
    LAST_CLICK("last_click"),
    MULTI_TOUCH_LINEAR("multi_touch_linear"),
    TIME_DECAY("time_decay");

    private final String value;

    AttributionModel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
