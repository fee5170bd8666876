package io.marketlens.analytics.channel;

/**
 * Maps a platform's raw channel or placement string to the canonical channel taxonomy.
 */
public final class ChannelClassifier {
    private ChannelClassifier() {}

    /**
     * @return the canonical channel value; {@code other} only when the platform itself is unknown
     */
    public static String classify(String platform, String rawChannel) {
        Platform p = Platform.fromKey(platform);
        if (p == null) {
            return CanonicalChannel.OTHER.value();
        }
        return p.classify(rawChannel).value();
    }
}
