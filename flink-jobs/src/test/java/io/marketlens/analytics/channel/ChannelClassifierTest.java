package io.marketlens.analytics.channel;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChannelClassifierTest {

    @Test
    void mappedValuesAreCaseInsensitive() {
        assertEquals("paid_social", ChannelClassifier.classify("meta_ads", "Instagram_Feed"));
        assertEquals("shopping", ChannelClassifier.classify("google_ads", " SHOPPING "));
        assertEquals("sms", ChannelClassifier.classify("klaviyo", "SMS"));
    }

    @Test
    void unmappedValueFallsBackToPlatformDefault() {
        assertEquals("paid_search", ChannelClassifier.classify("google_ads", "something_new"));
        assertEquals("marketplace", ChannelClassifier.classify("amazon_ads", "something_new"));
        assertEquals("other", ChannelClassifier.classify("ga4", "something_new"));
    }

    @Test
    void blankChannelFallsBackToPlatformDefault() {
        assertEquals("paid_social", ChannelClassifier.classify("tiktok_ads", null));
        assertEquals("direct", ChannelClassifier.classify("shopify", "  "));
    }

    @Test
    void unknownPlatformIsOther() {
        assertEquals("other", ChannelClassifier.classify("myspace_ads", "feed"));
        assertEquals("other", ChannelClassifier.classify(null, "feed"));
    }

    @Test
    void sameRawValueMayMeanDifferentChannelsPerPlatform() {
        assertEquals(CanonicalChannel.DISPLAY, Platform.TIKTOK_ADS.classify("audience_network"));
        assertEquals(CanonicalChannel.PAID_SOCIAL, Platform.META_ADS.classify("audience_network"));
    }
}
