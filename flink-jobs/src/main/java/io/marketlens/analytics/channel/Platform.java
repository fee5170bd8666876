package io.marketlens.analytics.channel;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static io.marketlens.analytics.channel.CanonicalChannel.AFFILIATE;
import static io.marketlens.analytics.channel.CanonicalChannel.DIRECT;
import static io.marketlens.analytics.channel.CanonicalChannel.DISPLAY;
import static io.marketlens.analytics.channel.CanonicalChannel.EMAIL;
import static io.marketlens.analytics.channel.CanonicalChannel.MARKETPLACE;
import static io.marketlens.analytics.channel.CanonicalChannel.ORGANIC_SEARCH;
import static io.marketlens.analytics.channel.CanonicalChannel.ORGANIC_SOCIAL;
import static io.marketlens.analytics.channel.CanonicalChannel.OTHER;
import static io.marketlens.analytics.channel.CanonicalChannel.PAID_SEARCH;
import static io.marketlens.analytics.channel.CanonicalChannel.PAID_SOCIAL;
import static io.marketlens.analytics.channel.CanonicalChannel.PUSH;
import static io.marketlens.analytics.channel.CanonicalChannel.REFERRAL;
import static io.marketlens.analytics.channel.CanonicalChannel.SHOPPING;
import static io.marketlens.analytics.channel.CanonicalChannel.SMS;
import static io.marketlens.analytics.channel.CanonicalChannel.VIDEO;

/**
 * Known source platforms, each carrying its own raw-channel mapping table and fallback channel.
 *
 * <p>Fallbacks differ on purpose: an unmapped Google value is most likely search, an unmapped
 * Amazon value is marketplace inventory, an unmapped GA4 grouping is genuinely unknown.</p>
 */
public enum Platform {
    META_ADS("meta_ads", PAID_SOCIAL, table()
            .map(PAID_SOCIAL, "facebook_feed", "instagram_feed", "facebook_stories", "instagram_stories",
                    "facebook_reels", "instagram_reels", "messenger_inbox", "audience_network", "feed", "story", "reels")
            .map(MARKETPLACE, "facebook_marketplace", "marketplace")
            .map(VIDEO, "video", "in_stream_video", "video_feeds")
            .map(DISPLAY, "audience_network_classic", "display", "banner")),
    GOOGLE_ADS("google_ads", PAID_SEARCH, table()
            .map(PAID_SEARCH, "search", "search_network", "google_search", "performance_max", "pmax")
            .map(DISPLAY, "display", "display_network", "google_display", "gdn", "app", "universal_app", "app_campaign")
            .map(VIDEO, "video", "youtube", "youtube_video")
            .map(SHOPPING, "shopping", "google_shopping", "pla", "product_listing")
            .map(PAID_SOCIAL, "discovery", "demand_gen", "discover")),
    TIKTOK_ADS("tiktok_ads", PAID_SOCIAL, table()
            .map(PAID_SOCIAL, "tiktok_feed", "in_feed", "for_you", "fyp", "spark_ads", "branded_content")
            .map(VIDEO, "topview", "brand_takeover")
            .map(DISPLAY, "pangle", "audience_network")),
    PINTEREST_ADS("pinterest_ads", PAID_SOCIAL, table()
            .map(PAID_SOCIAL, "browse", "home_feed", "pinterest_feed")
            .map(PAID_SEARCH, "search", "pinterest_search")
            .map(SHOPPING, "shopping", "catalog", "product")
            .map(VIDEO, "video", "video_pins")),
    SNAP_ADS("snap_ads", PAID_SOCIAL, table()
            .map(PAID_SOCIAL, "snap_ads", "story_ads", "between_stories")
            .map(VIDEO, "spotlight", "spotlight_ads")
            .map(DISPLAY, "discover", "discover_ads")
            .map(SHOPPING, "collection", "dynamic_ads", "catalog")),
    AMAZON_ADS("amazon_ads", MARKETPLACE, table()
            .map(SHOPPING, "sponsored_products", "sp")
            .map(PAID_SEARCH, "sponsored_brands", "sb", "headline_search")
            .map(DISPLAY, "sponsored_display", "sd", "product_display", "dsp", "demand_side_platform")
            .map(VIDEO, "video", "ott", "streaming_tv")),
    KLAVIYO("klaviyo", EMAIL, table()
            .map(EMAIL, "email", "campaign", "flow", "automation")
            .map(SMS, "sms", "text", "mms")
            .map(PUSH, "push", "push_notification", "mobile_push")),
    GA4("ga4", OTHER, table()
            .map(ORGANIC_SEARCH, "organic search", "organic_search")
            .map(PAID_SEARCH, "paid search", "paid_search", "cpc")
            .map(ORGANIC_SOCIAL, "organic social", "organic_social")
            .map(PAID_SOCIAL, "paid social", "paid_social", "paidsocial")
            .map(EMAIL, "email", "e-mail")
            .map(DISPLAY, "display", "banner")
            .map(VIDEO, "video", "youtube")
            .map(REFERRAL, "referral", "ref")
            .map(DIRECT, "direct", "(direct)", "(none)")
            .map(AFFILIATE, "affiliate", "affiliates")),
    RECHARGE("recharge", DIRECT, table()),
    SHOPIFY("shopify", DIRECT, table()
            .map(DIRECT, "online_store", "web", "storefront", "pos", "point_of_sale", "retail",
                    "draft_orders", "draft", "shopify_inbox", "inbox", "chat"));

    private static final Map<String, Platform> BY_KEY = new HashMap<>();

    static {
        for (Platform platform : values()) {
            BY_KEY.put(platform.key, platform);
        }
    }

    private final String key;
    private final CanonicalChannel defaultChannel;
    private final Map<String, CanonicalChannel> mappings;

    Platform(String key, CanonicalChannel defaultChannel, MappingTable table) {
        this.key = key;
        this.defaultChannel = defaultChannel;
        this.mappings = Collections.unmodifiableMap(table.entries);
    }

    public String key() {
        return key;
    }

    public CanonicalChannel defaultChannel() {
        return defaultChannel;
    }

    /**
     * Case-insensitive lookup; unmapped or blank values fall back to this platform's default.
     */
    public CanonicalChannel classify(String rawChannel) {
        if (rawChannel == null) {
            return defaultChannel;
        }
        String normalized = rawChannel.trim().toLowerCase(Locale.ROOT);
        return mappings.getOrDefault(normalized, defaultChannel);
    }

    public static Platform fromKey(String key) {
        if (key == null) {
            return null;
        }
        return BY_KEY.get(key.trim().toLowerCase(Locale.ROOT));
    }

    private static MappingTable table() {
        return new MappingTable();
    }

    private static final class MappingTable {
        private final Map<String, CanonicalChannel> entries = new HashMap<>();

        MappingTable map(CanonicalChannel channel, String... rawValues) {
            for (String raw : rawValues) {
                CanonicalChannel previous = entries.putIfAbsent(raw, channel);
                if (previous != null && previous != channel) {
                    throw new IllegalStateException("Raw channel '" + raw + "' mapped twice");
                }
            }
            return this;
        }
    }
}
