package io.marketlens.analytics.util;

/**
 * Stable cross-platform identifiers derived from (tenant, platform, platform-native id).
 *
 * <p>The identifier is the MD5 of {@code tenant|platform|nativeId} after trimming each part.
 * The pipe delimiter keeps {@code ("ab", "cdef")} and {@code ("abc", "def")} apart. Any null or
 * blank part yields null; callers must filter such rows rather than coerce them.</p>
 */
public final class IdentifierNormalizer {
    public static final String ACCOUNT_PREFIX = "acc_";
    public static final String CAMPAIGN_PREFIX = "cmp_";
    public static final String AD_GROUP_PREFIX = "adg_";
    public static final String AD_PREFIX = "ad_";

    private IdentifierNormalizer() {}

    public static String normalize(String tenantId, String platform, String nativeId) {
        String t = StringSemantics.trimToNull(tenantId);
        String p = StringSemantics.trimToNull(platform);
        String n = StringSemantics.trimToNull(nativeId);
        if (t == null || p == null || n == null) {
            return null;
        }
        return Hashing.md5Hex(t + "|" + p + "|" + n);
    }

    public static String accountId(String tenantId, String platform, String nativeId) {
        return prefixed(ACCOUNT_PREFIX, normalize(tenantId, platform, nativeId));
    }

    public static String campaignId(String tenantId, String platform, String nativeId) {
        return prefixed(CAMPAIGN_PREFIX, normalize(tenantId, platform, nativeId));
    }

    public static String adGroupId(String tenantId, String platform, String nativeId) {
        return prefixed(AD_GROUP_PREFIX, normalize(tenantId, platform, nativeId));
    }

    public static String adId(String tenantId, String platform, String nativeId) {
        return prefixed(AD_PREFIX, normalize(tenantId, platform, nativeId));
    }

    private static String prefixed(String prefix, String hash) {
        return hash == null ? null : prefix + hash;
    }
}
