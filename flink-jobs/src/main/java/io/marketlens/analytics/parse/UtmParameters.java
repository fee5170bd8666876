package io.marketlens.analytics.parse;

import io.marketlens.analytics.util.StringSemantics;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * UTM parameters taken from a landing-page URL query string.
 */
public final class UtmParameters {
    private static final UtmParameters NONE = new UtmParameters(null, null, null, null, null);

    private final String source;
    private final String medium;
    private final String campaign;
    private final String term;
    private final String content;

    private UtmParameters(String source, String medium, String campaign, String term, String content) {
        this.source = source;
        this.medium = medium;
        this.campaign = campaign;
        this.term = term;
        this.content = content;
    }

    /**
     * Parses {@code utm_*} query parameters; keys are case-insensitive and the first occurrence wins.
     */
    public static UtmParameters fromLandingSite(String landingSite) {
        String url = StringSemantics.trimToNull(landingSite);
        if (url == null) {
            return NONE;
        }
        int queryStart = url.indexOf('?');
        if (queryStart < 0) {
            return NONE;
        }
        String query = url.substring(queryStart + 1);
        int fragment = query.indexOf('#');
        if (fragment >= 0) {
            query = query.substring(0, fragment);
        }

        String source = null;
        String medium = null;
        String campaign = null;
        String term = null;
        String content = null;
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = pair.substring(0, eq).toLowerCase(Locale.ROOT);
            String value = StringSemantics.trimToNull(decode(pair.substring(eq + 1)));
            switch (key) {
                case "utm_source":
                    source = source == null ? value : source;
                    break;
                case "utm_medium":
                    medium = medium == null ? value : medium;
                    break;
                case "utm_campaign":
                    campaign = campaign == null ? value : campaign;
                    break;
                case "utm_term":
                    term = term == null ? value : term;
                    break;
                case "utm_content":
                    content = content == null ? value : content;
                    break;
                default:
                    break;
            }
        }
        return new UtmParameters(source, medium, campaign, term, content);
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return value;
        }
    }

    public String source() {
        return source;
    }

    public String medium() {
        return medium;
    }

    public String campaign() {
        return campaign;
    }

    public String term() {
        return term;
    }

    public String content() {
        return content;
    }
}
