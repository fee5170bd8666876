package io.marketlens.analytics.source;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import io.marketlens.analytics.util.JsonSupport;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceCatalogLoaderTest {

    @Test
    void defaultCatalogDefinesEveryPlatformSource() {
        SourceCatalog catalog = SourceCatalogLoader.loadDefault();

        assertEquals("v1", catalog.version());
        assertEquals(7, catalog.size());
        for (String name : List.of("meta_ads", "google_ads", "tiktok_ads", "pinterest_ads", "snap_ads", "amazon_ads")) {
            SourceDefinition definition = catalog.find(name);
            assertNotNull(definition, name);
            assertEquals(SourceEntityType.AD_PERFORMANCE, definition.entityType());
            assertTrue(definition.maps(SourceField.ACCOUNT_ID), name);
            assertTrue(definition.maps(SourceField.CAMPAIGN_ID), name);
            assertTrue(definition.maps(SourceField.REPORT_DATE), name);
        }
        SourceDefinition orders = catalog.find("shopify_orders");
        assertEquals(SourceEntityType.ORDER, orders.entityType());
        assertEquals("shopify", orders.platform());
        assertNull(catalog.find("myspace_ads"));
    }

    @Test
    void microCurrencySourcesMapMicrosFields() {
        SourceCatalog catalog = SourceCatalogLoader.loadDefault();

        assertTrue(catalog.find("google_ads").maps(SourceField.SPEND_MICROS));
        assertTrue(catalog.find("pinterest_ads").maps(SourceField.SPEND_MICROS));
        assertTrue(catalog.find("snap_ads").maps(SourceField.SPEND_MICROS));
        assertFalse(catalog.find("meta_ads").maps(SourceField.SPEND_MICROS));
    }

    @Test
    void unknownFieldKeyIsRejected() throws Exception {
        JsonNode root = JsonSupport.MAPPER.readTree("{\"catalog_version\":\"t\",\"sources\":[{"
                + "\"name\":\"meta_ads\",\"platform\":\"meta_ads\",\"entity_type\":\"ad_performance\","
                + "\"fields\":{\"favourite_colour\":[\"colour\"]}}]}");

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> SourceCatalogLoader.parseCatalog(root));
        assertTrue(ex.getMessage().contains("favourite_colour"));
    }

    @Test
    void unknownPlatformIsRejected() throws Exception {
        JsonNode root = JsonSupport.MAPPER.readTree("{\"sources\":[{"
                + "\"name\":\"myspace\",\"platform\":\"myspace_ads\",\"entity_type\":\"ad_performance\",\"fields\":{}}]}");

        assertThrows(IllegalStateException.class, () -> SourceCatalogLoader.parseCatalog(root));
    }

    @Test
    void duplicateSourceNameIsRejected() throws Exception {
        String source = "{\"name\":\"meta_ads\",\"platform\":\"meta_ads\",\"entity_type\":\"ad_performance\",\"fields\":{}}";
        JsonNode root = JsonSupport.MAPPER.readTree("{\"sources\":[" + source + "," + source + "]}");

        assertThrows(IllegalStateException.class, () -> SourceCatalogLoader.parseCatalog(root));
    }
}
