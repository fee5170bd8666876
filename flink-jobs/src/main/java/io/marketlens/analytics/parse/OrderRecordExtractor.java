package io.marketlens.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import io.marketlens.analytics.channel.ChannelClassifier;
import io.marketlens.analytics.model.OrderFact;
import io.marketlens.analytics.model.RawRecord;
import io.marketlens.analytics.source.SourceDefinition;
import io.marketlens.analytics.source.SourceEntityType;
import io.marketlens.analytics.source.SourceField;
import io.marketlens.analytics.tenant.TenantResolver;
import io.marketlens.analytics.util.IdentifierNormalizer;
import io.marketlens.analytics.util.StringSemantics;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.util.Set;

/**
 * Turns commerce-platform raw records into order facts.
 */
public class OrderRecordExtractor implements Serializable {
    private static final long serialVersionUID = 1L;

    static final String ORDER_GID_PREFIX = "gid://shopify/Order/";
    static final String CUSTOMER_GID_PREFIX = "gid://shopify/Customer/";
    static final String UNKNOWN_SHOP = "unknown";

    private static final Set<String> VALID_FINANCIAL_STATUSES =
            Set.of("paid", "partially_paid", "authorized", "partially_refunded");

    private final TenantResolver tenantResolver;

    public OrderRecordExtractor(TenantResolver tenantResolver) {
        this.tenantResolver = tenantResolver;
    }

    public Extraction<OrderFact> extract(SourceDefinition definition, RawRecord record) {
        if (definition == null || definition.entityType() != SourceEntityType.ORDER) {
            return Extraction.dropped(DropReason.UNKNOWN_SOURCE, record.sourceName);
        }
        JsonNode root = PayloadReader.readObject(record.payload);
        if (root == null) {
            return Extraction.dropped(DropReason.MALFORMED_PAYLOAD, "payload is not a JSON object");
        }

        String tenantId = tenantResolver.resolve(definition.registrySourceType(), record.connectionId);
        if (tenantId == null) {
            return Extraction.dropped(DropReason.UNRESOLVED_TENANT, "connectionId=" + record.connectionId);
        }

        PayloadFields fields = new PayloadFields(root, definition);
        String orderId = stripPrefix(fields.text(SourceField.ORDER_ID), ORDER_GID_PREFIX);
        if (orderId == null) {
            return Extraction.dropped(DropReason.MISSING_ORDER_ID, record.ingestionId);
        }

        OrderFact order = new OrderFact();
        order.tenantId = tenantId;
        order.sourcePlatform = definition.platform();
        order.orderId = orderId;
        order.createdAt = FieldCasts.timestamp(fields.text(SourceField.CREATED_AT));
        if (order.createdAt == null) {
            return Extraction.dropped(DropReason.MISSING_DATE, record.ingestionId);
        }
        order.orderDate = order.createdAt.atZone(ZoneOffset.UTC).toLocalDate();
        order.updatedAt = FieldCasts.timestamp(fields.text(SourceField.UPDATED_AT));
        order.cancelledAt = FieldCasts.timestamp(fields.text(SourceField.CANCELLED_AT));
        order.closedAt = FieldCasts.timestamp(fields.text(SourceField.CLOSED_AT));

        order.orderName = fields.text(SourceField.ORDER_NAME);
        order.orderNumber = FieldCasts.nullableInteger(fields.text(SourceField.ORDER_NUMBER));

        String shopId = StringSemantics.firstNonBlank(fields.text(SourceField.SHOP_ID), UNKNOWN_SHOP);
        order.platformAccountId = shopId;
        order.internalAccountId = IdentifierNormalizer.accountId(tenantId, definition.platform(), shopId);
        order.id = OrderFact.surrogateKey(tenantId, orderId, shopId);

        String customerId = stripPrefix(fields.text(SourceField.CUSTOMER_ID), CUSTOMER_GID_PREFIX);
        order.customerKey = IdentifierNormalizer.normalize(tenantId, definition.platform(), customerId);

        order.revenueGross = FieldCasts.decimal(fields.text(SourceField.TOTAL_PRICE));
        order.totalTax = FieldCasts.decimal(fields.text(SourceField.TOTAL_TAX));
        order.totalDiscounts = FieldCasts.decimal(fields.text(SourceField.TOTAL_DISCOUNTS));
        order.revenueNet = order.revenueGross.subtract(order.totalDiscounts).max(BigDecimal.ZERO);
        order.currency = FieldCasts.currency(fields.text(SourceField.CURRENCY));

        order.financialStatus = StringSemantics.lowerTrimOrNull(fields.text(SourceField.FINANCIAL_STATUS));
        order.fulfillmentStatus = StringSemantics.lowerTrimOrNull(fields.text(SourceField.FULFILLMENT_STATUS));
        order.validOrder = order.financialStatus != null && VALID_FINANCIAL_STATUSES.contains(order.financialStatus);

        String rawChannel = StringSemantics.firstNonBlank(
                fields.text(SourceField.CHANNEL), definition.channelDefault());
        order.platformChannel = rawChannel;
        order.canonicalChannel = ChannelClassifier.classify(definition.platform(), rawChannel);

        UtmParameters utm = UtmParameters.fromLandingSite(fields.text(SourceField.LANDING_SITE));
        order.utmSource = utm.source();
        order.utmMedium = utm.medium();
        order.utmCampaign = utm.campaign();
        order.utmTerm = utm.term();
        order.utmContent = utm.content();

        order.ingestedAtMillis = record.emittedAtMillis;
        return Extraction.of(order);
    }

    static String stripPrefix(String value, String prefix) {
        String trimmed = StringSemantics.trimToNull(value);
        if (trimmed != null && trimmed.startsWith(prefix)) {
            return StringSemantics.trimToNull(trimmed.substring(prefix.length()));
        }
        return trimmed;
    }
}
