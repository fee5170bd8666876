package io.marketlens.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import io.marketlens.analytics.channel.ChannelClassifier;
import io.marketlens.analytics.model.RawRecord;
import io.marketlens.analytics.model.StagedAdRow;
import io.marketlens.analytics.source.SourceDefinition;
import io.marketlens.analytics.source.SourceEntityType;
import io.marketlens.analytics.source.SourceField;
import io.marketlens.analytics.tenant.TenantResolver;
import io.marketlens.analytics.util.IdentifierNormalizer;
import io.marketlens.analytics.util.StringSemantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Turns ad-platform raw records into staging rows using the source definition's field mapping.
 *
 * <p>One extractor serves every ad platform. Field casts never fail the record; rows whose tenant,
 * account, campaign or report date cannot be established are dropped with a reason.
 * Tenant registry failures and ambiguous tenant mappings propagate to the caller.</p>
 */
public class AdRecordExtractor implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AdRecordExtractor.class);

    private final TenantResolver tenantResolver;

    public AdRecordExtractor(TenantResolver tenantResolver) {
        this.tenantResolver = tenantResolver;
    }

    public Extraction<StagedAdRow> extract(SourceDefinition definition, RawRecord record) {
        if (definition == null || definition.entityType() != SourceEntityType.AD_PERFORMANCE) {
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
        String platform = definition.platform();

        StagedAdRow row = new StagedAdRow();
        row.tenantId = tenantId;
        row.platform = platform;
        row.platformAccountId = fields.text(SourceField.ACCOUNT_ID);
        row.platformCampaignId = fields.text(SourceField.CAMPAIGN_ID);
        row.platformAdGroupId = fields.text(SourceField.AD_GROUP_ID);
        row.platformAdId = fields.text(SourceField.AD_ID);
        row.reportDate = FieldCasts.date(fields.text(SourceField.REPORT_DATE));

        if (row.platformAccountId == null) {
            return Extraction.dropped(DropReason.MISSING_ACCOUNT, record.ingestionId);
        }
        if (row.platformCampaignId == null) {
            return Extraction.dropped(DropReason.MISSING_CAMPAIGN, record.ingestionId);
        }
        if (row.reportDate == null) {
            return Extraction.dropped(DropReason.MISSING_DATE, record.ingestionId);
        }

        row.internalAccountId = IdentifierNormalizer.accountId(tenantId, platform, row.platformAccountId);
        row.internalCampaignId = IdentifierNormalizer.campaignId(tenantId, platform, row.platformCampaignId);
        row.internalAdGroupId = IdentifierNormalizer.adGroupId(tenantId, platform, row.platformAdGroupId);
        row.internalAdId = IdentifierNormalizer.adId(tenantId, platform, row.platformAdId);

        row.spend = amount(fields, SourceField.SPEND, SourceField.SPEND_MICROS);
        row.impressions = FieldCasts.integer(fields.text(SourceField.IMPRESSIONS));
        row.clicks = FieldCasts.integer(fields.text(SourceField.CLICKS));
        row.conversions = FieldCasts.decimal(fields.text(SourceField.CONVERSIONS));
        row.conversionValue = amount(fields, SourceField.CONVERSION_VALUE, SourceField.CONVERSION_VALUE_MICROS);
        row.platformRoasReported = FieldCasts.nullableDecimal(fields.text(SourceField.PLATFORM_ROAS));
        row.currency = FieldCasts.currency(fields.text(SourceField.CURRENCY));

        row.campaignName = fields.text(SourceField.CAMPAIGN_NAME);
        row.adGroupName = fields.text(SourceField.AD_GROUP_NAME);

        String rawChannel = fields.text(SourceField.CHANNEL);
        if (rawChannel == null) {
            rawChannel = StringSemantics.trimToNull(definition.channelDefault());
            LOG.debug("No channel in payload, using default (source={}, ingestionId={}, default={})",
                    definition.name(), record.ingestionId, rawChannel);
        }
        row.platformChannel = rawChannel;
        row.canonicalChannel = ChannelClassifier.classify(platform, rawChannel);

        row.ingestionId = record.ingestionId;
        row.emittedAtMillis = record.emittedAtMillis;
        return Extraction.of(row);
    }

    // Micro-currency paths take precedence when they carry a value.
    private static BigDecimal amount(PayloadFields fields, SourceField units, SourceField micros) {
        String microsText = fields.text(micros);
        if (microsText != null) {
            return FieldCasts.micros(microsText);
        }
        return FieldCasts.decimal(fields.text(units));
    }
}
