package io.marketlens.analytics.attribution;

import io.marketlens.analytics.model.AttributionRecord;
import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.OrderFact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Allocates order revenue to campaigns under the last-click, linear and time-decay models.
 *
 * <p>Each order's last-click assignment seeds the run. Unattributed orders get a single
 * unattributed last-click record and take no part in multi-touch allocation. For attributed
 * orders, every campaign-date row with spend in the trailing window is an entry; entries of one
 * campaign collapse into one record whose weight is the sum of their normalized weights. With no
 * entries in the window, the last-click campaign receives weight 1.0.</p>
 *
 * <p>Orders only ever see campaign facts of their own tenant.</p>
 */
public class AttributionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(AttributionEngine.class);
    private static final int REVENUE_SCALE = 4;

    private final AttributionSettings settings;
    private final LastClickResolver lastClickResolver;
    private final List<WeightingScheme> schemes;

    public AttributionEngine(AttributionSettings settings, LastClickResolver lastClickResolver) {
        this.settings = settings;
        this.lastClickResolver = lastClickResolver;
        this.schemes = List.of(new LinearAttribution(), new TimeDecayAttribution(settings.decayRate()));
    }

    public List<AttributionRecord> attribute(Collection<OrderFact> orders, Collection<CampaignPerformanceFact> campaigns) {
        CampaignActivityIndex index = new CampaignActivityIndex(campaigns);
        List<AttributionRecord> records = new ArrayList<>();
        int unattributed = 0;
        int fallbacks = 0;
        for (OrderFact order : orders) {
            if (order.tenantId == null || order.orderId == null) {
                continue;
            }
            LastClickAssignment assignment = lastClickResolver.resolve(order, index.forTenant(order.tenantId));
            if (!assignment.isAttributed()) {
                records.add(unattributedRecord(order));
                unattributed++;
                continue;
            }
            records.add(lastClickCredit(assignment, AttributionModel.LAST_CLICK));

            List<WindowEntry> entries = index.windowEntries(order.tenantId, order.orderDate, settings.windowDays());
            for (WeightingScheme scheme : schemes) {
                if (entries.isEmpty()) {
                    records.add(lastClickCredit(assignment, scheme.model()));
                } else {
                    records.addAll(allocate(order, entries, scheme));
                }
            }
            if (entries.isEmpty()) {
                fallbacks++;
            }
        }
        LOG.info("Attribution complete (orders={}, records={}, unattributed={}, windowFallbacks={})",
                orders.size(), records.size(), unattributed, fallbacks);
        return records;
    }

    List<AttributionRecord> allocate(OrderFact order, List<WindowEntry> entries, WeightingScheme scheme) {
        double totalRaw = 0.0;
        Map<String, CampaignShare> shares = new LinkedHashMap<>();
        for (WindowEntry entry : entries) {
            double raw = scheme.rawWeight(entry);
            totalRaw += raw;
            shares.computeIfAbsent(entry.campaignKey(), k -> new CampaignShare()).add(entry, raw);
        }

        BigDecimal revenue = revenueOf(order);
        List<AttributionRecord> records = new ArrayList<>(shares.size());
        for (CampaignShare share : shares.values()) {
            AttributionRecord record = base(order, scheme.model(), share.latest.fact());
            record.daysBeforeOrder = share.latest.daysBeforeOrder();
            record.attributionWeight = share.rawWeight / totalRaw;
            record.attributedRevenue = revenue
                    .multiply(BigDecimal.valueOf(share.rawWeight))
                    .divide(BigDecimal.valueOf(totalRaw), REVENUE_SCALE, RoundingMode.HALF_UP);
            record.totalCampaignsInWindow = shares.size();
            record.windowEntries = entries.size();
            records.add(record);
        }
        return records;
    }

    // Full credit to the last-click campaign: the baseline model and the empty-window fallback.
    private AttributionRecord lastClickCredit(LastClickAssignment assignment, AttributionModel model) {
        OrderFact order = assignment.order();
        CampaignPerformanceFact campaign = assignment.campaign();
        AttributionRecord record = base(order, model, campaign);
        if (order.orderDate != null && campaign.performanceDate != null) {
            record.daysBeforeOrder = (int) ChronoUnit.DAYS.between(campaign.performanceDate, order.orderDate);
        }
        record.attributionWeight = 1.0;
        record.attributedRevenue = revenueOf(order);
        record.totalCampaignsInWindow = 1;
        return record;
    }

    private AttributionRecord unattributedRecord(OrderFact order) {
        AttributionRecord record = base(order, AttributionModel.LAST_CLICK, null);
        record.attributionStatus = AttributionRecord.STATUS_UNATTRIBUTED;
        record.attributionWeight = 0.0;
        record.attributedRevenue = BigDecimal.ZERO.setScale(REVENUE_SCALE);
        record.totalCampaignsInWindow = 0;
        return record;
    }

    private static AttributionRecord base(OrderFact order, AttributionModel model, CampaignPerformanceFact campaign) {
        AttributionRecord record = new AttributionRecord();
        record.tenantId = order.tenantId;
        record.orderId = order.orderId;
        record.orderCreatedAt = order.createdAt;
        record.currency = order.currency;
        record.revenue = revenueOf(order);
        record.attributionModel = model.value();
        record.attributionStatus = AttributionRecord.STATUS_ATTRIBUTED;
        if (campaign != null) {
            record.campaignFactId = campaign.id;
            record.campaignId = campaign.campaignId;
            record.campaignName = campaign.campaignName;
            record.platform = campaign.platform;
            record.adAccountId = campaign.adAccountId;
            record.campaignPerformanceDate = campaign.performanceDate;
        }
        String campaignKey = campaign == null ? null : WindowEntry.campaignKey(campaign);
        record.id = AttributionRecord.recordId(order.orderId, campaignKey, order.tenantId, model.value());
        return record;
    }

    private static BigDecimal revenueOf(OrderFact order) {
        BigDecimal gross = order.revenueGross == null ? BigDecimal.ZERO : order.revenueGross;
        return gross.setScale(REVENUE_SCALE, RoundingMode.HALF_UP);
    }

    private static final class CampaignShare {
        private double rawWeight;
        private WindowEntry latest;

        void add(WindowEntry entry, double raw) {
            rawWeight += raw;
            if (latest == null || entry.daysBeforeOrder() < latest.daysBeforeOrder()) {
                latest = entry;
            }
        }
    }
}
