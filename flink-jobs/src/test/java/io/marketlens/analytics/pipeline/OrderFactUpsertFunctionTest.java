package io.marketlens.analytics.pipeline;

import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.streaming.util.KeyedOneInputStreamOperatorTestHarness;
import org.apache.flink.streaming.util.ProcessFunctionTestHarnesses;
import org.junit.jupiter.api.Test;

import io.marketlens.analytics.config.PipelineConfig;
import io.marketlens.analytics.model.OrderFact;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrderFactUpsertFunctionTest {

    @Test
    void finalizedOrderKeepsRevenueAndAcceptsStatusChanges() throws Exception {
        try (KeyedOneInputStreamOperatorTestHarness<String, OrderFact, OrderFact> harness =
                ProcessFunctionTestHarnesses.forKeyedProcessFunction(
                        new OrderFactUpsertFunction(PipelineConfig.fromMap(Map.of())),
                        (OrderFact o) -> o.id,
                        Types.STRING)) {

            harness.open();

            OrderFact closed = order(100L, "100.00", "paid");
            closed.closedAt = Instant.parse("2024-03-06T00:00:00Z");
            harness.processElement(closed, 0L);
            harness.processElement(order(50L, "80.00", "paid"), 0L);
            harness.processElement(order(200L, "999.00", "refunded"), 0L);

            List<OrderFact> emitted = harness.extractOutputValues();
            assertEquals(2, emitted.size());
            OrderFact latest = emitted.get(1);
            assertEquals(0, new BigDecimal("100.00").compareTo(latest.revenueGross));
            assertEquals("refunded", latest.financialStatus);
            assertEquals(200L, latest.ingestedAtMillis);
        }
    }

    @Test
    void openOrderIsReplacedByNewerEmission() throws Exception {
        try (KeyedOneInputStreamOperatorTestHarness<String, OrderFact, OrderFact> harness =
                ProcessFunctionTestHarnesses.forKeyedProcessFunction(
                        new OrderFactUpsertFunction(PipelineConfig.fromMap(Map.of())),
                        (OrderFact o) -> o.id,
                        Types.STRING)) {

            harness.open();

            harness.processElement(order(100L, "100.00", "pending"), 0L);
            harness.processElement(order(200L, "120.00", "paid"), 0L);

            List<OrderFact> emitted = harness.extractOutputValues();
            assertEquals(2, emitted.size());
            assertEquals(0, new BigDecimal("120.00").compareTo(emitted.get(1).revenueGross));
        }
    }

    private static OrderFact order(long ingestedAt, String gross, String financialStatus) {
        OrderFact order = new OrderFact();
        order.tenantId = "tenant-a";
        order.sourcePlatform = "shopify";
        order.orderId = "1001";
        order.platformAccountId = "shop-9";
        order.id = OrderFact.surrogateKey(order.tenantId, order.orderId, order.platformAccountId);
        order.revenueGross = new BigDecimal(gross);
        order.financialStatus = financialStatus;
        order.ingestedAtMillis = ingestedAt;
        return order;
    }
}
