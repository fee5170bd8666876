package io.marketlens.analytics.pipeline;

import org.apache.flink.api.common.state.StateTtlConfig;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.marketlens.analytics.config.PipelineConfig;
import io.marketlens.analytics.merge.FactMerger;
import io.marketlens.analytics.model.OrderFact;

/**
 * Keyed by order surrogate key. Emits the merged order whenever a newer emission changes it.
 */
public class OrderFactUpsertFunction extends KeyedProcessFunction<String, OrderFact, OrderFact> {
    private static final Logger LOG = LoggerFactory.getLogger(OrderFactUpsertFunction.class);

    private final PipelineConfig config;
    private transient ValueState<OrderFact> current;

    public OrderFactUpsertFunction(PipelineConfig config) {
        this.config = config;
    }

    @Override
    public void open(org.apache.flink.configuration.Configuration parameters) {
        StateTtlConfig ttlConfig = StateTtlConfig
                .newBuilder(Time.days(config.factStateTtlDays))
                .setUpdateType(StateTtlConfig.UpdateType.OnCreateAndWrite)
                .setStateVisibility(StateTtlConfig.StateVisibility.NeverReturnExpired)
                .build();
        ValueStateDescriptor<OrderFact> descriptor = new ValueStateDescriptor<>("order-fact", OrderFact.class);
        descriptor.enableTimeToLive(ttlConfig);
        current = getRuntimeContext().getState(descriptor);
    }

    @Override
    public void processElement(OrderFact incoming, Context ctx, Collector<OrderFact> out) throws Exception {
        OrderFact existing = current.value();
        OrderFact merged = existing == null ? incoming : FactMerger.mergeOrder(existing, incoming);
        if (merged == existing) {
            LOG.debug("Order unchanged by emission (orderId={}, tenant={})", incoming.orderId, incoming.tenantId);
            return;
        }
        current.update(merged);
        out.collect(merged);
    }
}
