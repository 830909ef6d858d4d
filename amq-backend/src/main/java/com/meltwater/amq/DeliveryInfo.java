package com.meltwater.amq;

import com.google.common.collect.ImmutableMap;

/**
 * Where a received message came from. Fields the broker did not report are empty strings, {@code false} or {@code null}.
 */
public class DeliveryInfo {

    public static final DeliveryInfo EMPTY = new DeliveryInfo("", "", false, null, null);

    public final String exchange;
    public final String routingKey;
    public final boolean redelivered;
    /**
     * The consumer tag for consumed messages, {@code null} for messages fetched with {@link Backend#get(String, boolean)}.
     */
    public final String consumerTag;
    /**
     * The number of messages left in the queue for fetched messages, {@code null} for consumed messages.
     */
    public final Integer messageCount;

    public DeliveryInfo(String exchange, String routingKey, boolean redelivered, String consumerTag, Integer messageCount) {
        this.exchange = exchange == null ? "" : exchange;
        this.routingKey = routingKey == null ? "" : routingKey;
        this.redelivered = redelivered;
        this.consumerTag = consumerTag;
        this.messageCount = messageCount;
    }

    public ImmutableMap<String, Object> asMap() {
        ImmutableMap.Builder<String, Object> map = ImmutableMap.<String, Object>builder()
                .put("exchange", exchange)
                .put("routing_key", routingKey)
                .put("redelivered", redelivered);
        if (consumerTag != null) {
            map.put("consumer_tag", consumerTag);
        }
        if (messageCount != null) {
            map.put("message_count", messageCount);
        }
        return map.build();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
