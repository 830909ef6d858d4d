package com.meltwater.amq.impl;

import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Something the client's dispatch thread received for a channel, queued until the consume loop picks it up.
 */
final class ChannelEvent {

    enum Kind {
        DELIVERY,
        CANCELLED_BY_BROKER,
        SHUTDOWN
    }

    final Kind kind;
    final String consumerTag;
    final boolean noAck;
    final Delivery delivery;
    final ShutdownSignalException signal;

    private ChannelEvent(Kind kind, String consumerTag, boolean noAck, Delivery delivery, ShutdownSignalException signal) {
        this.kind = kind;
        this.consumerTag = consumerTag;
        this.noAck = noAck;
        this.delivery = delivery;
        this.signal = signal;
    }

    static ChannelEvent delivery(String consumerTag, boolean noAck, Delivery delivery) {
        return new ChannelEvent(Kind.DELIVERY, consumerTag, noAck, delivery, null);
    }

    static ChannelEvent cancelledByBroker(String consumerTag) {
        return new ChannelEvent(Kind.CANCELLED_BY_BROKER, consumerTag, false, null, null);
    }

    static ChannelEvent shutdown(ShutdownSignalException signal) {
        return new ChannelEvent(Kind.SHUTDOWN, null, false, null, signal);
    }

    @Override
    public String toString() {
        return "{kind=" + kind + ", consumerTag=" + consumerTag + '}';
    }
}
