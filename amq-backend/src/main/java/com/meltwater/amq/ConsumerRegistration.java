package com.meltwater.amq;

/**
 * A consumer registered on a channel with {@link Backend#declareConsumer(String, boolean, DeliveryListener, String, boolean)}.
 * Lives until it is cancelled or the channel closes.
 */
public class ConsumerRegistration {

    public final String queue;
    public final boolean noAck;
    public final DeliveryListener callback;
    public final String consumerTag;
    public final boolean noWait;

    public ConsumerRegistration(String queue, boolean noAck, DeliveryListener callback, String consumerTag, boolean noWait) {
        this.queue = queue;
        this.noAck = noAck;
        this.callback = callback;
        this.consumerTag = consumerTag;
        this.noWait = noWait;
    }

    /**
     * @return a copy carrying the tag the broker assigned, used when the registration asked for a server generated tag
     */
    public ConsumerRegistration withConsumerTag(String brokerTag) {
        return new ConsumerRegistration(queue, noAck, callback, brokerTag, noWait);
    }

    @Override
    public String toString() {
        return "{queue=" + queue + ", consumerTag=" + consumerTag + ", noAck=" + noAck + ", noWait=" + noWait + '}';
    }
}
