package com.meltwater.amq.impl;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;

import java.util.concurrent.BlockingQueue;

/**
 * Hands everything the broker sends to one consumer over to the thread driving the consume loop.
 *
 * Runs on the client's consumer dispatch thread, so it must only touch the event queue.
 */
class DispatchingConsumer extends DefaultConsumer {

    private final BlockingQueue<ChannelEvent> events;
    private final boolean noAck;

    DispatchingConsumer(Channel channel, BlockingQueue<ChannelEvent> events, boolean noAck) {
        super(channel);
        this.events = events;
        this.noAck = noAck;
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        events.add(ChannelEvent.delivery(consumerTag, noAck, new Delivery(envelope, properties, body)));
    }

    @Override
    public void handleCancel(String consumerTag) {
        events.add(ChannelEvent.cancelledByBroker(consumerTag));
    }
}
