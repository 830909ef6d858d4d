package com.meltwater.amq;

import com.rabbitmq.client.Delivery;

import java.io.IOException;

/**
 * Callback of a consumer registration. Invoked on the thread driving the {@link ConsumeLoop};
 * exceptions thrown here abort the current wait and propagate to the caller of the loop.
 *
 * The raw delivery can be turned into a {@link Message} with {@link Backend#toMessage(String, Delivery)}.
 */
@FunctionalInterface
public interface DeliveryListener {

    void onDelivery(String consumerTag, Delivery delivery) throws IOException;
}
