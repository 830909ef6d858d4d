package com.meltwater.amq;

import java.io.IOException;

/**
 * Settles the delivery of one {@link Message}. Exactly one of the methods may be called, and only once.
 *
 * @see Backend#ack(DeliveryTag)
 * @see Backend#reject(DeliveryTag)
 * @see Backend#requeue(DeliveryTag)
 */
public interface Acknowledger {

    void ack() throws IOException;

    void reject() throws IOException;

    void requeue() throws IOException;
}
