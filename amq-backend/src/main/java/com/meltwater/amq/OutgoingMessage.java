package com.meltwater.amq;

import com.rabbitmq.client.AMQP;

/**
 * A message prepared for publishing.
 *
 * @see Backend#prepareMessage(byte[], DeliveryMode, Integer, String, String)
 */
public class OutgoingMessage {

    public final byte[] body;
    public final AMQP.BasicProperties properties;

    public OutgoingMessage(byte[] body, AMQP.BasicProperties properties) {
        this.body = body == null ? new byte[0] : body;
        this.properties = properties == null ? new AMQP.BasicProperties() : properties;
    }
}
