package com.meltwater.amq;

import com.rabbitmq.client.BasicProperties;

/**
 * Maps the integer delivery mode codes to descriptive names.
 *
 * @see BasicProperties#getDeliveryMode()
 * @see <a href="https://www.rabbitmq.com/amqp-0-9-1-reference.html">AMQP 0-9-1 reference</a>
 */
public enum DeliveryMode {
    non_persistent(1),
    persistent(2);

    public final int code;

    DeliveryMode(int code) {
        this.code = code;
    }

    public static DeliveryMode fromCode(int code) {
        for (DeliveryMode mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown delivery mode " + code);
    }
}
