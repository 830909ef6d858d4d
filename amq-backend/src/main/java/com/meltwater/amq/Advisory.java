package com.meltwater.amq;

/**
 * A non-fatal condition that callers may want to know about. Advisories never interrupt the operation that raised them.
 */
public class Advisory {

    public enum Type {
        /**
         * A queue with that name already exists, so a recently changed routing key or other settings might be
         * ignored unless the queue is renamed or the broker restarted.
         */
        QUEUE_ALREADY_EXISTS,
        /**
         * A message published with the mandatory flag was returned as unroutable and nobody was waiting for a confirm.
         */
        MESSAGE_RETURNED
    }

    public final Type type;
    public final String subject;
    public final String description;

    public Advisory(Type type, String subject, String description) {
        this.type = type;
        this.subject = subject;
        this.description = description;
    }

    public static Advisory queueAlreadyExists(String queue) {
        return new Advisory(Type.QUEUE_ALREADY_EXISTS, queue,
                "A queue with that name already exists, so a recently changed routing_key or other settings might be "
                        + "ignored unless you rename the queue or restart the broker.");
    }

    public static Advisory messageReturned(String exchange, String routingKey, int replyCode, String replyText) {
        return new Advisory(Type.MESSAGE_RETURNED, exchange + "/" + routingKey,
                "Message returned by broker with " + replyCode + " " + replyText);
    }

    @Override
    public String toString() {
        return type + "(" + subject + "): " + description;
    }
}
