package com.meltwater.amq;

/**
 * A message published with the mandatory flag was returned by the broker because it could not be routed to any queue.
 */
public class UnroutableMessageException extends ProtocolException {

    private final String exchange;
    private final String routingKey;

    public UnroutableMessageException(int replyCode, String replyText, String exchange, String routingKey) {
        super(replyCode, "Message returned by broker: " + replyText + " [exchange=" + exchange + ", routingKey=" + routingKey + "]");
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }
}
