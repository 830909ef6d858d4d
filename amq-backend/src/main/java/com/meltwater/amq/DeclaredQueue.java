package com.meltwater.amq;

/**
 * Result of a queue declaration.
 */
public class DeclaredQueue {

    public final String name;
    public final int messageCount;
    public final int consumerCount;

    public DeclaredQueue(String name, int messageCount, int consumerCount) {
        this.name = name;
        this.messageCount = messageCount;
        this.consumerCount = consumerCount;
    }

    @Override
    public String toString() {
        return "{name=" + name + ", messageCount=" + messageCount + ", consumerCount=" + consumerCount + '}';
    }
}
