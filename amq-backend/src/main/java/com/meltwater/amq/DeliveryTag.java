package com.meltwater.amq;

/**
 * Identifies one message delivered on one channel, used to ack, reject or requeue it.
 *
 * A tag is only valid on the channel that issued it.
 */
public final class DeliveryTag {

    private final long channelId;
    private final long value;

    public DeliveryTag(long channelId, long value) {
        this.channelId = channelId;
        this.value = value;
    }

    /**
     * @return the process-unique id of the channel that issued this tag
     */
    public long getChannelId() {
        return channelId;
    }

    /**
     * @return the broker assigned delivery tag
     */
    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeliveryTag that = (DeliveryTag) o;
        return channelId == that.channelId && value == that.value;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(channelId) + Long.hashCode(value);
    }

    @Override
    public String toString() {
        return channelId + ":" + value;
    }
}
