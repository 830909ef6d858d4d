package com.meltwater.amq;

/**
 * Thrown when an operation is attempted on a channel that has been closed, either by the caller or by the broker.
 *
 * A closed channel is never re-opened by the backend that owned it.
 */
public class ChannelClosedException extends ProtocolException {

    public ChannelClosedException(String message) {
        super(UNKNOWN_REPLY_CODE, message);
    }

    public ChannelClosedException(int replyCode, String message, Throwable cause) {
        super(replyCode, message, cause);
    }
}
