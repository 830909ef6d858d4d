package com.meltwater.amq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;

import java.io.IOException;

/**
 * A channel or connection level error reported by the broker, or an equivalent error detected locally
 * (for example settling a delivery tag twice).
 *
 * Protocol errors are never retried or recovered by the backend.
 */
public class ProtocolException extends IOException {

    public static final int UNKNOWN_REPLY_CODE = -1;

    private final int replyCode;

    public ProtocolException(int replyCode, String message) {
        super(message);
        this.replyCode = replyCode;
    }

    public ProtocolException(int replyCode, String message, Throwable cause) {
        super(message, cause);
        this.replyCode = replyCode;
    }

    /**
     * @return the AMQP reply code, for example {@link AMQP#NOT_FOUND}, or {@link #UNKNOWN_REPLY_CODE}
     */
    public int getReplyCode() {
        return replyCode;
    }

    /**
     * Extracts the reply code from the close method carried by a shutdown signal.
     */
    public static int replyCodeOf(ShutdownSignalException signal) {
        Method reason = signal.getReason();
        if (reason instanceof AMQP.Channel.Close) {
            return ((AMQP.Channel.Close) reason).getReplyCode();
        }
        if (reason instanceof AMQP.Connection.Close) {
            return ((AMQP.Connection.Close) reason).getReplyCode();
        }
        return UNKNOWN_REPLY_CODE;
    }
}
