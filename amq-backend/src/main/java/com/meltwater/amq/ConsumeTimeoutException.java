package com.meltwater.amq;

import java.io.IOException;

/**
 * No channel event arrived within the configured wait timeout.
 *
 * @see BackendSettings#wait_timeout_millis
 */
public class ConsumeTimeoutException extends IOException {

    public ConsumeTimeoutException(long waitedMillis) {
        super("No broker event received within " + waitedMillis + " ms");
    }
}
