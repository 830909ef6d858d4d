package com.meltwater.amq.util;

import org.junit.Test;

import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.assertThat;

public class LoggerTest {

    private final Logger log = new Logger(LoggerTest.class);

    @Test
    public void renders_parameters_after_the_message() {
        String text = log.buildLogMessage("Channel opened.", new Object[]{"channelNr", 3, "queue", "jobs", "confirms", true});

        assertThat(text, equalTo("Channel opened. [ channelNr=3, queue=\"jobs\", confirms=true ]"));
    }

    @Test
    public void renders_byte_arrays_by_size() {
        String text = log.buildLogMessage("Published.", new Object[]{"body", new byte[12], "exchange", null});

        assertThat(text, equalTo("Published. [ body=byte[12], exchange=null ]"));
    }

    @Test
    public void message_without_parameters_is_unchanged() {
        assertThat(log.buildLogMessage("Closed.", new Object[0]), equalTo("Closed."));
    }

    @Test(expected = IllegalArgumentException.class)
    public void parameters_must_come_in_pairs() {
        log.buildLogMessage("Broken.", new Object[]{"key"});
    }

    @Test
    public void unpaired_parameters_do_not_break_logging() {
        log.warnWithParams("Still logged.", "key");
    }
}
