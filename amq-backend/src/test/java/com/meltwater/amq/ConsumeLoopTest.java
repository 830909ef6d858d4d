package com.meltwater.amq;

import org.junit.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ConsumeLoopTest {

    private final AtomicInteger waits = new AtomicInteger();
    private final ConsumeLoop.Waiter countingWaiter = waits::incrementAndGet;

    @Test
    public void bounded_loop_yields_one_signal_per_wait() {
        List<Long> signals = new ArrayList<>();

        for (Long signal : new ConsumeLoop(3, countingWaiter)) {
            signals.add(signal);
        }

        assertThat(signals, contains(1L, 2L, 3L));
        assertThat(waits.get(), is(3));
    }

    @Test
    public void zero_limit_never_waits() throws Exception {
        ConsumeLoop loop = new ConsumeLoop(0, countingWaiter);

        assertFalse(loop.iterator().hasNext());
        assertThat(loop.run(), is(0L));
        assertThat(waits.get(), is(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negative_limit_is_rejected() {
        new ConsumeLoop(-2, countingWaiter);
    }

    @Test
    public void unbounded_loop_runs_until_the_caller_stops() {
        ConsumeLoop loop = new ConsumeLoop(null, countingWaiter);
        Iterator<Long> signals = loop.iterator();

        for (int i = 0; i < 100; i++) {
            assertTrue(signals.hasNext());
            signals.next();
        }

        assertThat(loop.getCompletedWaits(), is(100L));
        assertTrue(loop.hasMore());
    }

    @Test(expected = IllegalStateException.class)
    public void unbounded_loop_can_not_be_run_to_completion() throws Exception {
        new ConsumeLoop(null, countingWaiter).run();
    }

    @Test(expected = NoSuchElementException.class)
    public void waiting_past_the_limit_fails() throws Exception {
        ConsumeLoop loop = new ConsumeLoop(1, countingWaiter);
        loop.waitNext();
        loop.waitNext();
    }

    @Test(expected = IllegalStateException.class)
    public void loop_can_only_be_iterated_once() {
        ConsumeLoop loop = new ConsumeLoop(2, countingWaiter);
        loop.iterator();
        loop.iterator();
    }

    @Test
    public void wait_failure_surfaces_from_the_iterator() {
        ConsumeLoop loop = new ConsumeLoop(5, () -> {
            throw new ConsumeTimeoutException(10);
        });

        try {
            loop.iterator().next();
            fail("expected the wait failure to surface");
        } catch (UncheckedIOException e) {
            assertThat(e.getCause(), instanceOf(ConsumeTimeoutException.class));
        }
        assertThat(loop.getCompletedWaits(), is(0L));
    }

    @Test
    public void observable_stops_waiting_when_unsubscribed() {
        List<Long> signals = new ConsumeLoop(null, countingWaiter)
                .asObservable()
                .take(2)
                .toList()
                .toBlocking()
                .single();

        assertThat(signals, contains(1L, 2L));
        assertThat(waits.get(), is(2));
    }

    @Test
    public void observable_reports_wait_failures_as_errors() {
        AtomicInteger attempts = new AtomicInteger();
        ConsumeLoop loop = new ConsumeLoop(3, () -> {
            if (attempts.incrementAndGet() == 2) {
                throw new IOException("connection lost");
            }
        });

        Throwable error = loop.asObservable()
                .ignoreElements()
                .materialize()
                .toBlocking()
                .first()
                .getThrowable();

        assertThat(error, instanceOf(UncheckedIOException.class));
        assertThat(attempts.get(), is(2));
        assertThat(loop.getCompletedWaits(), is(0L));
    }

    @Test
    public void observable_can_be_subscribed_more_than_once() {
        ConsumeLoop loop = new ConsumeLoop(2, countingWaiter);

        List<Long> first = loop.asObservable().toList().toBlocking().single();
        List<Long> second = loop.asObservable().toList().toBlocking().single();

        assertThat(first, contains(1L, 2L));
        assertThat(second, contains(1L, 2L));
        assertThat(waits.get(), is(4));
        assertThat(loop.iterator().hasNext(), is(true));
    }

    @Test
    public void observable_retry_starts_a_fresh_loop() {
        AtomicInteger attempts = new AtomicInteger();
        ConsumeLoop loop = new ConsumeLoop(2, () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new ConsumeTimeoutException(10);
            }
        });

        List<Long> signals = loop.asObservable().retry(1).toList().toBlocking().single();

        assertThat(signals, contains(1L, 2L));
        assertThat(attempts.get(), is(3));
    }
}
