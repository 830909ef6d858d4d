package com.meltwater.amq;

import com.google.common.base.Preconditions;
import rx.Observable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Drives consumption of the consumers registered on a {@link Backend}.
 *
 * Every step performs one blocking wait for the next channel event and dispatches it to the matching
 * {@link DeliveryListener} on the calling thread. A step yields the number of waits completed so far; it is a
 * progress signal and not a message count, since a wait can dispatch no delivery at all (a broker side cancel
 * for example).
 *
 * The loop is bounded by an optional limit:
 * <ul>
 *     <li>{@code null}: unbounded, runs until the caller stops iterating or a wait fails</li>
 *     <li>{@code 0}: no waits at all</li>
 *     <li>{@code n > 0}: exactly n waits</li>
 * </ul>
 *
 * A loop can only be iterated once. Call {@link Backend#consume(Integer)} again for a new one.
 *
 * Cancelling the last consumer does not end an unbounded loop. Set
 * {@link BackendSettings#wait_timeout_millis} to have waits fail with {@link ConsumeTimeoutException} instead of
 * blocking forever.
 */
public class ConsumeLoop implements Iterable<Long> {

    /**
     * Performs one blocking wait and dispatches what it received.
     */
    @FunctionalInterface
    public interface Waiter {
        void waitForEvent() throws IOException;
    }

    private final Integer limit;
    private final Waiter waiter;
    private long completedWaits;
    private boolean iterated;

    public ConsumeLoop(Integer limit, Waiter waiter) {
        Preconditions.checkArgument(limit == null || limit >= 0, "limit must be null or >= 0 but was %s", limit);
        Preconditions.checkNotNull(waiter, "waiter");
        this.limit = limit;
        this.waiter = waiter;
    }

    public Integer getLimit() {
        return limit;
    }

    public long getCompletedWaits() {
        return completedWaits;
    }

    public boolean hasMore() {
        return limit == null || completedWaits < limit;
    }

    /**
     * Performs the next wait.
     *
     * @return the number of waits completed, including this one
     * @throws NoSuchElementException if the limit has been reached
     * @throws IOException if the wait or the dispatched callback failed
     */
    public long waitNext() throws IOException {
        if (!hasMore()) {
            throw new NoSuchElementException("Consume limit of " + limit + " reached");
        }
        waiter.waitForEvent();
        return ++completedWaits;
    }

    /**
     * Waits until the limit is reached.
     *
     * @return the number of waits completed
     * @throws IllegalStateException if the loop is unbounded
     */
    public long run() throws IOException {
        Preconditions.checkState(limit != null, "run() needs a limit, iterate an unbounded loop instead");
        while (hasMore()) {
            waitNext();
        }
        return completedWaits;
    }

    /**
     * Wait failures surface as {@link UncheckedIOException} from {@link Iterator#next()}.
     */
    @Override
    public synchronized Iterator<Long> iterator() {
        Preconditions.checkState(!iterated, "A consume loop can only be iterated once");
        iterated = true;
        return new Iterator<Long>() {
            @Override
            public boolean hasNext() {
                return hasMore();
            }

            @Override
            public Long next() {
                try {
                    return waitNext();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        };
    }

    /**
     * The loop as a cold {@link Observable}. Every subscription drives a fresh loop with the same limit and waiter,
     * so the observable can be resubscribed ({@code retry()}, {@code repeat()}). The counters of this instance are
     * not touched.
     *
     * Waits run on the subscribing thread and stop when the subscriber unsubscribes (after the wait in progress
     * completes).
     */
    public Observable<Long> asObservable() {
        return Observable.defer(() -> Observable.from(new ConsumeLoop(limit, waiter)));
    }
}
