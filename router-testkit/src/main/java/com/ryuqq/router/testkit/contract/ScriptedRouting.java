package com.ryuqq.router.testkit.contract;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.exception.NotFoundException;
import com.ryuqq.router.core.exception.RoutingCancelledException;
import com.ryuqq.router.core.model.AddrInfo;
import com.ryuqq.router.core.model.ContentId;
import com.ryuqq.router.core.model.Multihash;
import com.ryuqq.router.core.model.PeerId;
import com.ryuqq.router.core.model.RoutingOptions;
import com.ryuqq.router.core.spi.ProvideManyRouting;
import com.ryuqq.router.core.spi.Routing;
import com.ryuqq.router.core.stream.ResultChannel;
import com.ryuqq.router.core.stream.ResultStream;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable {@link Routing} test double.
 *
 * <p>Every call waits for the configured delay (observing the call scope), then either
 * throws the configured error or returns the configured result. Calls, completions and
 * cancellations are counted so that tests can verify how a composite drove the backend.</p>
 *
 * <p><strong>Streams:</strong> when an item interval is set, stream items are produced by a
 * background thread that waits between items and stops as soon as the call scope completes.
 * Without an interval the stream is returned already completed.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedRouting slow = new ScriptedRouting("slow")
 *     .withDelay(Duration.ofSeconds(1))
 *     .returning("value".getBytes());
 * ScriptedRouting broken = new ScriptedRouting("broken")
 *     .failingWith(new IllegalStateException("boom"));
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public class ScriptedRouting implements Routing, ProvideManyRouting {

    private static final ExecutorService PRODUCERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "scripted-routing-producer");
        thread.setDaemon(true);
        return thread;
    });

    private final String name;
    private final List<String> journal;
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<Multihash> providedKeys = new CopyOnWriteArrayList<>();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger cancelled = new AtomicInteger();
    private final AtomicInteger streamsCancelled = new AtomicInteger();

    private volatile Duration delay = Duration.ZERO;
    private volatile Duration itemInterval = Duration.ZERO;
    private volatile RuntimeException error;
    private volatile RuntimeException streamError;
    private volatile byte[] value;
    private volatile AddrInfo peer;
    private volatile List<AddrInfo> providers = List.of();
    private volatile List<byte[]> searchResults = List.of();
    private volatile boolean ready = true;

    /**
     * Creates a double with its own journal.
     *
     * @param name the name used in journal entries
     */
    public ScriptedRouting(String name) {
        this(name, new CopyOnWriteArrayList<>());
    }

    /**
     * Creates a double writing {@code name:operation} entries into a shared journal.
     *
     * @param name the name used in journal entries
     * @param journal the shared, thread-safe journal
     */
    public ScriptedRouting(String name, List<String> journal) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (journal == null) {
            throw new IllegalArgumentException("journal cannot be null");
        }
        this.name = name;
        this.journal = journal;
    }

    public ScriptedRouting withDelay(Duration delay) {
        this.delay = delay;
        return this;
    }

    public ScriptedRouting withItemInterval(Duration itemInterval) {
        this.itemInterval = itemInterval;
        return this;
    }

    public ScriptedRouting failingWith(RuntimeException error) {
        this.error = error;
        return this;
    }

    /**
     * Makes streams end with the given failure after all scripted items.
     *
     * @param streamError the stream failure
     * @return this
     */
    public ScriptedRouting failingStreamWith(RuntimeException streamError) {
        this.streamError = streamError;
        return this;
    }

    public ScriptedRouting returning(byte[] value) {
        this.value = value;
        return this;
    }

    public ScriptedRouting returningPeer(AddrInfo peer) {
        this.peer = peer;
        return this;
    }

    public ScriptedRouting providing(List<AddrInfo> providers) {
        this.providers = List.copyOf(providers);
        return this;
    }

    public ScriptedRouting searching(List<byte[]> searchResults) {
        this.searchResults = List.copyOf(searchResults);
        return this;
    }

    public ScriptedRouting ready(boolean ready) {
        this.ready = ready;
        return this;
    }

    @Override
    public void provide(RoutingContext ctx, ContentId cid, boolean announce) {
        perform(ctx, "provide");
    }

    @Override
    public ResultStream<AddrInfo> findProvidersAsync(RoutingContext ctx, ContentId cid, int count) {
        perform(ctx, "findProviders");
        List<AddrInfo> items = providers;
        if (count > 0 && items.size() > count) {
            items = items.subList(0, count);
        }
        return stream(ctx, items);
    }

    @Override
    public AddrInfo findPeer(RoutingContext ctx, PeerId id) {
        perform(ctx, "findPeer");
        AddrInfo result = peer;
        if (result == null) {
            throw new NotFoundException();
        }
        return result;
    }

    @Override
    public void putValue(RoutingContext ctx, String key, byte[] value, RoutingOptions options) {
        perform(ctx, "putValue");
    }

    @Override
    public byte[] getValue(RoutingContext ctx, String key, RoutingOptions options) {
        perform(ctx, "getValue");
        byte[] result = value;
        if (result == null) {
            throw new NotFoundException();
        }
        return result;
    }

    @Override
    public ResultStream<byte[]> searchValue(RoutingContext ctx, String key, RoutingOptions options) {
        perform(ctx, "searchValue");
        return stream(ctx, searchResults);
    }

    @Override
    public void bootstrap(RoutingContext ctx) {
        perform(ctx, "bootstrap");
    }

    @Override
    public void provideMany(RoutingContext ctx, List<Multihash> keys) {
        perform(ctx, "provideMany");
        providedKeys.addAll(keys);
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the operations invoked so far, in arrival order.
     *
     * @return snapshot of operation names
     */
    public List<String> getCalls() {
        return List.copyOf(calls);
    }

    public int getInvocationCount() {
        return calls.size();
    }

    /**
     * Returns how many calls waited out their delay.
     *
     * @return completed call count
     */
    public int getCompletedCount() {
        return completed.get();
    }

    /**
     * Returns how many calls observed their scope completing during the delay.
     *
     * @return cancelled call count
     */
    public int getCancelledCount() {
        return cancelled.get();
    }

    /**
     * Returns how many background producers stopped because their scope completed.
     *
     * @return cancelled stream count
     */
    public int getStreamsCancelledCount() {
        return streamsCancelled.get();
    }

    public List<Multihash> getProvidedKeys() {
        return List.copyOf(providedKeys);
    }

    private void perform(RoutingContext ctx, String operation) {
        calls.add(operation);
        journal.add(name + ":" + operation);
        if (!ctx.sleep(delay)) {
            cancelled.incrementAndGet();
            RoutingCancelledException cause = ctx.error();
            throw cause != null ? cause : RoutingCancelledException.cancelled();
        }
        completed.incrementAndGet();
        RuntimeException failure = error;
        if (failure != null) {
            throw failure;
        }
    }

    private <T> ResultStream<T> stream(RoutingContext ctx, List<T> items) {
        RuntimeException failure = streamError;
        Duration interval = itemInterval;
        if (failure == null && (interval == null || interval.isZero())) {
            return ResultChannel.of(items);
        }
        ResultChannel<T> channel = new ResultChannel<>();
        PRODUCERS.execute(() -> produce(ctx, items, interval, failure, channel));
        return channel;
    }

    private <T> void produce(RoutingContext ctx, List<T> items, Duration interval,
                             RuntimeException failure, ResultChannel<T> channel) {
        for (T item : new ArrayList<>(items)) {
            if (!ctx.sleep(interval) || !channel.send(item, ctx)) {
                if (ctx.isDone()) {
                    streamsCancelled.incrementAndGet();
                }
                channel.complete();
                return;
            }
        }
        if (failure != null) {
            channel.fail(failure);
        } else {
            channel.complete();
        }
    }

    @Override
    public String toString() {
        return "ScriptedRouting{" + name + '}';
    }
}
