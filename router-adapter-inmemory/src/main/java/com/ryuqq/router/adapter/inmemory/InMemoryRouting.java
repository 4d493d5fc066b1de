package com.ryuqq.router.adapter.inmemory;

import com.ryuqq.router.core.context.RoutingContext;
import com.ryuqq.router.core.exception.NotFoundException;
import com.ryuqq.router.core.model.AddrInfo;
import com.ryuqq.router.core.model.ContentId;
import com.ryuqq.router.core.model.Multihash;
import com.ryuqq.router.core.model.PeerId;
import com.ryuqq.router.core.model.RoutingOptions;
import com.ryuqq.router.core.spi.ProvideManyRouting;
import com.ryuqq.router.core.spi.Routing;
import com.ryuqq.router.core.stream.ResultChannel;
import com.ryuqq.router.core.stream.ResultStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link Routing} for testing and reference purposes.
 *
 * <p>This implementation keeps provider records, known peers and stored values in
 * {@link ConcurrentHashMap}s. Every provide call records the configured self address
 * as a provider of the content.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>providers:</strong> ConcurrentHashMap&lt;Multihash, Set&lt;AddrInfo&gt;&gt; - providers per content hash</li>
 *   <li><strong>peers:</strong> ConcurrentHashMap&lt;PeerId, AddrInfo&gt; - registered peer addresses</li>
 *   <li><strong>values:</strong> ConcurrentHashMap&lt;String, byte[]&gt; - stored records (defensively copied)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No network: the {@code offline} option has no effect</li>
 *   <li>No record validation or expiry</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRouting routing = new InMemoryRouting(AddrInfo.of(PeerId.of("self"), "/ip4/127.0.0.1/tcp/4001"));
 * routing.provide(ctx, cid, true);
 * List&lt;AddrInfo&gt; providers = routing.findProvidersAsync(ctx, cid, 0).drain();
 * </pre>
 *
 * @author Router Team
 * @since 1.0.0
 */
public class InMemoryRouting implements Routing, ProvideManyRouting {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRouting.class);

    private final AddrInfo self;
    private final ConcurrentHashMap<Multihash, Set<AddrInfo>> providers;
    private final ConcurrentHashMap<PeerId, AddrInfo> peers;
    private final ConcurrentHashMap<String, byte[]> values;
    private final AtomicInteger bootstrapCount;

    /**
     * Creates a new InMemoryRouting with empty storage.
     *
     * @param self the address recorded as provider on every provide call
     * @throws IllegalArgumentException if self is null or empty
     */
    public InMemoryRouting(AddrInfo self) {
        if (self == null || self.isEmpty()) {
            throw new IllegalArgumentException("self cannot be null or empty");
        }
        this.self = self;
        this.providers = new ConcurrentHashMap<>();
        this.peers = new ConcurrentHashMap<>();
        this.values = new ConcurrentHashMap<>();
        this.bootstrapCount = new AtomicInteger();
        this.peers.put(self.id(), self);
    }

    /**
     * Registers a peer so that {@link #findPeer(RoutingContext, PeerId)} can resolve it.
     *
     * @param peer the peer address
     * @throws IllegalArgumentException if peer is null or empty
     */
    public void addPeer(AddrInfo peer) {
        if (peer == null || peer.isEmpty()) {
            throw new IllegalArgumentException("peer cannot be null or empty");
        }
        peers.put(peer.id(), peer);
    }

    /**
     * Records an additional provider for the content, as if learned from the network.
     *
     * @param cid the content
     * @param provider the provider address
     * @throws IllegalArgumentException if an argument is null or provider is empty
     */
    public void addProvider(ContentId cid, AddrInfo provider) {
        requireArgument(cid, "cid");
        if (provider == null || provider.isEmpty()) {
            throw new IllegalArgumentException("provider cannot be null or empty");
        }
        providers.computeIfAbsent(cid.hash(), k -> ConcurrentHashMap.newKeySet()).add(provider);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Does nothing when {@code announce} is false.</p>
     */
    @Override
    public void provide(RoutingContext ctx, ContentId cid, boolean announce) {
        requireArgument(ctx, "ctx");
        requireArgument(cid, "cid");
        ctx.throwIfDone();
        if (!announce) {
            return;
        }
        record(cid.hash());
    }

    @Override
    public ResultStream<AddrInfo> findProvidersAsync(RoutingContext ctx, ContentId cid, int count) {
        requireArgument(ctx, "ctx");
        requireArgument(cid, "cid");
        ctx.throwIfDone();
        Set<AddrInfo> known = providers.get(cid.hash());
        if (known == null) {
            return ResultChannel.empty();
        }
        List<AddrInfo> snapshot = new ArrayList<>();
        for (AddrInfo provider : known) {
            if (count > 0 && snapshot.size() >= count) {
                break;
            }
            snapshot.add(provider);
        }
        return ResultChannel.of(snapshot);
    }

    @Override
    public AddrInfo findPeer(RoutingContext ctx, PeerId id) {
        requireArgument(ctx, "ctx");
        requireArgument(id, "id");
        ctx.throwIfDone();
        AddrInfo peer = peers.get(id);
        if (peer == null) {
            throw new NotFoundException("routing: peer not found: " + id);
        }
        return peer;
    }

    @Override
    public void putValue(RoutingContext ctx, String key, byte[] value, RoutingOptions options) {
        requireArgument(ctx, "ctx");
        requireArgument(key, "key");
        requireArgument(value, "value");
        ctx.throwIfDone();
        values.put(key, value.clone());
    }

    @Override
    public byte[] getValue(RoutingContext ctx, String key, RoutingOptions options) {
        requireArgument(ctx, "ctx");
        requireArgument(key, "key");
        ctx.throwIfDone();
        byte[] value = values.get(key);
        if (value == null) {
            throw new NotFoundException("routing: value not found: " + key);
        }
        return value.clone();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Returns a completed stream holding the single stored value.</p>
     *
     * @throws NotFoundException if no value is stored under the key
     */
    @Override
    public ResultStream<byte[]> searchValue(RoutingContext ctx, String key, RoutingOptions options) {
        return ResultChannel.of(List.of(getValue(ctx, key, options)));
    }

    @Override
    public void bootstrap(RoutingContext ctx) {
        requireArgument(ctx, "ctx");
        ctx.throwIfDone();
        int count = bootstrapCount.incrementAndGet();
        log.debug("Bootstrapped in-memory routing {} (count={})", self.id(), count);
    }

    @Override
    public void provideMany(RoutingContext ctx, List<Multihash> keys) {
        requireArgument(ctx, "ctx");
        requireArgument(keys, "keys");
        for (Multihash key : keys) {
            ctx.throwIfDone();
            record(key);
        }
    }

    /**
     * Always ready.
     *
     * @return true
     */
    @Override
    public boolean isReady() {
        return true;
    }

    /**
     * Returns the self address recorded on provide.
     *
     * @return self address
     */
    public AddrInfo getSelf() {
        return self;
    }

    /**
     * Returns the number of bootstrap calls so far.
     *
     * @return bootstrap count
     */
    public int getBootstrapCount() {
        return bootstrapCount.get();
    }

    /**
     * Checks whether a value is stored under the key.
     *
     * @param key the record key
     * @return true if a value exists
     */
    public boolean containsValue(String key) {
        return values.containsKey(key);
    }

    /**
     * Clears all stored state (for testing).
     *
     * <p>The self peer stays registered.</p>
     */
    public void clear() {
        providers.clear();
        values.clear();
        peers.clear();
        peers.put(self.id(), self);
        bootstrapCount.set(0);
    }

    private void record(Multihash key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        providers.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(self);
    }

    private static void requireArgument(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
