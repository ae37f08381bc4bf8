package io.gatewaycontroller.watch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.WatchOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.etcd.jetcd.watch.WatchResponse;
import io.gatewaycontroller.models.GatewayObject;
import io.gatewaycontroller.models.Tombstone;
import io.gatewaycontroller.store.EtcdPathResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static io.gatewaycontroller.config.Constants.ETCD_OPERATION_TIMEOUT_SECONDS;
import static io.gatewaycontroller.config.Constants.WATCH_RETRY_DELAY_MILLIS;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Watch source over gateway status objects stored as JSON under an etcd prefix.
 * <p>
 * Lists the prefix once on start, then watches from the listed revision. All cache
 * updates and handler callbacks run on a single delivery thread so notifications
 * for the same key arrive in store order. If the watch fails it relists and
 * re-watches; objects that vanished in between are reported as tombstones.
 */
@Slf4j
public class EtcdWatchSource implements WatchSource {

    private final KV kvClient;
    private final Watch watchClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    private final Duration resyncPeriod;

    private final ConcurrentMap<String, GatewayObject> cache = new ConcurrentHashMap<>();
    private final ScheduledExecutorService deliveryExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "gateway-watch-delivery");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean rewatchPending = new AtomicBoolean(false);
    // Bumped whenever a watch is replaced so late events from the old one are dropped
    private final AtomicLong watchGeneration = new AtomicLong();

    private volatile GatewayEventHandler handler;
    private volatile Watch.Watcher watcher;

    public EtcdWatchSource(Client etcdClient, EtcdPathResolver pathResolver, ObjectMapper objectMapper, Duration resyncPeriod) {
        this.kvClient = etcdClient.getKVClient();
        this.watchClient = etcdClient.getWatchClient();
        this.pathResolver = pathResolver;
        this.objectMapper = objectMapper;
        this.resyncPeriod = resyncPeriod;

        log.info("EtcdWatchSource initialized for prefix {}", pathResolver.getGatewaysPrefix());
    }

    @Override
    public void start(GatewayEventHandler handler) throws WatchSourceException {
        if (closed.get()) {
            throw new WatchSourceException("Watch source is closed");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Watch source already started");
        }
        this.handler = handler;

        GetResponse listing = list();
        long revision = listing.getHeader().getRevision();
        List<KeyValue> kvs = listing.getKvs();
        log.info("Listed {} gateway objects at revision {}", kvs.size(), revision);

        deliver(() -> replace(kvs));
        openWatch(revision + 1);

        if (!resyncPeriod.isZero()) {
            deliveryExecutor.scheduleWithFixedDelay(this::resync,
                resyncPeriod.toMillis(), resyncPeriod.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Gateway resync scheduled every {}s", resyncPeriod.toSeconds());
        }
    }

    @Override
    public Optional<GatewayObject> getByKey(String key) throws WatchSourceException {
        if (closed.get()) {
            throw new WatchSourceException("Gateway cache is closed, cannot look up " + key);
        }
        return Optional.ofNullable(cache.get(key));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing gateway watch source");
        Watch.Watcher current = watcher;
        if (current != null) {
            current.close();
        }
        deliveryExecutor.shutdownNow();
    }

    private GetResponse list() throws WatchSourceException {
        String prefix = pathResolver.getGatewaysPrefix();
        try {
            return kvClient.get(
                ByteSequence.from(prefix, UTF_8),
                GetOption.builder().isPrefix(true).build()
            ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WatchSourceException("Interrupted while listing gateways under " + prefix, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new WatchSourceException("Failed to list gateways under " + prefix, e);
        }
    }

    private void openWatch(long fromRevision) {
        String prefix = pathResolver.getGatewaysPrefix();
        long generation = watchGeneration.incrementAndGet();
        watcher = watchClient.watch(
            ByteSequence.from(prefix, UTF_8),
            WatchOption.builder()
                .isPrefix(true)
                .withRevision(fromRevision)
                .withPrevKV(true)
                .build(),
            new GatewayListener(generation)
        );
        log.debug("Watching {} from revision {}", prefix, fromRevision);
    }

    /**
     * Relist and re-watch after the watch failed. Retries until it succeeds or the source is closed.
     */
    private void scheduleRewatch() {
        if (closed.get() || !rewatchPending.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.schedule(this::rewatch, WATCH_RETRY_DELAY_MILLIS, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Delivery executor stopped, not re-establishing gateway watch");
        }
    }

    private void rewatch() {
        rewatchPending.set(false);
        if (closed.get()) {
            return;
        }
        watchGeneration.incrementAndGet();
        Watch.Watcher previous = watcher;
        if (previous != null) {
            previous.close();
        }
        try {
            GetResponse listing = list();
            replace(listing.getKvs());
            openWatch(listing.getHeader().getRevision() + 1);
            log.info("Re-established gateway watch at revision {}", listing.getHeader().getRevision());
        } catch (WatchSourceException e) {
            log.error("Failed to re-establish gateway watch, retrying in {}ms", WATCH_RETRY_DELAY_MILLIS, e);
            scheduleRewatch();
        }
    }

    /**
     * Bring the cache in line with a full listing. Runs on the delivery thread.
     */
    private void replace(List<KeyValue> kvs) {
        Map<String, GatewayObject> listed = new LinkedHashMap<>();
        for (KeyValue kv : kvs) {
            toGatewayObject(kv).ifPresent(object -> listed.put(object.getKey(), object));
        }

        for (String key : new ArrayList<>(cache.keySet())) {
            if (!listed.containsKey(key)) {
                GatewayObject last = cache.remove(key);
                log.debug("GatewayStatus {} vanished while unobserved", key);
                notifyHandler(() -> handler.onDelete(new Tombstone(key, last)));
            }
        }

        for (GatewayObject object : listed.values()) {
            GatewayObject old = cache.put(object.getKey(), object);
            if (old == null) {
                notifyHandler(() -> handler.onAdd(object));
            } else {
                notifyHandler(() -> handler.onUpdate(old, object));
            }
        }
    }

    private void resync() {
        log.debug("Resyncing {} gateway objects", cache.size());
        for (GatewayObject object : new ArrayList<>(cache.values())) {
            notifyHandler(() -> handler.onAdd(object));
        }
    }

    private void handlePut(KeyValue kv) {
        toGatewayObject(kv).ifPresent(object -> {
            GatewayObject old = cache.put(object.getKey(), object);
            if (old == null) {
                notifyHandler(() -> handler.onAdd(object));
            } else {
                notifyHandler(() -> handler.onUpdate(old, object));
            }
        });
    }

    private void handleDelete(KeyValue kv, KeyValue prevKv) {
        Optional<String> key = pathResolver.extractGatewayKey(kv.getKey().toString(UTF_8));
        if (key.isEmpty()) {
            return;
        }
        GatewayObject cached = cache.remove(key.get());
        GatewayObject deleted = prevKv != null && !prevKv.getValue().isEmpty()
            ? toGatewayObject(prevKv).orElse(cached)
            : cached;
        if (deleted != null) {
            notifyHandler(() -> handler.onDelete(deleted));
        } else {
            notifyHandler(() -> handler.onDelete(new Tombstone(key.get(), null)));
        }
    }

    private Optional<GatewayObject> toGatewayObject(KeyValue kv) {
        String path = kv.getKey().toString(UTF_8);
        Optional<String> key = pathResolver.extractGatewayKey(path);
        if (key.isEmpty()) {
            log.debug("Ignoring key outside the gateway prefix: {}", path);
            return Optional.empty();
        }
        return Optional.of(new GatewayObject(key.get(), kv.getModRevision(), readPayload(path, kv.getValue())));
    }

    private JsonNode readPayload(String path, ByteSequence value) {
        try {
            return objectMapper.readTree(value.getBytes());
        } catch (IOException e) {
            log.warn("Gateway object at {} is not valid JSON, treating it as empty: {}", path, e.getMessage());
            return MissingNode.getInstance();
        }
    }

    private void deliver(Runnable action) {
        try {
            deliveryExecutor.execute(action);
        } catch (RejectedExecutionException e) {
            log.debug("Delivery executor stopped, dropping gateway notification");
        }
    }

    private void notifyHandler(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.error("Error while delivering gateway notification", e);
        }
    }

    private class GatewayListener implements Watch.Listener {

        private final long generation;

        GatewayListener(long generation) {
            this.generation = generation;
        }

        @Override
        public void onNext(WatchResponse watchResponse) {
            List<WatchEvent> events = watchResponse.getEvents();
            deliver(() -> {
                if (generation != watchGeneration.get()) {
                    return;
                }
                for (WatchEvent event : events) {
                    switch (event.getEventType()) {
                        case PUT:
                            handlePut(event.getKeyValue());
                            break;
                        case DELETE:
                            handleDelete(event.getKeyValue(), event.getPrevKV());
                            break;
                        default:
                            log.debug("Ignoring unrecognized watch event");
                            break;
                    }
                }
            });
        }

        @Override
        public void onError(Throwable throwable) {
            if (closed.get() || generation != watchGeneration.get()) {
                return;
            }
            log.error("Error in gateway watcher, relisting", throwable);
            scheduleRewatch();
        }

        @Override
        public void onCompleted() {
            if (closed.get() || generation != watchGeneration.get()) {
                return;
            }
            log.warn("Gateway watcher completed unexpectedly, relisting");
            scheduleRewatch();
        }
    }
}
