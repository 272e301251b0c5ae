package com.abhinavmehta.sgraph.sdk.store;

import com.abhinavmehta.sgraph.sdk.dto.ModelInfo;
import com.abhinavmehta.sgraph.sdk.exception.LoadException;
import com.abhinavmehta.sgraph.sdk.exception.NotLoadedException;
import com.abhinavmehta.sgraph.sdk.loader.ModelDefinition;
import com.abhinavmehta.sgraph.sdk.loader.ModelLoader;
import com.abhinavmehta.sgraph.sdk.model.Graph;
import com.abhinavmehta.sgraph.sdk.model.GraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the loaded models, keyed by identifier.
 * <p>
 * Parsing and validation run outside the table lock, on the loader executor and bounded by the
 * load timeout; only the final insert takes the write lock. Lookups share the read lock. A
 * {@link Graph} handed out by {@link #get} stays usable after its entry is evicted.
 */
public class InMemoryModelCache implements ModelCache {
    private static final Logger log = LoggerFactory.getLogger(InMemoryModelCache.class);

    private final ModelLoader loader;
    private final GraphBuilder graphBuilder;
    private final ExecutorService executorService;
    private final long loadTimeoutSeconds;
    private final ModelIdGenerator idGenerator = new ModelIdGenerator();

    // insertion order doubles as list() order
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryModelCache(ModelLoader loader, GraphBuilder graphBuilder,
                              ExecutorService executorService, long loadTimeoutSeconds) {
        this.loader = loader;
        this.graphBuilder = graphBuilder;
        this.executorService = executorService;
        this.loadTimeoutSeconds = loadTimeoutSeconds;
    }

    @Override
    public String load(String sourceRef) {
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new LoadException("Source reference cannot be empty");
        }
        log.info("Starting to load model from: {}", sourceRef);
        long start = System.nanoTime();

        Graph graph = loadGraph(sourceRef);
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        String modelId = idGenerator.next();
        ModelInfo info = ModelInfo.builder()
                .modelId(modelId)
                .sourceRef(sourceRef)
                .loadedAt(Instant.now().toString())
                .loadDurationMs(durationMs)
                .elementCount(graph.getElementCount())
                .associationCount(graph.getAssociationCount())
                .rootName(graph.getRoot().getName().isEmpty() ? "unnamed" : graph.getRoot().getName())
                .rootChildCount(graph.getRoot().getChildren().size())
                .build();

        lock.writeLock().lock();
        try {
            entries.put(modelId, new CacheEntry(modelId, graph, info));
            log.info("Model {} loaded from {} in {} ms ({} elements, {} associations; total models: {})",
                    modelId, sourceRef, durationMs, info.getElementCount(), info.getAssociationCount(), entries.size());
        } finally {
            lock.writeLock().unlock();
        }
        return modelId;
    }

    /**
     * Reads and builds the model as one task on the loader executor, so the load timeout bounds
     * parsing and validation together.
     */
    private Graph loadGraph(String sourceRef) {
        Future<Graph> future = executorService.submit(() -> {
            ModelDefinition definition = loader.load(sourceRef);
            if (definition == null) {
                throw new LoadException("Loader returned no model for " + sourceRef);
            }
            return graphBuilder.build(definition);
        });
        try {
            return future.get(loadTimeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Model loading timed out after {} seconds: {}", loadTimeoutSeconds, sourceRef);
            throw new LoadException("Model loading timed out after " + loadTimeoutSeconds + " seconds: " + sourceRef,
                    Map.of("sourceRef", sourceRef, "timeoutSeconds", loadTimeoutSeconds), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LoadException("Interrupted while loading " + sourceRef, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LoadException) {
                log.error("Rejected model from {}: {}", sourceRef, cause.getMessage());
                throw (LoadException) cause;
            }
            String reason = cause instanceof IOException ? "unreadable source" : "load failure";
            log.error("Failed to load model from {} ({}): {}", sourceRef, reason, cause.getMessage(), cause);
            throw new LoadException("Failed to load model from " + sourceRef + ": " + cause.getMessage(),
                    Map.of("sourceRef", sourceRef, "reason", reason), cause);
        }
    }

    @Override
    public Graph get(String modelId) {
        return find(modelId).orElseThrow(() -> new NotLoadedException(modelId));
    }

    @Override
    public Optional<Graph> find(String modelId) {
        return entry(modelId).map(CacheEntry::getGraph);
    }

    @Override
    public Optional<ModelInfo> getInfo(String modelId) {
        return entry(modelId).map(entry -> entry.getInfo().toBuilder().build());
    }

    private Optional<CacheEntry> entry(String modelId) {
        if (modelId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(modelId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean evict(String modelId) {
        if (modelId == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            boolean removed = entries.remove(modelId) != null;
            if (removed) {
                log.info("Removed model {} from cache", modelId);
            } else {
                log.debug("Evict requested for unknown model {}", modelId);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ModelInfo> list() {
        lock.readLock().lock();
        try {
            List<ModelInfo> infos = new ArrayList<>(entries.size());
            for (CacheEntry entry : entries.values()) {
                infos.add(entry.getInfo().toBuilder().build());
            }
            return infos;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int clear() {
        lock.writeLock().lock();
        try {
            int count = entries.size();
            entries.clear();
            log.info("Cleared {} models from cache", count);
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
