package com.abhinavmehta.sgraph.sdk;

import com.abhinavmehta.sgraph.sdk.dto.DependencyChain;
import com.abhinavmehta.sgraph.sdk.dto.Direction;
import com.abhinavmehta.sgraph.sdk.dto.ElementAssociations;
import com.abhinavmehta.sgraph.sdk.dto.ElementLookupResult;
import com.abhinavmehta.sgraph.sdk.dto.ElementView;
import com.abhinavmehta.sgraph.sdk.dto.ModelInfo;
import com.abhinavmehta.sgraph.sdk.dto.ModelOverview;
import com.abhinavmehta.sgraph.sdk.dto.PatternKind;
import com.abhinavmehta.sgraph.sdk.dto.SearchResult;
import com.abhinavmehta.sgraph.sdk.dto.SubtreeDependencies;
import com.abhinavmehta.sgraph.sdk.exception.InvalidArgumentException;
import com.abhinavmehta.sgraph.sdk.exception.NotLoadedException;
import com.abhinavmehta.sgraph.sdk.loader.JsonModelLoader;
import com.abhinavmehta.sgraph.sdk.loader.ModelLoader;
import com.abhinavmehta.sgraph.sdk.model.AttributeValue;
import com.abhinavmehta.sgraph.sdk.model.Graph;
import com.abhinavmehta.sgraph.sdk.model.GraphBuilder;
import com.abhinavmehta.sgraph.sdk.query.DependencyAnalyzer;
import com.abhinavmehta.sgraph.sdk.query.ElementNavigator;
import com.abhinavmehta.sgraph.sdk.query.OverviewGenerator;
import com.abhinavmehta.sgraph.sdk.query.QueryDeadline;
import com.abhinavmehta.sgraph.sdk.query.SearchEngine;
import com.abhinavmehta.sgraph.sdk.store.InMemoryModelCache;
import com.abhinavmehta.sgraph.sdk.store.ModelCache;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the SDK: loads models into an in-memory cache and answers structural queries
 * against them by model identifier.
 * <p>
 * Queries are read-only against immutable graphs and may run concurrently from any thread.
 */
public class SGraphClient implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(SGraphClient.class);

    private final SGraphSDKConfig config;
    private final ModelCache modelCache;
    private final SearchEngine searchEngine = new SearchEngine();
    private final DependencyAnalyzer dependencyAnalyzer = new DependencyAnalyzer();
    private final OverviewGenerator overviewGenerator = new OverviewGenerator();
    private final ElementNavigator elementNavigator = new ElementNavigator();
    private final ExecutorService internalExecutorService; // Used if no executor is provided in config
    private final boolean ownsCache; // false when the cache was handed in by the caller
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SGraphClient(SGraphSDKConfig config) {
        this(config, new JsonModelLoader(defaultObjectMapper()));
    }

    public SGraphClient(SGraphSDKConfig config, ModelLoader modelLoader) {
        this.config = config;
        if (config.getExecutorService() != null) {
            this.internalExecutorService = null; // Indicates external executor is used
        } else {
            AtomicInteger threadCounter = new AtomicInteger();
            this.internalExecutorService = Executors.newFixedThreadPool(Math.max(1, config.getLoaderThreads()), r -> {
                Thread t = new Thread(r, "sgraph-loader-" + threadCounter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        this.ownsCache = true;
        this.modelCache = new InMemoryModelCache(modelLoader, new GraphBuilder(config.getExternalSegmentName()),
                getEffectiveExecutorService(), config.getLoadTimeoutSeconds());
        log.info("SGraphClient initialized (load timeout {}s, query budget {} ms)",
                config.getLoadTimeoutSeconds(), config.getQueryTimeoutMillis());
    }

    /**
     * Uses a caller-owned cache, e.g. one shared between clients. Closing this client leaves the
     * cache and its models untouched.
     */
    public SGraphClient(SGraphSDKConfig config, ModelCache modelCache) {
        this.config = config;
        this.modelCache = modelCache;
        this.internalExecutorService = null;
        this.ownsCache = false;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private ExecutorService getEffectiveExecutorService() {
        return config.getExecutorService() != null ? config.getExecutorService() : this.internalExecutorService;
    }

    // --- model lifecycle ---

    public String loadModel(String path) {
        ensureOpen();
        return modelCache.load(path);
    }

    public List<ModelInfo> listModels() {
        ensureOpen();
        return modelCache.list();
    }

    public ModelInfo getModelInfo(String modelId) {
        ensureOpen();
        return modelCache.getInfo(modelId).orElseThrow(() -> new NotLoadedException(modelId));
    }

    public boolean evictModel(String modelId) {
        ensureOpen();
        return modelCache.evict(modelId);
    }

    public int clearCache() {
        ensureOpen();
        return modelCache.clear();
    }

    // --- navigation ---

    public ModelOverview getModelOverview(String modelId, Integer maxDepth, boolean includeCounts) {
        return getModelOverview(modelId, null, maxDepth, includeCounts);
    }

    public ModelOverview getModelOverview(String modelId, String scopePath, Integer maxDepth, boolean includeCounts) {
        Graph graph = graph(modelId);
        int depth = maxDepth == null ? config.getDefaultOverviewDepth() : maxDepth;
        return overviewGenerator.overview(graph, scopePath, depth, includeCounts, newDeadline());
    }

    public ElementView getRootElement(String modelId) {
        return elementNavigator.getRootElement(graph(modelId));
    }

    public ElementView getElement(String modelId, String elementPath) {
        return elementNavigator.getElement(graph(modelId), elementPath);
    }

    public ElementAssociations getIncomingAssociations(String modelId, String elementPath) {
        return elementNavigator.getAssociations(graph(modelId), elementPath, Direction.INCOMING);
    }

    public ElementAssociations getOutgoingAssociations(String modelId, String elementPath) {
        return elementNavigator.getAssociations(graph(modelId), elementPath, Direction.OUTGOING);
    }

    public ElementLookupResult getMultipleElements(String modelId, List<String> elementPaths) {
        return elementNavigator.getElements(graph(modelId), elementPaths);
    }

    // --- search ---

    public SearchResult searchElementsByName(String modelId, String pattern, PatternKind kind,
                                             String elementType, String scopePath) {
        return searchElementsByName(modelId, pattern, kind, elementType, scopePath, null);
    }

    public SearchResult searchElementsByName(String modelId, String pattern, PatternKind kind,
                                             String elementType, String scopePath, Integer maxResults) {
        return searchEngine.searchByName(graph(modelId), pattern, kind, elementType, scopePath, maxResults, newDeadline());
    }

    public SearchResult getElementsByType(String modelId, String elementType, String scopePath) {
        return getElementsByType(modelId, elementType, scopePath, null);
    }

    public SearchResult getElementsByType(String modelId, String elementType, String scopePath, Integer maxResults) {
        return searchEngine.searchByType(graph(modelId), elementType, scopePath, maxResults, newDeadline());
    }

    public SearchResult searchElementsByAttributes(String modelId, Map<String, ?> attributeFilters, String scopePath) {
        return searchElementsByAttributes(modelId, attributeFilters, scopePath, null);
    }

    /**
     * Filter values must be strings, numbers or booleans; comparison is type-sensitive.
     */
    public SearchResult searchElementsByAttributes(String modelId, Map<String, ?> attributeFilters,
                                                   String scopePath, Integer maxResults) {
        Graph graph = graph(modelId);
        if (attributeFilters == null) {
            throw new InvalidArgumentException("Attribute filters must not be null");
        }
        Map<String, AttributeValue> filters = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : attributeFilters.entrySet()) {
            try {
                filters.put(entry.getKey(), AttributeValue.of(entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new InvalidArgumentException("Invalid value for attribute filter '" + entry.getKey() + "': "
                        + e.getMessage());
            }
        }
        return searchEngine.searchByAttributes(graph, filters, scopePath, maxResults, newDeadline());
    }

    // --- dependency analysis ---

    public SubtreeDependencies getSubtreeDependencies(String modelId, String rootPath, boolean includeExternal,
                                                      Integer maxDepth) {
        return dependencyAnalyzer.analyzeSubtree(graph(modelId), rootPath, includeExternal, maxDepth, newDeadline());
    }

    public DependencyChain getDependencyChain(String modelId, String elementPath, String direction, Integer maxDepth) {
        return dependencyAnalyzer.dependencyChain(graph(modelId), elementPath, direction, maxDepth, newDeadline());
    }

    private Graph graph(String modelId) {
        ensureOpen();
        return modelCache.get(modelId);
    }

    private QueryDeadline newDeadline() {
        return QueryDeadline.ofMillis(config.getQueryTimeoutMillis());
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("SGraphClient is closed");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing SGraphClient ({} cached models)...", modelCache.size());
            if (ownsCache) {
                modelCache.clear();
            }
            if (internalExecutorService != null && !internalExecutorService.isShutdown()) {
                internalExecutorService.shutdown();
                try {
                    if (!internalExecutorService.awaitTermination(5, TimeUnit.SECONDS)) {
                        internalExecutorService.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    internalExecutorService.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            log.info("SGraphClient closed.");
        }
    }
}
