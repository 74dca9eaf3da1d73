package com.ryuqq.catalog.adapter.inmemory.store;

import com.ryuqq.catalog.core.model.NodeName;
import com.ryuqq.catalog.core.model.Resource;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.ExportedResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ExportedResourceStore} for testing and reference purposes.
 *
 * <p><strong>Storage:</strong></p>
 * <ul>
 *   <li>Facts: node → fact map, written with {@link #putFacts}</li>
 *   <li>Exports: node → exported resources, replaced wholesale by {@link #replaceExports}</li>
 * </ul>
 *
 * <p>{@link #exportedResources(String)} returns matches ordered by exporting node name,
 * then by declaration order, so collection results are deterministic.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryExportedResourceStore store = new InMemoryExportedResourceStore();
 * store.putFacts(NodeName.of("web1"), Map.of("ipaddress", "10.0.0.1"));
 *
 * store.replaceExports(NodeName.of("web1"), List.of(hostEntry));
 * List&lt;Resource&gt; hosts = store.exportedResources("host").orElseThrow();
 * </pre>
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public class InMemoryExportedResourceStore implements ExportedResourceStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExportedResourceStore.class);

    private final ConcurrentHashMap<NodeName, Map<String, String>> facts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<NodeName, List<Resource>> exports = new ConcurrentHashMap<>();

    /**
     * Stores the facts of a node, replacing previous ones.
     *
     * @param node the node
     * @param nodeFacts the facts
     * @throws IllegalArgumentException if node or nodeFacts is null
     */
    public void putFacts(NodeName node, Map<String, String> nodeFacts) {
        if (node == null || nodeFacts == null) {
            throw new IllegalArgumentException("node and facts cannot be null");
        }
        facts.put(node, Map.copyOf(nodeFacts));
    }

    @Override
    public Result<Map<String, String>> facts(NodeName node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        return Result.ok(facts.getOrDefault(node, Map.of()));
    }

    @Override
    public Result<List<Resource>> exportedResources(String type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        String wanted = type.toLowerCase(Locale.ROOT);
        List<Resource> matches = new ArrayList<>();
        exports.entrySet().stream()
            .sorted(Comparator.comparing(entry -> entry.getKey().getValue()))
            .forEach(entry -> entry.getValue().stream()
                .filter(resource -> resource.type().equals(wanted))
                .forEach(matches::add));
        return Result.ok(List.copyOf(matches));
    }

    @Override
    public Result<Integer> replaceExports(NodeName node, List<Resource> resources) {
        if (node == null || resources == null) {
            throw new IllegalArgumentException("node and resources cannot be null");
        }
        List<Resource> copy = List.copyOf(resources);
        if (copy.isEmpty()) {
            exports.remove(node);
        } else {
            exports.put(node, copy);
        }
        log.debug("Stored {} exported resources for {}", copy.size(), node);
        return Result.ok(copy.size());
    }

    /**
     * Removes all facts and exports.
     */
    public void clear() {
        facts.clear();
        exports.clear();
    }
}
