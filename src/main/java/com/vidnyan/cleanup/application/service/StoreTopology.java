package com.vidnyan.cleanup.application.service;

import com.vidnyan.cleanup.application.error.ConfigurationException;
import com.vidnyan.cleanup.application.port.out.FindingStore;
import com.vidnyan.cleanup.application.port.out.FindingStoreFactory;
import com.vidnyan.cleanup.domain.finding.Category;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved binding of analyzers to stores, plus the execution mode it implies.
 * In forked mode a category without its own fork URL uses the primary store;
 * in sequential mode every category uses the primary store.
 */
@Slf4j
public final class StoreTopology implements AutoCloseable {

    private final FindingStore primary;
    private final Map<Category, FindingStore> stores;
    private final ExecutionMode mode;

    public StoreTopology(FindingStore primary, Map<Category, FindingStore> stores, ExecutionMode mode) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.mode = Objects.requireNonNull(mode, "mode");
        Map<Category, FindingStore> resolved = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            resolved.put(category, stores.getOrDefault(category, primary));
        }
        this.stores = Collections.unmodifiableMap(resolved);
    }

    /**
     * Build the topology from settings.
     * @throws ConfigurationException when no primary URL is configured
     */
    public static StoreTopology from(StoreSettings settings, FindingStoreFactory factory) {
        if (settings == null || !settings.hasPrimary()) {
            throw new ConfigurationException(
                    "No primary store URL configured. Set cleanup.store.primary-url or DATABASE_URL.");
        }
        FindingStore primary = factory.create("primary", settings.primaryUrl().trim());
        ExecutionMode mode = ExecutionMode.select(settings);

        Map<Category, FindingStore> stores = new EnumMap<>(Category.class);
        if (mode == ExecutionMode.FORKED) {
            for (Category category : Category.values()) {
                settings.forkUrl(category).ifPresent(url ->
                        stores.put(category, factory.create(category.key() + "-fork", url)));
            }
        }

        StoreTopology topology = new StoreTopology(primary, stores, mode);
        topology.describe();
        return topology;
    }

    public FindingStore primary() {
        return primary;
    }

    public FindingStore storeFor(Category category) {
        return stores.get(category);
    }

    public ExecutionMode mode() {
        return mode;
    }

    public boolean isForked(Category category) {
        return storeFor(category) != primary;
    }

    /**
     * Every distinct store, primary first.
     */
    public List<FindingStore> distinctStores() {
        Set<FindingStore> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<FindingStore> distinct = new ArrayList<>();
        seen.add(primary);
        distinct.add(primary);
        for (FindingStore store : stores.values()) {
            if (seen.add(store)) {
                distinct.add(store);
            }
        }
        return distinct;
    }

    private void describe() {
        log.info("Execution mode: {}", mode);
        stores.forEach((category, store) -> log.info("  {} analyzer -> {}{}",
                category.key(), store.name(),
                mode == ExecutionMode.FORKED && store == primary ? " (no fork configured)" : ""));
    }

    @Override
    public void close() {
        for (FindingStore store : distinctStores()) {
            store.close();
        }
    }
}
