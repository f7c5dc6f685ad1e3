package com.relaygate.registry;

import com.relaygate.config.GatewayProperties;
import com.relaygate.model.ProviderDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Read-mostly provider catalog. The table is immutable; a reload swaps the whole
 * snapshot in one reference write so concurrent selections see either the old
 * catalog or the new one, never a mix.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final AtomicReference<Snapshot> snapshot;
    private final List<Consumer<List<ProviderDescriptor>>> reloadListeners = new CopyOnWriteArrayList<>();

    @Autowired
    public ProviderRegistry(ProviderCatalogLoader loader, GatewayProperties properties) {
        this(loader.load(properties.getProviders()));
    }

    public ProviderRegistry(List<ProviderDescriptor> descriptors) {
        this.snapshot = new AtomicReference<>(Snapshot.of(descriptors));
    }

    /**
     * Eligible providers in iteration order.
     */
    public List<ProviderDescriptor> list() {
        return snapshot.get().eligible;
    }

    /**
     * Every configured provider, including disabled ones.
     */
    public List<ProviderDescriptor> all() {
        return snapshot.get().all;
    }

    public Optional<ProviderDescriptor> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.get().byId.get(id));
    }

    /**
     * Replace the whole catalog and notify listeners with the new table.
     */
    public void reload(List<ProviderDescriptor> descriptors) {
        Snapshot next = Snapshot.of(descriptors);
        snapshot.set(next);
        log.info("Provider registry reloaded: {} providers, {} eligible", next.all.size(), next.eligible.size());
        reloadListeners.forEach(listener -> listener.accept(next.all));
    }

    public void addReloadListener(Consumer<List<ProviderDescriptor>> listener) {
        reloadListeners.add(listener);
    }

    private static final class Snapshot {
        private final List<ProviderDescriptor> all;
        private final List<ProviderDescriptor> eligible;
        private final Map<String, ProviderDescriptor> byId;

        private Snapshot(List<ProviderDescriptor> all) {
            this.all = List.copyOf(all);
            this.eligible = this.all.stream().filter(ProviderDescriptor::isEligible).toList();
            Map<String, ProviderDescriptor> index = new LinkedHashMap<>();
            for (ProviderDescriptor descriptor : this.all) {
                if (index.putIfAbsent(descriptor.getId(), descriptor) != null) {
                    throw new IllegalArgumentException("Duplicate provider id: " + descriptor.getId());
                }
            }
            this.byId = Map.copyOf(index);
        }

        static Snapshot of(List<ProviderDescriptor> descriptors) {
            return new Snapshot(descriptors == null ? List.of() : descriptors);
        }
    }
}
