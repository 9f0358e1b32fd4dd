package com.ryuqq.resea.engine;

import com.ryuqq.resea.application.registry.ActionListener;
import com.ryuqq.resea.application.registry.Plugin;
import com.ryuqq.resea.application.registry.Registry;
import com.ryuqq.resea.application.store.Store;
import com.ryuqq.resea.application.store.Subscription;
import com.ryuqq.resea.core.contract.StoreDefinition;
import com.ryuqq.resea.core.model.ActionEvent;
import com.ryuqq.resea.core.spi.PersistOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 기본 Registry 구현체.
 *
 * <p><strong>Store 생성 절차:</strong></p>
 * <ol>
 *   <li>{@link ReactiveStore} 생성 및 등록</li>
 *   <li>설치된 Plugin 순서대로 {@link Plugin#properties} 병합</li>
 *   <li>설치된 Plugin 순서대로 {@link Plugin#storeCreated} 호출</li>
 * </ol>
 *
 * <p><strong>Plugin 재생 정책:</strong> Plugin 설치 이전에 만들어진 Store에는
 * 훅을 호출하지 않습니다.</p>
 *
 * <p><strong>배치:</strong> {@link #batch(Runnable)} 범위 안의 커밋은 즉시 반영되지만
 * 통지는 가장 바깥 범위가 끝날 때 Store마다 한 번으로 합쳐집니다.</p>
 *
 * <p><strong>동시성:</strong> 단일 스레드 협력 모델이며 thread-safe하지 않습니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public final class DefaultRegistry implements Registry {

    private static final Logger log = LoggerFactory.getLogger(DefaultRegistry.class);

    private final RegistryConfig config;
    private final Map<String, ReactiveStore> stores = new LinkedHashMap<>();
    private final Map<String, Plugin> plugins = new LinkedHashMap<>();
    private final Listeners<ActionListener> actionListeners = new Listeners<>("Action");
    private final Set<ReactiveStore> enlisted = new LinkedHashSet<>();
    private int batchDepth;
    private boolean closed;

    /**
     * 기본 설정으로 생성.
     */
    public DefaultRegistry() {
        this(new RegistryConfig());
    }

    /**
     * 생성자.
     *
     * @param config Registry 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public DefaultRegistry(RegistryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public Registry use(Plugin plugin) {
        ensureOpen();
        if (plugin == null) {
            throw new IllegalArgumentException("plugin cannot be null");
        }
        String name = plugin.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("plugin name cannot be null or blank");
        }
        if (plugins.containsKey(name)) {
            log.warn("Plugin '{}' is already installed; ignoring duplicate", name);
            return this;
        }
        plugins.put(name, plugin);
        try {
            plugin.install(this);
        } catch (RuntimeException e) {
            log.error("Plugin '{}' install hook failed", name, e);
        }
        log.info("Plugin '{}' installed", name);
        return this;
    }

    @Override
    public Store defineStore(StoreDefinition definition) {
        ensureOpen();
        requireDefinition(definition);
        ReactiveStore existing = stores.get(definition.id().getValue());
        if (existing != null) {
            log.debug("Store {} already defined; returning existing instance", definition.id().getValue());
            return existing;
        }
        return create(definition);
    }

    @Override
    public Store createStore(StoreDefinition definition) {
        ensureOpen();
        requireDefinition(definition);
        if (stores.containsKey(definition.id().getValue())) {
            throw new IllegalStateException("Store already exists: " + definition.id().getValue());
        }
        return create(definition);
    }

    private ReactiveStore create(StoreDefinition definition) {
        ReactiveStore store = new ReactiveStore(definition, this, config);
        stores.put(definition.id().getValue(), store);

        for (Plugin plugin : plugins.values()) {
            try {
                Map<String, Object> contributed = plugin.properties(store);
                if (contributed != null && !contributed.isEmpty()) {
                    store.applyProperties(plugin.name(), contributed);
                }
            } catch (RuntimeException e) {
                log.error("Plugin '{}' properties hook failed for store {}", plugin.name(), definition.id().getValue(), e);
            }
        }
        for (Plugin plugin : plugins.values()) {
            try {
                plugin.storeCreated(store);
            } catch (RuntimeException e) {
                log.error("Plugin '{}' storeCreated hook failed for store {}", plugin.name(), definition.id().getValue(), e);
            }
        }
        if (definition.persistOptions().isPresent() && !plugins.containsKey(PersistOptions.PLUGIN_NAME)) {
            log.warn("Store {} requests persistence but no '{}' plugin is installed",
                definition.id().getValue(), PersistOptions.PLUGIN_NAME);
        }

        log.info("Store {} created", definition.id().getValue());
        return store;
    }

    @Override
    public Optional<Store> getStore(String id) {
        return Optional.ofNullable(stores.get(id));
    }

    @Override
    public Collection<Store> stores() {
        return Collections.unmodifiableList(new ArrayList<>(stores.values()));
    }

    /**
     * 설치된 Plugin 이름 목록 (설치 순서).
     *
     * @return Plugin 이름 스냅샷
     */
    public List<String> pluginNames() {
        return List.copyOf(plugins.keySet());
    }

    @Override
    public void emitAction(ActionEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        actionListeners.notifyEach(listener -> listener.onAction(event));
    }

    @Override
    public Subscription onAction(ActionListener listener) {
        return actionListeners.add(listener);
    }

    @Override
    public void batch(Runnable body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        batchDepth++;
        try {
            body.run();
        } finally {
            batchDepth--;
            if (batchDepth == 0) {
                flushBatch();
            }
        }
    }

    boolean isBatching() {
        return batchDepth > 0;
    }

    void enlist(ReactiveStore store) {
        enlisted.add(store);
    }

    private void flushBatch() {
        List<ReactiveStore> pending = new ArrayList<>(enlisted);
        enlisted.clear();
        for (ReactiveStore store : pending) {
            store.flushBatch();
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        stores.values().forEach(ReactiveStore::detach);
        stores.clear();
        plugins.clear();
        actionListeners.clear();
        enlisted.clear();
        log.info("Registry closed");
    }

    public boolean isClosed() {
        return closed;
    }

    public RegistryConfig config() {
        return config;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Registry is closed");
        }
    }

    private static void requireDefinition(StoreDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
    }
}
