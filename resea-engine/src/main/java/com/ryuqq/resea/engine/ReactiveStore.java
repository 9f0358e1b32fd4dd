package com.ryuqq.resea.engine;

import com.ryuqq.resea.application.registry.ActionListener;
import com.ryuqq.resea.application.store.PatchListener;
import com.ryuqq.resea.application.store.PathObserver;
import com.ryuqq.resea.application.store.StateListener;
import com.ryuqq.resea.application.store.Store;
import com.ryuqq.resea.application.store.Subscription;
import com.ryuqq.resea.core.contract.StoreDefinition;
import com.ryuqq.resea.core.model.MemberKind;
import com.ryuqq.resea.core.model.StoreId;
import com.ryuqq.resea.core.path.StatePath;
import com.ryuqq.resea.core.path.StateTrees;
import com.ryuqq.resea.core.state.CopyOnWriteDraft;
import com.ryuqq.resea.core.state.Draft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Reactive Store 구현체.
 *
 * <p>하나의 Store가 가진 State, version, 구독자 목록, Getter 캐시, Action 디스패처를 소유합니다.</p>
 *
 * <p><strong>커밋 절차 (setState / patch / reset 공통):</strong></p>
 * <ol>
 *   <li>재진입 가드 확인 (통지 중 호출은 무시)</li>
 *   <li>새 최상위 맵 계산 (기존 트리는 변경하지 않음)</li>
 *   <li>후보 키 중 실제로 값이 달라진 키만 추림 (없으면 종료: version 유지, 통지 없음)</li>
 *   <li>State 교체, version 1 증가</li>
 *   <li>변경 키와 겹치는 Getter 캐시 항목 제거</li>
 *   <li>부분 변경 구독자 → 전체 State 구독자 순으로 통지 (배치 중이면 배치 종료 시로 연기)</li>
 * </ol>
 *
 * <p><strong>키 해석:</strong> 생성 시점에 만든 멤버 테이블로 Getter, Action, Plugin 속성,
 * State 필드를 구분합니다. 테이블에 없는 키는 State 필드입니다.</p>
 *
 * <p><strong>동시성:</strong> 단일 스레드 협력 모델을 전제로 하며 thread-safe하지 않습니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public final class ReactiveStore implements Store {

    private static final Logger log = LoggerFactory.getLogger(ReactiveStore.class);

    private final StoreDefinition definition;
    private final DefaultRegistry registry;
    private final Map<String, Object> initialSnapshot;
    private final Map<String, MemberKind> members;
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final Listeners<StateListener> subscribers;
    private final Listeners<PatchListener> fineGrainedSetters;
    private final GetterCache getterCache;
    private final ActionDispatcher dispatcher;

    private Map<String, Object> state;
    private long version;
    private boolean updating;
    private Map<String, Object> batchBaseState;

    /**
     * 생성자. 정의의 State 팩토리를 한 번 호출해 초기 스냅샷을 만듭니다.
     *
     * @param definition Store 정의
     * @param registry 소속 Registry
     * @param config Registry 설정
     */
    ReactiveStore(StoreDefinition definition, DefaultRegistry registry, RegistryConfig config) {
        this.definition = definition;
        this.registry = registry;
        this.initialSnapshot = definition.createInitialState();
        this.state = initialSnapshot;
        this.members = new LinkedHashMap<>(definition.members());
        this.subscribers = new Listeners<>("State");
        this.fineGrainedSetters = new Listeners<>("Patch");
        this.getterCache = new GetterCache(definition.id(), definition.getters(), () -> state, () -> version);
        this.dispatcher = new ActionDispatcher(
            this, new StoreActionContext(this), definition, config, registry::emitAction
        );
    }

    @Override
    public StoreId id() {
        return definition.id();
    }

    @Override
    public StoreDefinition definition() {
        return definition;
    }

    @Override
    public Map<String, Object> getState() {
        return new LinkedHashMap<>(state);
    }

    /**
     * 현재 동결 State (복사 없음).
     *
     * @return 불변 State
     */
    Map<String, Object> currentState() {
        return state;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public boolean isUpdating() {
        return updating;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        MemberKind kind = members.getOrDefault(key, MemberKind.STATE);
        switch (kind) {
            case GETTER:
                return getter(key);
            case PROPERTY:
                return property(key);
            case ACTION:
            case ASYNC_ACTION:
                throw new IllegalArgumentException(
                    String.format("'%s' is an action in store %s; use dispatch()", key, id().getValue())
                );
            default:
                return (T) StatePath.getValue(state, key);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getter(String name) {
        return (T) getterCache.read(name);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T property(String name) {
        return (T) properties.get(name);
    }

    @Override
    public void set(String path, Object value) {
        patch(draft -> draft.set(path, value));
    }

    @Override
    public void setState(Map<String, ?> partial) {
        if (partial == null) {
            throw new IllegalArgumentException("partial cannot be null");
        }
        if (dropReentrant("setState")) {
            return;
        }
        Map<String, Object> next = new LinkedHashMap<>(state);
        partial.forEach((key, value) -> next.put(key, StateTrees.freeze(value)));
        commit(next, partial.keySet());
    }

    @Override
    public void setState(UnaryOperator<Map<String, Object>> updater) {
        if (updater == null) {
            throw new IllegalArgumentException("updater cannot be null");
        }
        if (dropReentrant("setState")) {
            return;
        }
        Map<String, Object> partial = updater.apply(getState());
        if (partial != null) {
            setState(partial);
        }
    }

    @Override
    public void patch(Map<String, ?> partial) {
        if (partial == null) {
            throw new IllegalArgumentException("partial cannot be null");
        }
        if (dropReentrant("patch")) {
            return;
        }
        Map<String, Object> next = new LinkedHashMap<>(state);
        partial.forEach((key, value) -> next.put(key, StateTrees.deepMerge(state.get(key), value)));
        commit(next, partial.keySet());
    }

    @Override
    public void patch(Consumer<Draft> recipe) {
        if (recipe == null) {
            throw new IllegalArgumentException("recipe cannot be null");
        }
        if (dropReentrant("patch")) {
            return;
        }
        CopyOnWriteDraft draft = new CopyOnWriteDraft(state);
        recipe.accept(draft);
        commit(draft.snapshot(), draft.touchedKeys());
    }

    @Override
    public void reset() {
        if (dropReentrant("reset")) {
            return;
        }
        Set<String> keys = new LinkedHashSet<>(state.keySet());
        keys.addAll(initialSnapshot.keySet());
        commit(initialSnapshot, keys);
    }

    @Override
    public void hydrate(Map<String, ?> partial) {
        if (partial == null) {
            throw new IllegalArgumentException("partial cannot be null");
        }
        Map<String, Object> next = new LinkedHashMap<>(state);
        partial.forEach((key, value) -> next.put(key, StateTrees.freeze(value)));
        Map<String, Object> changed = diff(state, next, partial.keySet());
        if (changed.isEmpty()) {
            return;
        }
        Map<String, Object> previous = state;
        state = Collections.unmodifiableMap(next);
        invalidateGetters(previous, state, changed.keySet());
        log.debug("Hydrated store {} with keys {}", id().getValue(), changed.keySet());
    }

    @Override
    public Subscription subscribe(StateListener listener) {
        return subscribers.add(listener);
    }

    @Override
    public Subscription onPatch(PatchListener listener) {
        return fineGrainedSetters.add(listener);
    }

    @Override
    public Subscription onAction(ActionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        StoreId id = id();
        return registry.onAction(event -> {
            if (id.equals(event.storeId())) {
                listener.onAction(event);
            }
        });
    }

    @Override
    public Subscription observe(Collection<String> paths, PathObserver observer) {
        return fineGrainedSetters.add(new PathObservation(paths, observer, state));
    }

    @Override
    public Object dispatch(String action, Object... args) {
        return dispatcher.dispatch(action, args);
    }

    @Override
    public CompletableFuture<Object> dispatchAsync(String action, Object... args) {
        return dispatcher.dispatchAsync(action, args);
    }

    /**
     * Plugin 속성 병합. Getter/Action 이름과 겹치는 속성은 경고 후 무시합니다.
     *
     * @param pluginName 기여 Plugin 이름
     * @param contributed 속성 이름 → 값
     */
    void applyProperties(String pluginName, Map<String, Object> contributed) {
        contributed.forEach((name, value) -> {
            MemberKind existing = members.get(name);
            if (existing != null && existing != MemberKind.PROPERTY) {
                log.warn("Plugin '{}' property '{}' clashes with {} in store {}; ignored",
                    pluginName, name, existing, id().getValue());
                return;
            }
            members.put(name, MemberKind.PROPERTY);
            properties.put(name, value);
        });
    }

    /**
     * 배치 종료 시 연기된 통지를 한 번에 전달.
     */
    void flushBatch() {
        Map<String, Object> base = batchBaseState;
        batchBaseState = null;
        if (base == null) {
            return;
        }
        Set<String> keys = new LinkedHashSet<>(base.keySet());
        keys.addAll(state.keySet());
        Map<String, Object> changed = diff(base, state, keys);
        if (!changed.isEmpty()) {
            deliver(changed, state, base);
        }
    }

    /**
     * Registry 종료 시 구독자와 캐시 정리.
     */
    void detach() {
        subscribers.clear();
        fineGrainedSetters.clear();
        getterCache.clear();
        properties.clear();
        batchBaseState = null;
    }

    GetterCache getterCache() {
        return getterCache;
    }

    private boolean dropReentrant(String operation) {
        if (updating) {
            log.debug("Dropped re-entrant {} on store {} during notification", operation, id().getValue());
            return true;
        }
        return false;
    }

    private void commit(Map<String, Object> next, Collection<String> candidateKeys) {
        Map<String, Object> previous = state;
        Map<String, Object> changed = diff(previous, next, candidateKeys);
        if (changed.isEmpty()) {
            return;
        }
        state = Collections.unmodifiableMap(new LinkedHashMap<>(next));
        version++;
        invalidateGetters(previous, state, changed.keySet());

        if (registry.isBatching()) {
            if (batchBaseState == null) {
                batchBaseState = previous;
                registry.enlist(this);
            }
            return;
        }
        deliver(changed, state, previous);
    }

    private void invalidateGetters(Map<String, Object> previous, Map<String, Object> next, Set<String> changedKeys) {
        Set<String> invalidated = new LinkedHashSet<>(changedKeys);
        if (!previous.keySet().equals(next.keySet())) {
            invalidated.add(StatePath.ROOT);
        }
        getterCache.invalidate(invalidated);
    }

    private void deliver(Map<String, Object> changed, Map<String, Object> next, Map<String, Object> previous) {
        Map<String, Object> payload = Collections.unmodifiableMap(changed);
        boolean outermost = !updating;
        updating = true;
        try {
            fineGrainedSetters.notifyEach(listener -> listener.onPatch(payload));
            subscribers.notifyEach(listener -> listener.onChange(next, previous));
        } finally {
            if (outermost) {
                updating = false;
            }
        }
    }

    private static Map<String, Object> diff(Map<String, Object> before, Map<String, Object> after,
                                            Collection<String> candidateKeys) {
        Map<String, Object> changed = new LinkedHashMap<>();
        for (String key : candidateKeys) {
            Object oldValue = before.get(key);
            Object newValue = after.get(key);
            if (!Objects.equals(oldValue, newValue) || before.containsKey(key) != after.containsKey(key)) {
                changed.put(key, newValue);
            }
        }
        return changed;
    }

    @Override
    public String toString() {
        return "ReactiveStore{id=" + id().getValue() + ", version=" + version + '}';
    }
}
