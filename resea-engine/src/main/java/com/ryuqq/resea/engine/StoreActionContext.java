package com.ryuqq.resea.engine;

import com.ryuqq.resea.core.contract.ActionContext;
import com.ryuqq.resea.core.model.StoreId;
import com.ryuqq.resea.core.state.Draft;
import com.ryuqq.resea.core.state.MapStateReader;
import com.ryuqq.resea.core.state.StateReader;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Store에 바인딩된 {@link ActionContext}.
 *
 * <p>모든 호출을 소유 Store로 위임합니다. Store당 하나가 생성되어 모든 Action 호출에 공유됩니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
final class StoreActionContext implements ActionContext {

    private final ReactiveStore store;

    StoreActionContext(ReactiveStore store) {
        this.store = store;
    }

    @Override
    public StoreId storeId() {
        return store.id();
    }

    @Override
    public <T> T get(String key) {
        return store.get(key);
    }

    @Override
    public void set(String path, Object value) {
        store.set(path, value);
    }

    @Override
    public <T> T getter(String name) {
        return store.getter(name);
    }

    @Override
    public StateReader state() {
        return new MapStateReader(store.currentState());
    }

    @Override
    public Object dispatch(String action, Object... args) {
        return store.dispatch(action, args);
    }

    @Override
    public CompletableFuture<Object> dispatchAsync(String action, Object... args) {
        return store.dispatchAsync(action, args);
    }

    @Override
    public void setState(Map<String, ?> partial) {
        store.setState(partial);
    }

    @Override
    public void setState(UnaryOperator<Map<String, Object>> updater) {
        store.setState(updater);
    }

    @Override
    public void patch(Map<String, ?> partial) {
        store.patch(partial);
    }

    @Override
    public void patch(Consumer<Draft> recipe) {
        store.patch(recipe);
    }

    @Override
    public void reset() {
        store.reset();
    }
}
