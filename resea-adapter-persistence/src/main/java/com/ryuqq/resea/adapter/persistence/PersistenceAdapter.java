package com.ryuqq.resea.adapter.persistence;

import com.ryuqq.resea.application.store.Store;
import com.ryuqq.resea.application.store.Subscription;
import com.ryuqq.resea.core.path.StatePath;
import com.ryuqq.resea.core.path.StateTrees;
import com.ryuqq.resea.core.spi.PersistOptions;
import com.ryuqq.resea.core.spi.StateCodec;
import com.ryuqq.resea.core.spi.StorageMedium;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Store 하나를 저장 매체에 연결하는 영속화 어댑터.
 *
 * <p><strong>연결 절차 ({@link #attach()}):</strong></p>
 * <ol>
 *   <li>key로 매체 읽기</li>
 *   <li>값이 있으면 역직렬화 후 {@link Store#hydrate} (통지 없음)</li>
 *   <li>값이 없고 hydrateInitial이면 현재 State를 즉시 기록</li>
 *   <li>전체 State 변경을 구독하여 변경마다 허용 경로만 추출해 기록</li>
 * </ol>
 *
 * <p><strong>실패 정책:</strong> 매체/코덱 예외는 WARN 로그 후 무시합니다.
 * Store는 메모리 상에서 계속 동작합니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public final class PersistenceAdapter {

    private static final Logger log = LoggerFactory.getLogger(PersistenceAdapter.class);

    private final Store store;
    private final String key;
    private final List<String> paths;
    private final StateCodec codec;
    private final StorageMedium medium;
    private final boolean hydrateInitial;

    /**
     * 생성자.
     *
     * @param store 대상 Store
     * @param options 영속화 설정 (codec, medium이 채워져 있어야 함)
     * @throws IllegalArgumentException store/options가 null이거나 codec/medium이 비어 있는 경우
     */
    public PersistenceAdapter(Store store, PersistOptions options) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (options.codec() == null || options.medium() == null) {
            throw new IllegalArgumentException("options must carry a codec and a medium");
        }
        this.store = store;
        this.key = options.resolveKey(store.id());
        this.paths = options.paths();
        this.codec = options.codec();
        this.medium = options.medium();
        this.hydrateInitial = options.hydrateInitial();
    }

    /**
     * 저장된 State 복원 후 변경 구독 시작.
     *
     * @return 구독 해제 핸들
     */
    public Subscription attach() {
        Optional<String> saved = read();
        if (saved.isPresent()) {
            restore(saved.get());
        } else if (hydrateInitial) {
            write(store.getState());
        }
        return store.subscribe((next, previous) -> write(next));
    }

    /**
     * 현재 State 즉시 기록.
     */
    public void flush() {
        write(store.getState());
    }

    /**
     * 저장된 값 제거.
     */
    public void clear() {
        try {
            medium.remove(key);
        } catch (RuntimeException e) {
            log.warn("Failed to clear persisted state of store {} (key: {})", store.id().getValue(), key, e);
        }
    }

    /**
     * 허용 경로만 담은 새 트리 추출 (경로가 없으면 전체 State).
     *
     * @param state 원본 State
     * @return 기록할 트리
     */
    Map<String, Object> extract(Map<String, Object> state) {
        if (paths.isEmpty()) {
            return state;
        }
        Object subset = Collections.emptyMap();
        for (String path : paths) {
            if (StatePath.contains(state, path)) {
                subset = StateTrees.withValue(subset, StatePath.segments(path), StatePath.getValue(state, path));
            }
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> tree = (Map<String, Object>) subset;
        return tree;
    }

    public String key() {
        return key;
    }

    private Optional<String> read() {
        try {
            return medium.get(key);
        } catch (RuntimeException e) {
            log.warn("Failed to read persisted state of store {} (key: {}); continuing in memory",
                store.id().getValue(), key, e);
            return Optional.empty();
        }
    }

    private void restore(String text) {
        try {
            Map<String, Object> restored = codec.deserialize(text);
            store.hydrate(restored == null ? Map.of() : new LinkedHashMap<>(restored));
            log.debug("Hydrated store {} from key {}", store.id().getValue(), key);
        } catch (RuntimeException e) {
            log.warn("Failed to restore persisted state of store {} (key: {}); keeping initial state",
                store.id().getValue(), key, e);
        }
    }

    private void write(Map<String, Object> state) {
        try {
            medium.set(key, codec.serialize(extract(state)));
        } catch (RuntimeException e) {
            log.warn("Failed to persist state of store {} (key: {}); continuing in memory",
                store.id().getValue(), key, e);
        }
    }
}
