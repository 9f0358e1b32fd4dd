package com.ryuqq.resea.engine;

import com.ryuqq.resea.core.contract.Getter;
import com.ryuqq.resea.core.contract.Getters;
import com.ryuqq.resea.core.model.StoreId;
import com.ryuqq.resea.core.state.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * 의존성 추적 Getter 캐시.
 *
 * <p>Getter 값을 지연 계산하여 캐시하고, 실제로 읽은 경로가 바뀐 경우에만 재계산합니다.</p>
 *
 * <p><strong>읽기 알고리즘:</strong></p>
 * <ol>
 *   <li>캐시 항목이 유효하면 ({@link GetterCacheEntry#validate}) 즉시 반환</li>
 *   <li>아니면 새 {@link Tracer}로 State를 감싸 Getter 실행 (Tracer 재사용 없음)</li>
 *   <li>읽힌 경로 집합, 경로별 스냅샷, 현재 version과 함께 결과 저장</li>
 * </ol>
 *
 * <p><strong>Getter 간 참조:</strong> Getter 본문에서 다른 Getter를 읽으면 내부 Getter의
 * 추적 경로가 바깥 Getter의 경로 집합에 합쳐집니다 (전이적).</p>
 *
 * <p><strong>실패:</strong> 순환 참조는 {@link IllegalStateException}, Getter 본문 예외는
 * 캐시 항목 없이 호출자에게 그대로 전파됩니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
final class GetterCache {

    private static final Logger log = LoggerFactory.getLogger(GetterCache.class);

    private final StoreId storeId;
    private final Map<String, Getter> getters;
    private final Supplier<Map<String, Object>> stateSource;
    private final LongSupplier versionSource;
    private final Map<String, GetterCacheEntry> entries = new HashMap<>();
    private final Set<String> computing = new LinkedHashSet<>();

    /**
     * 생성자.
     *
     * @param storeId 소유 Store ID (로그/오류 메시지용)
     * @param getters 정의 시점 Getter 테이블
     * @param stateSource 현재 State 공급자
     * @param versionSource 현재 version 공급자
     */
    GetterCache(StoreId storeId, Map<String, Getter> getters,
                Supplier<Map<String, Object>> stateSource, LongSupplier versionSource) {
        this.storeId = storeId;
        this.getters = getters;
        this.stateSource = stateSource;
        this.versionSource = versionSource;
    }

    /**
     * Getter 값 읽기.
     *
     * @param name Getter 이름
     * @return Getter 값
     * @throws IllegalArgumentException 존재하지 않는 Getter인 경우
     * @throws IllegalStateException 순환 참조가 감지된 경우
     */
    Object read(String name) {
        return read(name, null);
    }

    private Object read(String name, Set<String> callerPaths) {
        Getter getter = getters.get(name);
        if (getter == null) {
            throw new IllegalArgumentException(
                String.format("Unknown getter '%s' in store %s", name, storeId.getValue())
            );
        }
        Map<String, Object> state = stateSource.get();
        long version = versionSource.getAsLong();

        GetterCacheEntry entry = entries.get(name);
        if (entry == null || !entry.validate(state, version)) {
            entry = compute(name, getter, state, version);
        }
        if (callerPaths != null) {
            callerPaths.addAll(entry.trackedPaths());
        }
        return entry.value();
    }

    private GetterCacheEntry compute(String name, Getter getter, Map<String, Object> state, long version) {
        if (computing.contains(name)) {
            throw new IllegalStateException(
                String.format("Circular getter dependency in store %s: %s -> %s",
                    storeId.getValue(), String.join(" -> ", computing), name)
            );
        }
        entries.remove(name);
        computing.add(name);
        try {
            Set<String> tracked = new LinkedHashSet<>();
            Object value = getter.compute(new Tracer(state, tracked), new TrackingGetters(tracked));
            GetterCacheEntry entry = GetterCacheEntry.capture(value, version, tracked, state);
            entries.put(name, entry);
            log.debug("Computed getter {}.{} at version {} tracking {}", storeId.getValue(), name, version, tracked);
            return entry;
        } finally {
            computing.remove(name);
        }
    }

    /**
     * 변경된 최상위 키와 겹치는 항목 제거.
     *
     * @param changedTopLevelKeys 변경된 최상위 키
     * @return 제거된 항목 수
     */
    int invalidate(Set<String> changedTopLevelKeys) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.dependsOnAny(changedTopLevelKeys));
        int dropped = before - entries.size();
        if (dropped > 0) {
            log.debug("Invalidated {} getter entries in store {} for keys {}", dropped, storeId.getValue(), changedTopLevelKeys);
        }
        return dropped;
    }

    void clear() {
        entries.clear();
    }

    Optional<GetterCacheEntry> entry(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    int size() {
        return entries.size();
    }

    /**
     * 바깥 Getter의 경로 집합으로 내부 Getter 의존성을 전파하는 {@link Getters}.
     */
    private final class TrackingGetters implements Getters {

        private final Set<String> sink;

        private TrackingGetters(Set<String> sink) {
            this.sink = sink;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> T get(String name) {
            return (T) read(name, sink);
        }
    }
}
