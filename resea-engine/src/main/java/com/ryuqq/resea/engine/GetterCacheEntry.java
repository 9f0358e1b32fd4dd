package com.ryuqq.resea.engine;

import com.ryuqq.resea.core.path.StatePath;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Getter 캐시 항목.
 *
 * <p><strong>유효성 규칙 (2단계):</strong></p>
 * <ol>
 *   <li>version이 Store의 현재 version과 같으면 즉시 유효</li>
 *   <li>version이 뒤처졌더라도 모든 추적 경로의 현재 값이 스냅샷과 같으면 유효
 *       (재계산 없이 현재 version으로 갱신)</li>
 * </ol>
 *
 * <p>루트 경로({@link StatePath#ROOT})의 스냅샷은 최상위 키 목록입니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
final class GetterCacheEntry {

    private final Object value;
    private final Set<String> trackedPaths;
    private final Set<String> topLevelKeys;
    private final Map<String, Object> pathSnapshot;
    private long version;

    private GetterCacheEntry(Object value, long version, Set<String> trackedPaths, Map<String, Object> pathSnapshot) {
        this.value = value;
        this.version = version;
        this.trackedPaths = trackedPaths;
        this.pathSnapshot = pathSnapshot;
        Set<String> keys = new LinkedHashSet<>();
        for (String path : trackedPaths) {
            keys.add(StatePath.topLevelKey(path));
        }
        this.topLevelKeys = Collections.unmodifiableSet(keys);
    }

    /**
     * 계산 결과와 추적 경로로 항목 생성 (경로별 현재 값 스냅샷 포함).
     *
     * @param value 계산 결과
     * @param version 계산 시점 version
     * @param trackedPaths 추적된 경로
     * @param state 계산 시점 State
     * @return 캐시 항목
     */
    static GetterCacheEntry capture(Object value, long version, Set<String> trackedPaths, Map<String, Object> state) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (String path : trackedPaths) {
            snapshot.put(path, snapshotOf(state, path));
        }
        return new GetterCacheEntry(
            value,
            version,
            Collections.unmodifiableSet(new LinkedHashSet<>(trackedPaths)),
            Collections.unmodifiableMap(snapshot)
        );
    }

    /**
     * 유효성 검사. 스냅샷이 일치하면 version을 갱신합니다.
     *
     * @param state 현재 State
     * @param currentVersion 현재 version
     * @return 유효하면 true
     */
    boolean validate(Map<String, Object> state, long currentVersion) {
        if (version == currentVersion) {
            return true;
        }
        for (Map.Entry<String, Object> snapshot : pathSnapshot.entrySet()) {
            if (!Objects.equals(snapshotOf(state, snapshot.getKey()), snapshot.getValue())) {
                return false;
            }
        }
        version = currentVersion;
        return true;
    }

    boolean dependsOnAny(Set<String> changedTopLevelKeys) {
        for (String key : topLevelKeys) {
            if (changedTopLevelKeys.contains(key)) {
                return true;
            }
        }
        return false;
    }

    Object value() {
        return value;
    }

    long version() {
        return version;
    }

    Set<String> trackedPaths() {
        return trackedPaths;
    }

    Map<String, Object> pathSnapshot() {
        return pathSnapshot;
    }

    private static Object snapshotOf(Map<String, Object> state, String path) {
        if (StatePath.ROOT.equals(path)) {
            return List.copyOf(state.keySet());
        }
        return StatePath.getValue(state, path);
    }
}
