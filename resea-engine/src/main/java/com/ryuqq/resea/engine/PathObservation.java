package com.ryuqq.resea.engine;

import com.ryuqq.resea.application.store.PatchListener;
import com.ryuqq.resea.application.store.PathObserver;
import com.ryuqq.resea.core.path.StatePath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 경로 단위 관찰.
 *
 * <p>부분 변경 통지를 받아, 관찰 경로 중 마지막 전달 이후 값이 실제로 바뀐 경로만
 * {@link PathObserver}에 전달합니다. 관련 없는 키의 변경은 무시됩니다.</p>
 *
 * <pre>
 * observe(["user.name"])
 *   patch {user: {name: "a", age: 2}} → age만 변경 → 통지 없음
 *   patch {user: {name: "b", age: 2}}            → {user.name: "b"}
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
final class PathObservation implements PatchListener {

    private final List<List<String>> paths;
    private final PathObserver observer;
    private final Map<String, Object> lastDelivered = new LinkedHashMap<>();

    /**
     * 생성자.
     *
     * @param paths 관찰 경로 (정규화 전)
     * @param observer 구독자
     * @param state 구독 시점 State (기준값)
     * @throws IllegalArgumentException paths가 비어 있거나 observer가 null인 경우
     */
    PathObservation(Collection<String> paths, PathObserver observer, Map<String, Object> state) {
        if (paths == null || paths.isEmpty()) {
            throw new IllegalArgumentException("paths cannot be null or empty");
        }
        if (observer == null) {
            throw new IllegalArgumentException("observer cannot be null");
        }
        List<List<String>> normalized = new ArrayList<>();
        for (String path : new LinkedHashSet<>(paths)) {
            List<String> segments = StatePath.segments(path);
            normalized.add(segments);
            lastDelivered.put(String.join(".", segments), StatePath.getValue(state, segments));
        }
        this.paths = Collections.unmodifiableList(normalized);
        this.observer = observer;
    }

    @Override
    public void onPatch(Map<String, Object> changed) {
        Map<String, Object> delivered = new LinkedHashMap<>();
        for (List<String> segments : paths) {
            if (!changed.containsKey(segments.get(0))) {
                continue;
            }
            String path = String.join(".", segments);
            Object current = StatePath.getValue(changed, segments);
            if (!Objects.equals(current, lastDelivered.get(path))) {
                lastDelivered.put(path, current);
                delivered.put(path, current);
            }
        }
        if (!delivered.isEmpty()) {
            observer.onChange(Collections.unmodifiableMap(delivered));
        }
    }

    List<String> paths() {
        List<String> joined = new ArrayList<>(paths.size());
        for (List<String> segments : paths) {
            joined.add(String.join(".", segments));
        }
        return joined;
    }
}
