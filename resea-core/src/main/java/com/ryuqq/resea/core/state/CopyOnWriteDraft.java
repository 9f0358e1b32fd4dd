package com.ryuqq.resea.core.state;

import com.ryuqq.resea.core.path.StatePath;
import com.ryuqq.resea.core.path.StateTrees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Copy-on-write 방식의 {@link Draft} 구현.
 *
 * <p>원본 트리는 절대 변경되지 않습니다. 쓰기마다 해당 경로 위의 노드만 새로 만들어
 * 작업용 최상위 맵에 반영합니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public final class CopyOnWriteDraft implements Draft {

    private final Map<String, Object> working;
    private final Set<String> touched = new LinkedHashSet<>();

    /**
     * Draft 생성.
     *
     * @param base 동결된 원본 최상위 맵
     * @throws IllegalArgumentException base가 null인 경우
     */
    public CopyOnWriteDraft(Map<String, Object> base) {
        if (base == null) {
            throw new IllegalArgumentException("base cannot be null");
        }
        this.working = new LinkedHashMap<>(base);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String path) {
        return (T) StatePath.getValue(working, StatePath.segments(path));
    }

    @Override
    public void set(String path, Object value) {
        List<String> segments = StatePath.segments(path);
        String key = segments.get(0);
        Object updated = StateTrees.withValue(working.get(key), segments.subList(1, segments.size()), value);
        working.put(key, updated);
        touched.add(key);
    }

    @Override
    public void append(String path, Object element) {
        Object current = get(path);
        List<Object> list;
        if (current == null) {
            list = new ArrayList<>();
        } else if (current instanceof List<?> existing) {
            list = new ArrayList<>(existing);
        } else {
            throw new IllegalStateException("Cannot append to non-array value at path: " + path);
        }
        list.add(element);
        set(path, list);
    }

    @Override
    public void remove(String path) {
        List<String> segments = StatePath.segments(path);
        String key = segments.get(0);
        if (!working.containsKey(key)) {
            return;
        }
        if (segments.size() == 1) {
            working.remove(key);
        } else {
            working.put(key, StateTrees.withoutValue(working.get(key), segments.subList(1, segments.size())));
        }
        touched.add(key);
    }

    @Override
    public Set<String> touchedKeys() {
        return Collections.unmodifiableSet(touched);
    }

    @Override
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(working));
    }
}
