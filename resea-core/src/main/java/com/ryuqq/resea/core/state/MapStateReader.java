package com.ryuqq.resea.core.state;

import com.ryuqq.resea.core.path.StatePath;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 동결된 State 트리 위의 기본 {@link StateReader}.
 *
 * <p>읽은 경로를 기록하지 않습니다. 하위 클래스는 {@link #onRead(String)}를
 * 재정의하여 읽기를 가로챌 수 있습니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public class MapStateReader implements StateReader {

    private final Object node;
    private final String path;

    /**
     * 루트 Reader 생성.
     *
     * @param root 루트 State 맵
     * @throws IllegalArgumentException root가 null인 경우
     */
    public MapStateReader(Map<String, Object> root) {
        this(requireRoot(root), "");
    }

    /**
     * 범위 지정 Reader 생성.
     *
     * @param node 현재 범위의 노드
     * @param path 현재 범위의 절대 경로
     */
    protected MapStateReader(Object node, String path) {
        this.node = node;
        this.path = path;
    }

    private static Object requireRoot(Map<String, Object> root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        return root;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String relativePath) {
        List<String> segments = StatePath.segments(relativePath);
        recordTraversal(segments);
        return (T) StatePath.getValue(node, segments);
    }

    @Override
    public StateReader at(String relativePath) {
        List<String> segments = StatePath.segments(relativePath);
        String absolute = recordTraversal(segments);
        return scoped(StatePath.getValue(node, segments), absolute);
    }

    @Override
    public boolean has(String key) {
        onRead(StatePath.join(path, key));
        if (node instanceof Map<?, ?> map) {
            return map.containsKey(key);
        }
        if (node instanceof List<?> list && StatePath.isIndex(key)) {
            return Integer.parseInt(key) < list.size();
        }
        return false;
    }

    @Override
    public Set<String> keys() {
        onRead(path);
        if (node instanceof Map<?, ?> map) {
            Set<String> keys = new LinkedHashSet<>();
            map.keySet().forEach(k -> keys.add(String.valueOf(k)));
            return Collections.unmodifiableSet(keys);
        }
        if (node instanceof List<?> list) {
            Set<String> keys = new LinkedHashSet<>();
            for (int i = 0; i < list.size(); i++) {
                keys.add(String.valueOf(i));
            }
            return Collections.unmodifiableSet(keys);
        }
        return Collections.emptySet();
    }

    @Override
    public String path() {
        return path;
    }

    /**
     * 하위 범위 Reader 생성 (하위 클래스에서 재정의).
     *
     * @param child 하위 노드
     * @param childPath 하위 절대 경로
     * @return 하위 Reader
     */
    protected StateReader scoped(Object child, String childPath) {
        return new MapStateReader(child, childPath);
    }

    /**
     * 경로 읽기 훅. 기본 구현은 아무 것도 하지 않습니다.
     *
     * @param absolutePath 읽은 절대 경로
     */
    protected void onRead(String absolutePath) {
    }

    private String recordTraversal(List<String> segments) {
        String current = path;
        for (String segment : segments) {
            current = StatePath.join(current, segment);
            onRead(current);
        }
        return current;
    }
}
