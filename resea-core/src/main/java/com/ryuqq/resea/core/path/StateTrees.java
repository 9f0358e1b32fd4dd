package com.ryuqq.resea.core.path;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 불변 State 트리 빌더.
 *
 * <p>Store가 보관하는 모든 트리는 동결(freeze)된 상태입니다. 객체는 불변
 * {@link LinkedHashMap}, 배열은 불변 {@link ArrayList}로 깊은 복사되며,
 * 변경은 항상 쓰기 경로 위의 노드만 새로 만드는 copy-on-write 방식으로 수행됩니다.</p>
 *
 * <p><strong>병합 규칙 ({@link #deepMerge}):</strong></p>
 * <ul>
 *   <li>객체 + 객체 → 키 단위 재귀 병합</li>
 *   <li>배열 → 통째로 교체</li>
 *   <li>그 외 → 새 값으로 교체</li>
 * </ul>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public final class StateTrees {

    /**
     * 배열 끝을 넘는 인덱스에 기록할 때 null로 채울 수 있는 최대 칸 수.
     */
    public static final int MAX_LIST_PADDING = 1_000;

    // Utility class - prevent instantiation
    private StateTrees() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 값을 깊은 복사하여 동결.
     *
     * <p>Map의 키는 문자열로 변환됩니다. 배열(Object[])은 불변 List로 변환됩니다.</p>
     *
     * @param value 원본 값
     * @return 동결된 값 (스칼라는 그대로 반환)
     */
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Object[] array) {
            List<Object> copy = new ArrayList<>(array.length);
            for (Object element : array) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * 최상위 State 맵 동결.
     *
     * @param state 원본 맵 (null이면 빈 맵)
     * @return 동결된 최상위 맵
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> freezeRoot(Map<String, ?> state) {
        if (state == null) {
            return Collections.emptyMap();
        }
        return (Map<String, Object>) freeze(state);
    }

    /**
     * 깊은 병합.
     *
     * @param current 현재 값
     * @param patch 병합할 값
     * @return 병합된 동결 값
     */
    public static Object deepMerge(Object current, Object patch) {
        if (current instanceof Map<?, ?> base && patch instanceof Map<?, ?> overlay) {
            Map<String, Object> merged = new LinkedHashMap<>();
            base.forEach((k, v) -> merged.put(String.valueOf(k), v));
            overlay.forEach((k, v) -> {
                String key = String.valueOf(k);
                merged.put(key, deepMerge(merged.get(key), v));
            });
            return Collections.unmodifiableMap(merged);
        }
        return freeze(patch);
    }

    /**
     * 경로 위치의 값을 교체한 새 트리 반환 (copy-on-write).
     *
     * <p>중간 노드가 없으면 다음 세그먼트가 인덱스인 경우 배열, 아니면 객체를 생성합니다.
     * 배열 길이를 넘는 인덱스는 null로 채운 뒤 기록하되, 채울 칸이
     * {@link #MAX_LIST_PADDING}을 넘으면 거부합니다.</p>
     *
     * @param node 원본 노드 (변경되지 않음)
     * @param segments 경로 세그먼트
     * @param value 기록할 값
     * @return 새 노드
     * @throws IllegalArgumentException 인덱스가 배열 끝에서 너무 멀리 떨어진 경우
     */
    public static Object withValue(Object node, List<String> segments, Object value) {
        return withValue(node, segments, 0, value);
    }

    private static Object withValue(Object node, List<String> segments, int depth, Object value) {
        if (depth == segments.size()) {
            return freeze(value);
        }
        String segment = segments.get(depth);
        if (node instanceof List<?> list && StatePath.isIndex(segment)) {
            int index = Integer.parseInt(segment);
            if (index - list.size() > MAX_LIST_PADDING) {
                throw new IllegalArgumentException(String.format(
                    "Index %d is too far past the end of a list of size %d (max padding: %d)",
                    index, list.size(), MAX_LIST_PADDING
                ));
            }
            List<Object> copy = new ArrayList<>(list);
            while (copy.size() <= index) {
                copy.add(null);
            }
            copy.set(index, withValue(copy.get(index), segments, depth + 1, value));
            return Collections.unmodifiableList(copy);
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        if (node instanceof Map<?, ?> map) {
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        } else if (StatePath.isIndex(segment) && node == null) {
            return withValue(Collections.emptyList(), segments, depth, value);
        }
        copy.put(segment, withValue(copy.get(segment), segments, depth + 1, value));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * 경로 위치의 키를 제거한 새 트리 반환 (copy-on-write).
     *
     * <p>경로가 존재하지 않으면 원본 노드를 그대로 반환합니다.</p>
     *
     * @param node 원본 노드
     * @param segments 경로 세그먼트
     * @return 새 노드
     */
    public static Object withoutValue(Object node, List<String> segments) {
        return withoutValue(node, segments, 0);
    }

    private static Object withoutValue(Object node, List<String> segments, int depth) {
        String segment = segments.get(depth);
        boolean last = depth == segments.size() - 1;
        if (node instanceof Map<?, ?> map) {
            if (!map.containsKey(segment)) {
                return node;
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            if (last) {
                copy.remove(segment);
            } else {
                copy.put(segment, withoutValue(copy.get(segment), segments, depth + 1));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (node instanceof List<?> list && StatePath.isIndex(segment)) {
            int index = Integer.parseInt(segment);
            if (index >= list.size()) {
                return node;
            }
            List<Object> copy = new ArrayList<>(list);
            if (last) {
                copy.remove(index);
            } else {
                copy.set(index, withoutValue(copy.get(index), segments, depth + 1));
            }
            return Collections.unmodifiableList(copy);
        }
        return node;
    }
}
