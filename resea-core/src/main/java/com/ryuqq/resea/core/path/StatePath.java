package com.ryuqq.resea.core.path;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * State 경로 문자열 유틸리티.
 *
 * <p>점(.)과 대괄호 인덱스 표기를 함께 지원하며, 모든 경로는 점으로 구분된
 * 정규화 형태로 변환됩니다.</p>
 *
 * <p><strong>정규화 예시:</strong></p>
 * <pre>
 * "user.name"        → [user, name]
 * "items[0].id"      → [items, 0, id]
 * "matrix[1][2]"     → [matrix, 1, 2]
 * </pre>
 *
 * <p><strong>Segment Arena:</strong> 한 번 분해된 경로는 내부 캐시에 보관되어
 * 재분해 비용 없이 재사용됩니다. 캐시된 목록은 불변입니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public final class StatePath {

    /**
     * 루트 자체를 가리키는 경로 (최상위 키 목록 의존성).
     *
     * <p>일반 경로는 비어 있을 수 없으므로 실제 키와 겹치지 않습니다.</p>
     */
    public static final String ROOT = "";

    private static final Pattern BRACKET_INDEX = Pattern.compile("\\[(\\d+)]");
    private static final Pattern NUMERIC = Pattern.compile("\\d{1,9}");
    private static final int MAX_ARENA_SIZE = 4096;

    private static final Map<String, List<String>> ARENA = new ConcurrentHashMap<>();

    // Utility class - prevent instantiation
    private StatePath() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 경로를 세그먼트 목록으로 분해.
     *
     * @param path 경로 문자열 (예: "items[0].id")
     * @return 불변 세그먼트 목록
     * @throws IllegalArgumentException path가 null, 빈 문자열이거나 세그먼트가 없는 경우
     */
    public static List<String> segments(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        List<String> cached = ARENA.get(path);
        if (cached != null) {
            return cached;
        }
        List<String> parsed = parse(path);
        if (ARENA.size() < MAX_ARENA_SIZE) {
            ARENA.putIfAbsent(path, parsed);
        }
        return parsed;
    }

    private static List<String> parse(String path) {
        String dotted = BRACKET_INDEX.matcher(path.trim()).replaceAll(".$1");
        List<String> result = new ArrayList<>();
        for (String segment : dotted.split("\\.")) {
            if (!segment.isEmpty()) {
                result.add(segment);
            }
        }
        if (result.isEmpty()) {
            throw new IllegalArgumentException("path has no segments: " + path);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 경로 정규화 ("items[0].id" → "items.0.id").
     *
     * @param path 경로 문자열
     * @return 정규화된 경로
     */
    public static String normalize(String path) {
        return String.join(".", segments(path));
    }

    /**
     * 최상위 키 추출 ("a.b.c" → "a"). {@link #ROOT}는 그대로 반환합니다.
     *
     * @param path 경로 문자열
     * @return 첫 번째 세그먼트
     */
    public static String topLevelKey(String path) {
        if (ROOT.equals(path)) {
            return ROOT;
        }
        return segments(path).get(0);
    }

    /**
     * 부모 경로와 자식 키를 결합.
     *
     * @param parent 부모 경로 (빈 문자열이면 루트)
     * @param key 자식 키
     * @return 결합된 경로
     */
    public static String join(String parent, String key) {
        if (parent == null || parent.isEmpty()) {
            return key;
        }
        return parent + "." + key;
    }

    /**
     * 경로의 모든 접두 경로 목록 ("a.b.c" → [a, a.b, a.b.c]).
     *
     * @param path 경로 문자열
     * @return 짧은 것부터 정렬된 접두 경로 목록
     */
    public static List<String> prefixes(String path) {
        List<String> segments = segments(path);
        List<String> prefixes = new ArrayList<>(segments.size());
        StringBuilder current = new StringBuilder();
        for (String segment : segments) {
            if (current.length() > 0) {
                current.append('.');
            }
            current.append(segment);
            prefixes.add(current.toString());
        }
        return prefixes;
    }

    /**
     * 세그먼트가 배열 인덱스 형태인지 확인.
     *
     * @param segment 세그먼트
     * @return 숫자로만 구성된 경우 true
     */
    public static boolean isIndex(String segment) {
        return NUMERIC.matcher(segment).matches();
    }

    /**
     * 경로 위치의 값 조회.
     *
     * <p>중간 노드가 없거나 객체/배열이 아니면 null을 반환합니다 (예외 없음).</p>
     *
     * @param root 루트 노드
     * @param path 경로 문자열
     * @return 경로 위치의 값 (없으면 null)
     */
    public static Object getValue(Object root, String path) {
        return getValue(root, segments(path));
    }

    /**
     * 세그먼트 목록 위치의 값 조회.
     *
     * @param root 루트 노드
     * @param segments 세그먼트 목록
     * @return 경로 위치의 값 (없으면 null)
     */
    public static Object getValue(Object root, List<String> segments) {
        Object current = root;
        for (String segment : segments) {
            if (current == null) {
                return null;
            }
            current = child(current, segment);
        }
        return current;
    }

    /**
     * 경로 위치에 키가 존재하는지 확인 (값이 null이어도 키가 있으면 true).
     *
     * @param root 루트 노드
     * @param path 경로 문자열
     * @return 존재 여부
     */
    public static boolean contains(Object root, String path) {
        List<String> segments = segments(path);
        Object parent = getValue(root, segments.subList(0, segments.size() - 1));
        String last = segments.get(segments.size() - 1);
        if (parent instanceof Map<?, ?> map) {
            return map.containsKey(last);
        }
        if (parent instanceof List<?> list && isIndex(last)) {
            return Integer.parseInt(last) < list.size();
        }
        return false;
    }

    static Object child(Object node, String segment) {
        if (node instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (node instanceof List<?> list && isIndex(segment)) {
            int index = Integer.parseInt(segment);
            return index < list.size() ? list.get(index) : null;
        }
        return null;
    }
}
