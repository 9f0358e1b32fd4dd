package com.ryuqq.resea.core.state;

import java.util.Map;
import java.util.Set;

/**
 * 읽은 경로를 기록하는 {@link StateReader}.
 *
 * <p>Getter 계산 중 State 접근을 가로채어, 거쳐간 모든 경로를 호출자가 넘겨준
 * 집합에 추가합니다. {@code get("a.b.c")}는 "a", "a.b", "a.b.c"를 기록하고,
 * {@link #at(String)}은 같은 집합을 공유하는 하위 Tracer를 반환합니다.</p>
 *
 * <p>Tracer는 한 번의 계산에만 사용됩니다. 재계산마다 새 Tracer와 새 집합을 만들어야
 * 조건부 읽기로 의존 경로가 줄어드는 경우에도 정확합니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public final class Tracer extends MapStateReader {

    private final Set<String> sink;

    /**
     * 루트 Tracer 생성.
     *
     * @param root 루트 State 맵
     * @param sink 읽은 경로가 추가될 집합
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public Tracer(Map<String, Object> root, Set<String> sink) {
        super(root);
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.sink = sink;
    }

    private Tracer(Object node, String path, Set<String> sink) {
        super(node, path);
        this.sink = sink;
    }

    @Override
    protected StateReader scoped(Object child, String childPath) {
        return new Tracer(child, childPath, sink);
    }

    @Override
    protected void onRead(String absolutePath) {
        sink.add(absolutePath);
    }
}
