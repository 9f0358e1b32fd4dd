package com.ryuqq.resea.core.contract;

import com.ryuqq.resea.core.state.StateReader;

/**
 * 캐시되는 파생 값 계산 함수.
 *
 * <p>{@code state}는 읽은 경로를 기록하는 Tracer이며, {@code getters}를 통해 읽은
 * 다른 Getter의 의존 경로도 함께 추적됩니다. 추적된 경로의 값이 바뀌기 전까지는
 * 재계산되지 않습니다.</p>
 *
 * <pre>
 * Getter doubleCount = (state, getters) -&gt; state.&lt;Integer&gt;get("count") * 2;
 * Getter label = (state, getters) -&gt; getters.get("doubleCount") + " items";
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Getter {

    /**
     * 값 계산.
     *
     * @param state 경로 추적 State Reader
     * @param getters 같은 Store의 다른 Getter
     * @return 계산된 값 (null 가능)
     */
    Object compute(StateReader state, Getters getters);
}
