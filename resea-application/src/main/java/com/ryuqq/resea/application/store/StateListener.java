package com.ryuqq.resea.application.store;

import java.util.Map;

/**
 * 전체 State 변경 구독자.
 *
 * @author Resea Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateListener {

    /**
     * 커밋된 변경 통지.
     *
     * @param newState 변경 후 State (불변)
     * @param oldState 변경 전 State (불변)
     */
    void onChange(Map<String, Object> newState, Map<String, Object> oldState);
}
