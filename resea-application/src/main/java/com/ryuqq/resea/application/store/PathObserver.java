package com.ryuqq.resea.application.store;

import java.util.Map;

/**
 * 경로 단위 구독자.
 *
 * <p>렌더링 계층이 관련 없는 변경에 반응하지 않도록, 관찰 중인 경로의 값이
 * 실제로 달라졌을 때만 호출됩니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PathObserver {

    /**
     * 관찰 경로 변경 통지.
     *
     * @param changed 값이 바뀐 정규화 경로 → 새 값 (불변)
     */
    void onChange(Map<String, Object> changed);
}
