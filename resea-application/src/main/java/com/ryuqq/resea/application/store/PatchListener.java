package com.ryuqq.resea.application.store;

import java.util.Map;

/**
 * 부분 변경 구독자 (fine-grained setter).
 *
 * <p>커밋마다 변경된 최상위 키와 그 새 값만 전달받습니다.
 * 제거된 키는 null 값으로 전달됩니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PatchListener {

    /**
     * 부분 변경 통지.
     *
     * @param changed 변경된 최상위 키 → 새 값 (불변)
     */
    void onPatch(Map<String, Object> changed);
}
