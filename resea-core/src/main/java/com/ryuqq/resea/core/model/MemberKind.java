package com.ryuqq.resea.core.model;

/**
 * Store 멤버 종류.
 *
 * <p>Store 생성 시 모든 Getter, Action, Plugin 속성 이름을 이 종류로 분류한
 * 디스패치 테이블이 만들어집니다. 테이블에 없는 키는 State 필드로 해석됩니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public enum MemberKind {

    /**
     * State 필드.
     */
    STATE,

    /**
     * 캐시되는 파생 값.
     */
    GETTER,

    /**
     * 동기 Action.
     */
    ACTION,

    /**
     * 비동기 Action ({@code <name>Loading} 플래그 관리 대상).
     */
    ASYNC_ACTION,

    /**
     * Plugin이 기여한 속성.
     */
    PROPERTY;

    /**
     * 디스패치 가능한 Action인지 확인.
     *
     * @return ACTION 또는 ASYNC_ACTION이면 true
     */
    public boolean isAction() {
        return this == ACTION || this == ASYNC_ACTION;
    }
}
