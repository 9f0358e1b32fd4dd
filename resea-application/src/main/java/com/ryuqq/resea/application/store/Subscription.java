package com.ryuqq.resea.application.store;

/**
 * 구독 해제 핸들.
 *
 * <p>{@link #unsubscribe()}는 멱등입니다. 여러 번 호출해도 안전합니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Subscription {

    /**
     * 구독 해제.
     */
    void unsubscribe();
}
