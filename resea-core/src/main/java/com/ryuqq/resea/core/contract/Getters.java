package com.ryuqq.resea.core.contract;

/**
 * Getter 간 합성을 위한 조회 인터페이스.
 *
 * @author Resea Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Getters {

    /**
     * 다른 Getter의 현재 값 조회.
     *
     * @param name Getter 이름
     * @param <T> 기대 타입
     * @return Getter 값
     * @throws IllegalArgumentException 존재하지 않는 Getter인 경우
     */
    <T> T get(String name);
}
