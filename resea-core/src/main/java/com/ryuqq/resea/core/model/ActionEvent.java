package com.ryuqq.resea.core.model;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Action 1회 실행의 텔레메트리 기록.
 *
 * <p>디스패치 시작 시 만들어지고, 전역 Action 이벤트 버스에 한 번 전달된 뒤 버려집니다.
 * 영속화되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>성공: result 설정 가능, error는 null</li>
 *   <li>실패: error 설정, result는 null</li>
 *   <li>endTime - startTime &gt;= 0 (nanoTime 규약에 따라 차이로 비교)</li>
 * </ul>
 *
 * <p>시각은 {@link System#nanoTime()} 기준 단조 증가 값(나노초)입니다.
 * 벽시계 시각이 아니므로 같은 JVM 안에서의 비교와 duration 계산에만 사용합니다.</p>
 *
 * @param storeId Action이 속한 Store
 * @param name Action 이름
 * @param args 호출 인자 (불변, null 요소 허용)
 * @param result 반환 값 (성공 시, null 가능)
 * @param error 발생한 예외 (실패 시)
 * @param startTime 시작 시각 (nanoTime)
 * @param endTime 종료 시각 (nanoTime)
 *
 * @author Resea Team
 * @since 1.0.0
 */
public record ActionEvent(
    StoreId storeId,
    String name,
    List<Object> args,
    Object result,
    Throwable error,
    long startTime,
    long endTime
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 없거나 불변식을 위반한 경우
     */
    public ActionEvent {
        if (storeId == null) {
            throw new IllegalArgumentException("storeId cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (error != null && result != null) {
            throw new IllegalArgumentException("result must be null when error is set");
        }
        if (endTime - startTime < 0) {
            throw new IllegalArgumentException(
                "endTime must not precede startTime (start: " + startTime + ", end: " + endTime + ")"
            );
        }
        args = args == null ? List.of() : Collections.unmodifiableList(Arrays.asList(args.toArray()));
    }

    /**
     * 성공 이벤트 생성.
     *
     * @param storeId Store ID
     * @param name Action 이름
     * @param args 호출 인자
     * @param result 반환 값
     * @param startTime 시작 시각
     * @param endTime 종료 시각
     * @return ActionEvent 인스턴스
     */
    public static ActionEvent succeeded(StoreId storeId, String name, Object[] args,
                                        Object result, long startTime, long endTime) {
        return new ActionEvent(storeId, name, toList(args), result, null, startTime, endTime);
    }

    /**
     * 실패 이벤트 생성.
     *
     * @param storeId Store ID
     * @param name Action 이름
     * @param args 호출 인자
     * @param error 발생한 예외
     * @param startTime 시작 시각
     * @param endTime 종료 시각
     * @return ActionEvent 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static ActionEvent failed(StoreId storeId, String name, Object[] args,
                                     Throwable error, long startTime, long endTime) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new ActionEvent(storeId, name, toList(args), null, error, startTime, endTime);
    }

    private static List<Object> toList(Object[] args) {
        return args == null ? List.of() : Arrays.asList(args);
    }

    /**
     * 실행 시간.
     *
     * @return endTime - startTime
     */
    public Duration duration() {
        return Duration.ofNanos(endTime - startTime);
    }

    /**
     * 성공 여부.
     *
     * @return error가 없으면 true
     */
    public boolean isSuccess() {
        return error == null;
    }
}
