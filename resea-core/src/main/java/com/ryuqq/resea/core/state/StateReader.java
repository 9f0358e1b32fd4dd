package com.ryuqq.resea.core.state;

import java.util.Set;

/**
 * State 트리 읽기 인터페이스.
 *
 * <p>Getter 본문과 Action 본문이 State를 읽는 유일한 통로입니다.
 * 구현체에 따라 읽은 경로가 기록될 수 있습니다 ({@link Tracer}).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * int count = state.get("count");
 * String city = state.get("user.address.city");
 * StateReader address = state.at("user.address");
 * String zip = address.get("zip");
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public interface StateReader {

    /**
     * 경로 위치의 값 조회.
     *
     * <p>객체/배열 값은 동결된 {@code Map}/{@code List}로 반환됩니다.</p>
     *
     * @param path 경로 (현재 범위 기준 상대 경로)
     * @param <T> 기대 타입
     * @return 값 (없으면 null)
     * @throws ClassCastException 기대 타입과 다른 경우 (호출 측에서 발생)
     */
    <T> T get(String path);

    /**
     * 하위 경로 범위의 Reader 반환.
     *
     * <p>값이 객체/배열이 아니면 빈 범위의 Reader를 반환합니다.</p>
     *
     * @param path 하위 경로
     * @return 하위 범위 Reader
     */
    StateReader at(String path);

    /**
     * 현재 범위에 키가 존재하는지 확인.
     *
     * @param key 키
     * @return 존재 여부
     */
    boolean has(String key);

    /**
     * 현재 범위의 키 목록.
     *
     * <p>루트에서 호출하면 최상위 키 목록 자체가 읽기 대상이 됩니다
     * ({@link com.ryuqq.resea.core.path.StatePath#ROOT}).</p>
     *
     * @return 키 집합 (배열이면 인덱스 문자열)
     */
    Set<String> keys();

    /**
     * 현재 범위의 절대 경로.
     *
     * @return 루트이면 빈 문자열
     */
    String path();
}
