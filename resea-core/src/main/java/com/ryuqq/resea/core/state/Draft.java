package com.ryuqq.resea.core.state;

import java.util.Map;
import java.util.Set;

/**
 * 함수형 patch에 전달되는 쓰기 가로채기 뷰.
 *
 * <p>Draft에 대한 모든 쓰기는 작업용 사본 트리에 기록되며, 어느 최상위 키가
 * 변경되었는지 추적됩니다. 레시피 종료 후 Store는 실제로 값이 달라진
 * 최상위 키만 모아 최소 diff로 커밋합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * store.patch(draft -&gt; {
 *     draft.set("user.address.city", "Seoul");
 *     draft.append("tags", "new");
 *     boolean active = draft.get("active");
 *     draft.set("active", !active);
 * });
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public interface Draft {

    /**
     * 작업 트리의 값 조회 (이전 쓰기가 반영된 값).
     *
     * @param path 경로
     * @param <T> 기대 타입
     * @return 값 (없으면 null)
     */
    <T> T get(String path);

    /**
     * 경로 위치에 값 기록. 중간 노드가 없으면 생성합니다.
     *
     * @param path 경로
     * @param value 값 (객체/배열은 동결 복사됨)
     */
    void set(String path, Object value);

    /**
     * 경로 위치의 배열 끝에 요소 추가. 배열이 없으면 새로 만듭니다.
     *
     * @param path 배열 경로
     * @param element 추가할 요소
     * @throws IllegalStateException 경로의 값이 배열이 아닌 경우
     */
    void append(String path, Object element);

    /**
     * 경로 위치의 키 제거.
     *
     * @param path 경로
     */
    void remove(String path);

    /**
     * 쓰기가 발생한 최상위 키 집합.
     *
     * @return 최상위 키 집합 (쓰기 순서)
     */
    Set<String> touchedKeys();

    /**
     * 현재 작업 트리.
     *
     * @return 동결된 최상위 맵
     */
    Map<String, Object> snapshot();
}
