package com.ryuqq.resea.application.store;

import com.ryuqq.resea.application.registry.ActionListener;
import com.ryuqq.resea.core.contract.StoreDefinition;
import com.ryuqq.resea.core.model.StoreId;
import com.ryuqq.resea.core.state.Draft;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * 소비자용 Store 인터페이스.
 *
 * <p>렌더링/관찰 계층이 사용하는 언어 중립 계약입니다. 모든 쓰기는
 * {@code setState}/{@code patch}/{@code reset}을 통과하며, 그때마다 version 증가와
 * Getter 캐시 무효화가 보장됩니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>State 필드 및 Getter 값 읽기</li>
 *   <li>State 쓰기 (얕은 병합, 깊은 병합, Draft)</li>
 *   <li>전체/부분/경로 단위 구독</li>
 *   <li>Action 디스패치 및 Action 이벤트 구독</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 단일 스레드 협력 모델입니다. 같은 Store를 여러 스레드에서
 * 동시에 변경해서는 안 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Store store = registry.defineStore(counterDefinition);
 * store.setState(Map.of("count", 1));
 * int doubled = store.getter("doubleCount");
 * Subscription subscription = store.subscribe((next, prev) -&gt; render(next));
 * store.dispatch("increment");
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public interface Store {

    /**
     * Store ID.
     *
     * @return Store ID
     */
    StoreId id();

    /**
     * Store 정의.
     *
     * @return 생성에 사용된 정의
     */
    StoreDefinition definition();

    /**
     * 현재 State의 얕은 방어 복사본.
     *
     * <p>반환된 맵을 변경해도 Store에 영향이 없습니다. 중첩 값은 불변입니다.</p>
     *
     * @return State 복사본
     */
    Map<String, Object> getState();

    /**
     * 현재 version (커밋마다 1 증가).
     *
     * @return version
     */
    long version();

    /**
     * 재진입 가드 상태.
     *
     * @return setState/patch 처리 중이면 true
     */
    boolean isUpdating();

    /**
     * 키 읽기 (Getter → Plugin 속성 → State 필드 순으로 해석).
     *
     * @param key 키
     * @param <T> 기대 타입
     * @return 값
     * @throws IllegalArgumentException key가 Action 이름인 경우
     */
    <T> T get(String key);

    /**
     * Getter 값 읽기.
     *
     * @param name Getter 이름
     * @param <T> 기대 타입
     * @return Getter 값
     * @throws IllegalArgumentException 존재하지 않는 Getter인 경우
     */
    <T> T getter(String name);

    /**
     * Plugin 기여 속성 읽기.
     *
     * @param name 속성 이름
     * @param <T> 기대 타입
     * @return 속성 값 (없으면 null)
     */
    <T> T property(String name);

    /**
     * 경로 쓰기 (patch로 전달).
     *
     * @param path 경로 (예: "user.name", "items[0].id")
     * @param value 값
     */
    void set(String path, Object value);

    /**
     * 얕은 병합.
     *
     * <p>모든 키가 현재 값과 같으면 아무 일도 일어나지 않습니다 (version 유지, 통지 없음).
     * 통지 중 재진입한 호출은 무시됩니다.</p>
     *
     * @param partial 부분 State
     * @throws IllegalArgumentException partial이 null인 경우
     */
    void setState(Map<String, ?> partial);

    /**
     * 함수형 얕은 병합.
     *
     * @param updater 이전 State → 부분 State
     * @throws IllegalArgumentException updater가 null인 경우
     */
    void setState(UnaryOperator<Map<String, Object>> updater);

    /**
     * 깊은 병합 (중첩 객체 병합, 배열은 통째로 교체).
     *
     * @param partial 부분 State
     * @throws IllegalArgumentException partial이 null인 경우
     */
    void patch(Map<String, ?> partial);

    /**
     * Draft 기반 patch. 실제로 값이 달라진 최상위 키만 통지됩니다.
     *
     * @param recipe Draft 변경 함수
     * @throws IllegalArgumentException recipe가 null인 경우
     */
    void patch(Consumer<Draft> recipe);

    /**
     * 생성 시점의 초기 State로 교체.
     */
    void reset();

    /**
     * 통지 없이 State에 얕은 병합 (생성 직후 영속 State 복원용).
     *
     * <p>version을 올리지 않으며 구독자에게 통지하지 않습니다.</p>
     *
     * @param partial 복원할 부분 State
     */
    void hydrate(Map<String, ?> partial);

    /**
     * 전체 State 변경 구독.
     *
     * @param listener 구독자
     * @return 구독 해제 핸들
     */
    Subscription subscribe(StateListener listener);

    /**
     * 부분 변경 구독.
     *
     * @param listener 구독자
     * @return 구독 해제 핸들
     */
    Subscription onPatch(PatchListener listener);

    /**
     * 이 Store의 Action 이벤트 구독.
     *
     * @param listener 구독자
     * @return 구독 해제 핸들
     */
    Subscription onAction(ActionListener listener);

    /**
     * 경로 단위 구독.
     *
     * @param paths 관찰할 경로 목록
     * @param observer 구독자
     * @return 구독 해제 핸들
     * @throws IllegalArgumentException paths가 비어 있는 경우
     */
    Subscription observe(Collection<String> paths, PathObserver observer);

    /**
     * Action 디스패치.
     *
     * <p>비동기 Action이면 추적 중인 {@link CompletableFuture}를 반환합니다.</p>
     *
     * @param action Action 이름
     * @param args 인자
     * @return Action 결과
     * @throws IllegalArgumentException 존재하지 않는 Action인 경우
     */
    Object dispatch(String action, Object... args);

    /**
     * Action 비동기 디스패치 (동기 Action은 완료된 Future로 감쌈).
     *
     * @param action Action 이름
     * @param args 인자
     * @return 결과 Future
     */
    CompletableFuture<Object> dispatchAsync(String action, Object... args);
}
