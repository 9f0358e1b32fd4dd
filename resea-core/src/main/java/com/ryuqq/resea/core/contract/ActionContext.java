package com.ryuqq.resea.core.contract;

import com.ryuqq.resea.core.model.StoreId;
import com.ryuqq.resea.core.state.Draft;
import com.ryuqq.resea.core.state.StateReader;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Action 본문의 명시적 수신자.
 *
 * <p>State 필드, Getter, 다른 Action, 핵심 변경 연산을 하나로 묶습니다.
 * {@link #set(String, Object)}을 통한 쓰기는 patch로 전달됩니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public interface ActionContext {

    /**
     * Store ID.
     *
     * @return 소속 Store ID
     */
    StoreId storeId();

    /**
     * 키 조회 (Getter, Plugin 속성, State 필드 순으로 해석).
     *
     * @param key 키
     * @param <T> 기대 타입
     * @return 값
     */
    <T> T get(String key);

    /**
     * 경로 쓰기 (patch로 전달).
     *
     * @param path 경로 (중첩/인덱스 경로 허용)
     * @param value 값
     */
    void set(String path, Object value);

    /**
     * Getter 값 조회.
     *
     * @param name Getter 이름
     * @param <T> 기대 타입
     * @return Getter 값
     */
    <T> T getter(String name);

    /**
     * 현재 State Reader (경로 추적 없음).
     *
     * @return State Reader
     */
    StateReader state();

    /**
     * 다른 Action 디스패치.
     *
     * @param action Action 이름
     * @param args 인자
     * @return 결과
     */
    Object dispatch(String action, Object... args);

    /**
     * 다른 Action 비동기 디스패치.
     *
     * @param action Action 이름
     * @param args 인자
     * @return 결과 Future
     */
    CompletableFuture<Object> dispatchAsync(String action, Object... args);

    /**
     * 얕은 병합.
     *
     * @param partial 부분 State
     */
    void setState(Map<String, ?> partial);

    /**
     * 함수형 얕은 병합.
     *
     * @param updater 이전 State → 부분 State
     */
    void setState(UnaryOperator<Map<String, Object>> updater);

    /**
     * 깊은 병합.
     *
     * @param partial 부분 State
     */
    void patch(Map<String, ?> partial);

    /**
     * Draft 기반 patch.
     *
     * @param recipe Draft 변경 함수
     */
    void patch(Consumer<Draft> recipe);

    /**
     * 초기 State로 복원.
     */
    void reset();
}
