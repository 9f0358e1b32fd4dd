package com.ryuqq.resea.application.registry;

import com.ryuqq.resea.application.store.Store;
import com.ryuqq.resea.application.store.Subscription;
import com.ryuqq.resea.core.contract.StoreDefinition;
import com.ryuqq.resea.core.model.ActionEvent;

import java.util.Collection;
import java.util.Optional;

/**
 * Store 컨테이너.
 *
 * <p>Store 생성, Plugin 설치, 전역 Action 이벤트 버스를 담당합니다.
 * 전역 싱글턴이 아닌 명시적인 값이며, 필요한 곳에 직접 전달합니다.</p>
 *
 * <p><strong>Store 생명주기:</strong></p>
 * <pre>
 * undefined ─(defineStore/createStore)─► created ─► alive (변경, 읽기, reset)
 *                                                     │
 *                                                     └─(registry.close)─► 전체 제거
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public interface Registry extends AutoCloseable {

    /**
     * Plugin 설치. 같은 이름이 이미 설치되어 있으면 경고 후 무시합니다.
     *
     * @param plugin Plugin
     * @return this (체이닝)
     * @throws IllegalArgumentException plugin 또는 이름이 null인 경우
     */
    Registry use(Plugin plugin);

    /**
     * Store 정의 (get-or-create).
     *
     * <p>같은 ID의 Store가 이미 있으면 새로 만들지 않고 기존 인스턴스를 반환합니다.
     * 구독자와 Getter 캐시가 그대로 유지됩니다.</p>
     *
     * @param definition Store 정의
     * @return Store
     */
    Store defineStore(StoreDefinition definition);

    /**
     * Store 생성 (엄격).
     *
     * @param definition Store 정의
     * @return 새 Store
     * @throws IllegalStateException 같은 ID의 Store가 이미 있는 경우
     */
    Store createStore(StoreDefinition definition);

    /**
     * ID로 Store 조회.
     *
     * @param id Store ID 문자열
     * @return Store (없으면 empty)
     */
    Optional<Store> getStore(String id);

    /**
     * 등록된 Store 목록 (생성 순서).
     *
     * @return Store 스냅샷
     */
    Collection<Store> stores();

    /**
     * Action 이벤트를 모든 구독자에게 동기 전달. 구독자 예외는 격리됩니다.
     *
     * @param event Action 이벤트
     */
    void emitAction(ActionEvent event);

    /**
     * 전역 Action 이벤트 구독.
     *
     * @param listener 구독자
     * @return 구독 해제 핸들
     */
    Subscription onAction(ActionListener listener);

    /**
     * 배치 범위 실행.
     *
     * <p>범위 안의 커밋은 즉시 반영되지만, 통지는 가장 바깥 범위가 끝날 때
     * Store마다 한 번으로 합쳐집니다.</p>
     *
     * @param body 배치 본문
     */
    void batch(Runnable body);

    /**
     * 모든 Store, Plugin, 구독자 제거.
     */
    @Override
    void close();
}
