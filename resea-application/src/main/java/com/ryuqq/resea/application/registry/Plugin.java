package com.ryuqq.resea.application.registry;

import com.ryuqq.resea.application.store.Store;

import java.util.Map;

/**
 * Registry 확장 Plugin.
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * registry.use(plugin)
 *   → install(registry)             (설치 시 1회)
 * registry.defineStore(definition)  (설치 이후 생성되는 Store마다)
 *   → properties(store)             (Store에 병합될 속성)
 *   → storeCreated(store)           (Store당 1회)
 * </pre>
 *
 * <p><strong>재생 없음:</strong> 설치 전에 이미 만들어진 Store에 대해서는
 * {@code properties}/{@code storeCreated}가 호출되지 않습니다.</p>
 *
 * <p>훅에서 발생한 예외는 로깅 후 격리됩니다.</p>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public interface Plugin {

    /**
     * Plugin 고유 이름. 같은 이름은 한 번만 설치됩니다.
     *
     * @return Plugin 이름
     */
    String name();

    /**
     * 설치 훅.
     *
     * @param registry 설치 대상 Registry
     */
    default void install(Registry registry) {
    }

    /**
     * Store에 병합할 속성.
     *
     * @param store 새 Store
     * @return 속성 이름 → 값 (값이 함수 객체이면 메서드처럼 사용)
     */
    default Map<String, Object> properties(Store store) {
        return Map.of();
    }

    /**
     * Store 생성 훅.
     *
     * @param store 새 Store
     */
    default void storeCreated(Store store) {
    }
}
