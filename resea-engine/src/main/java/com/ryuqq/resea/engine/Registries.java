package com.ryuqq.resea.engine;

import com.ryuqq.resea.application.registry.Registry;

/**
 * Registry 팩토리.
 *
 * <pre>
 * Registry registry = Registries.createRegistry()
 *     .use(new PersistencePlugin(medium));
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public final class Registries {

    // Utility class - prevent instantiation
    private Registries() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 설정의 빈 Registry 생성.
     *
     * @return 새 Registry
     */
    public static Registry createRegistry() {
        return new DefaultRegistry();
    }

    /**
     * 설정을 지정한 빈 Registry 생성.
     *
     * @param config Registry 설정
     * @return 새 Registry
     * @throws IllegalArgumentException config가 null인 경우
     */
    public static Registry createRegistry(RegistryConfig config) {
        return new DefaultRegistry(config);
    }
}
