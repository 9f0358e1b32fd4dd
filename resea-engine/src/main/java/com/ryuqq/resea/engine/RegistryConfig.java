package com.ryuqq.resea.engine;

/**
 * Registry 설정 (불변 record).
 *
 * <p>이 record는 Registry가 만드는 모든 Store의 Action 디스패치 동작을 제어합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>loadingSuffix: 비동기 Action 로딩 플래그 접미사 (기본 "Loading" → "fetchUserLoading")</li>
 *   <li>trackAsyncLoading: 비동기 Action 실행 중 로딩 플래그 관리 여부 (기본 true)</li>
 * </ul>
 *
 * @author Resea Team
 * @since 1.0.0
 * @param loadingSuffix 로딩 플래그 접미사 (공백 불가)
 * @param trackAsyncLoading 로딩 플래그 관리 여부
 */
public record RegistryConfig(String loadingSuffix, boolean trackAsyncLoading) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: loadingSuffix="Loading", trackAsyncLoading=true</p>
     */
    public RegistryConfig() {
        this("Loading", true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RegistryConfig {
        if (loadingSuffix == null || loadingSuffix.isBlank()) {
            throw new IllegalArgumentException(
                "loadingSuffix cannot be null or blank (current: '" + loadingSuffix + "')"
            );
        }
        if (loadingSuffix.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException(
                "loadingSuffix cannot contain whitespace (current: '" + loadingSuffix + "')"
            );
        }
    }

    /**
     * Action 이름에 대응하는 로딩 플래그 키.
     *
     * @param actionName Action 이름
     * @return 로딩 플래그 State 키
     */
    public String loadingKey(String actionName) {
        return actionName + loadingSuffix;
    }

    /**
     * loadingSuffix만 변경한 새 인스턴스 생성.
     *
     * @param loadingSuffix 새로운 접미사
     * @return 새 RegistryConfig 인스턴스
     */
    public RegistryConfig withLoadingSuffix(String loadingSuffix) {
        return new RegistryConfig(loadingSuffix, this.trackAsyncLoading);
    }

    /**
     * trackAsyncLoading만 변경한 새 인스턴스 생성.
     *
     * @param trackAsyncLoading 로딩 플래그 관리 여부
     * @return 새 RegistryConfig 인스턴스
     */
    public RegistryConfig withTrackAsyncLoading(boolean trackAsyncLoading) {
        return new RegistryConfig(this.loadingSuffix, trackAsyncLoading);
    }
}
