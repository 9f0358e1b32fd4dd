package com.ryuqq.resea.core.spi;

import com.ryuqq.resea.core.model.StoreId;
import com.ryuqq.resea.core.path.StatePath;

import java.util.ArrayList;
import java.util.List;

/**
 * Store 영속화 설정 (불변 record).
 *
 * <p>이 record는 Persistence Adapter가 Store 하나를 어떻게 저장하고 복원할지 결정합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>key: 저장 키 (기본값 null → {@code resea_<storeId>})</li>
 *   <li>paths: 저장할 경로 허용 목록 (기본 빈 목록 → 전체 State)</li>
 *   <li>codec: 직렬화 방식 (기본 null → Plugin 기본 codec)</li>
 *   <li>medium: 저장 매체 (기본 null → Plugin 기본 매체)</li>
 *   <li>hydrateInitial: 저장된 값이 없을 때 초기 State를 즉시 저장할지 여부 (기본 false)</li>
 * </ul>
 *
 * @author Resea Team
 * @since 1.0.0
 * @param key 저장 키 (null 가능)
 * @param paths 저장 경로 목록 (정규화됨)
 * @param codec 직렬화 방식 (null 가능)
 * @param medium 저장 매체 (null 가능)
 * @param hydrateInitial 초기 State 저장 여부
 */
public record PersistOptions(
    String key,
    List<String> paths,
    StateCodec codec,
    StorageMedium medium,
    boolean hydrateInitial
) {

    /**
     * Persistence Plugin 이름.
     */
    public static final String PLUGIN_NAME = "persistence";

    /**
     * 기본 키 접두어.
     */
    public static final String DEFAULT_KEY_PREFIX = "resea_";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: key=null, paths=[], codec=null, medium=null, hydrateInitial=false</p>
     */
    public PersistOptions() {
        this(null, List.of(), null, null, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PersistOptions {
        if (key != null && key.isBlank()) {
            throw new IllegalArgumentException("key cannot be blank (current: '" + key + "')");
        }
        List<String> normalized = new ArrayList<>();
        if (paths != null) {
            for (String path : paths) {
                normalized.add(StatePath.normalize(path));
            }
        }
        paths = List.copyOf(normalized);
    }

    /**
     * 기본 설정.
     *
     * @return 기본 PersistOptions
     */
    public static PersistOptions defaults() {
        return new PersistOptions();
    }

    /**
     * Store에 적용될 실제 저장 키.
     *
     * @param storeId Store ID
     * @return key가 지정되었으면 key, 아니면 {@code resea_<storeId>}
     */
    public String resolveKey(StoreId storeId) {
        return key != null ? key : DEFAULT_KEY_PREFIX + storeId.getValue();
    }

    /**
     * key만 변경한 새 인스턴스 생성.
     *
     * @param key 새 저장 키
     * @return 새 PersistOptions 인스턴스
     */
    public PersistOptions withKey(String key) {
        return new PersistOptions(key, paths, codec, medium, hydrateInitial);
    }

    /**
     * paths만 변경한 새 인스턴스 생성.
     *
     * @param paths 새 경로 목록
     * @return 새 PersistOptions 인스턴스
     */
    public PersistOptions withPaths(List<String> paths) {
        return new PersistOptions(key, paths, codec, medium, hydrateInitial);
    }

    /**
     * codec만 변경한 새 인스턴스 생성.
     *
     * @param codec 새 codec
     * @return 새 PersistOptions 인스턴스
     */
    public PersistOptions withCodec(StateCodec codec) {
        return new PersistOptions(key, paths, codec, medium, hydrateInitial);
    }

    /**
     * medium만 변경한 새 인스턴스 생성.
     *
     * @param medium 새 저장 매체
     * @return 새 PersistOptions 인스턴스
     */
    public PersistOptions withMedium(StorageMedium medium) {
        return new PersistOptions(key, paths, codec, medium, hydrateInitial);
    }

    /**
     * hydrateInitial만 변경한 새 인스턴스 생성.
     *
     * @param hydrateInitial 초기 State 저장 여부
     * @return 새 PersistOptions 인스턴스
     */
    public PersistOptions withHydrateInitial(boolean hydrateInitial) {
        return new PersistOptions(key, paths, codec, medium, hydrateInitial);
    }
}
