package com.ryuqq.resea.adapter.persistence;

import com.ryuqq.resea.adapter.persistence.codec.JacksonStateCodec;
import com.ryuqq.resea.application.registry.Plugin;
import com.ryuqq.resea.application.store.Store;
import com.ryuqq.resea.core.spi.PersistOptions;
import com.ryuqq.resea.core.spi.StateCodec;
import com.ryuqq.resea.core.spi.StorageMedium;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 영속화 Plugin ({@value PersistOptions#PLUGIN_NAME}).
 *
 * <p>{@code StoreDefinition.Builder.persist(...)}로 영속화를 요청한 Store에만 적용됩니다.
 * 설정에 codec/medium이 없으면 Plugin의 기본값을 사용합니다.</p>
 *
 * <p><strong>Store 속성:</strong></p>
 * <ul>
 *   <li>{@value #FLUSH_PROPERTY}: {@link Runnable}, 현재 State 즉시 기록</li>
 *   <li>{@value #CLEAR_PROPERTY}: {@link Runnable}, 저장된 값 제거</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Registry registry = Registries.createRegistry()
 *     .use(new PersistencePlugin(new FileStorageMedium(Path.of("state"))));
 *
 * Store settings = registry.defineStore(StoreDefinition.builder("settings")
 *     .state(() -&gt; Map.of("theme", "light", "draft", ""))
 *     .persist(PersistOptions.defaults().withPaths(List.of("theme")))
 *     .build());
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
public class PersistencePlugin implements Plugin {

    private static final Logger log = LoggerFactory.getLogger(PersistencePlugin.class);

    public static final String FLUSH_PROPERTY = "persistNow";
    public static final String CLEAR_PROPERTY = "clearPersisted";

    private final StorageMedium defaultMedium;
    private final StateCodec defaultCodec;
    private final Map<String, PersistenceAdapter> adapters = new ConcurrentHashMap<>();

    /**
     * JSON 코덱을 기본으로 사용하는 생성자.
     *
     * @param defaultMedium 기본 저장 매체
     * @throws IllegalArgumentException defaultMedium이 null인 경우
     */
    public PersistencePlugin(StorageMedium defaultMedium) {
        this(defaultMedium, new JacksonStateCodec());
    }

    /**
     * 생성자.
     *
     * @param defaultMedium 기본 저장 매체
     * @param defaultCodec 기본 코덱
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PersistencePlugin(StorageMedium defaultMedium, StateCodec defaultCodec) {
        if (defaultMedium == null) {
            throw new IllegalArgumentException("defaultMedium cannot be null");
        }
        if (defaultCodec == null) {
            throw new IllegalArgumentException("defaultCodec cannot be null");
        }
        this.defaultMedium = defaultMedium;
        this.defaultCodec = defaultCodec;
    }

    @Override
    public String name() {
        return PersistOptions.PLUGIN_NAME;
    }

    @Override
    public Map<String, Object> properties(Store store) {
        if (store.definition().persistOptions().isEmpty()) {
            return Map.of();
        }
        String id = store.id().getValue();
        Map<String, Object> contributed = new LinkedHashMap<>();
        contributed.put(FLUSH_PROPERTY, (Runnable) () -> adapter(id).ifPresent(PersistenceAdapter::flush));
        contributed.put(CLEAR_PROPERTY, (Runnable) () -> adapter(id).ifPresent(PersistenceAdapter::clear));
        return contributed;
    }

    @Override
    public void storeCreated(Store store) {
        Optional<PersistOptions> requested = store.definition().persistOptions();
        if (requested.isEmpty()) {
            return;
        }
        PersistOptions options = resolve(requested.get());
        PersistenceAdapter adapter = new PersistenceAdapter(store, options);
        adapter.attach();
        adapters.put(store.id().getValue(), adapter);
        log.info("Persistence attached to store {} (key: {}, paths: {})",
            store.id().getValue(), adapter.key(), options.paths().isEmpty() ? "all" : options.paths());
    }

    /**
     * Store에 연결된 어댑터 조회.
     *
     * @param storeId Store ID 문자열
     * @return 어댑터 (영속화 대상이 아니면 empty)
     */
    public Optional<PersistenceAdapter> adapter(String storeId) {
        return Optional.ofNullable(adapters.get(storeId));
    }

    private PersistOptions resolve(PersistOptions options) {
        PersistOptions resolved = options;
        if (resolved.medium() == null) {
            resolved = resolved.withMedium(defaultMedium);
        }
        if (resolved.codec() == null) {
            resolved = resolved.withCodec(defaultCodec);
        }
        return resolved;
    }
}
