/**
 * Persistence Adapter - Store State 영속화 Plugin.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resea.adapter.persistence.PersistencePlugin} - Registry에 설치하는 Plugin</li>
 *   <li>{@link com.ryuqq.resea.adapter.persistence.PersistenceAdapter} - Store 하나와 매체의 연결</li>
 *   <li>{@link com.ryuqq.resea.adapter.persistence.codec.JacksonStateCodec} - 기본 JSON 코덱</li>
 *   <li>{@link com.ryuqq.resea.adapter.persistence.medium.FileStorageMedium} - 파일 기반 매체</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-persistence (PersistencePlugin)
 *   ↓ implements
 * application (Plugin, Store)
 *   ↓ depends on
 * core/spi (StorageMedium, StateCodec, PersistOptions)
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
package com.ryuqq.resea.adapter.persistence;
