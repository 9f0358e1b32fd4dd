/**
 * Reactive Store Engine - Store/Registry 구현체.
 *
 * <p>이 패키지는 application 계층 인터페이스의 구체적인 구현체를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resea.engine.ReactiveStore} - State, version, 구독, 커밋 처리</li>
 *   <li>{@link com.ryuqq.resea.engine.DefaultRegistry} - Store 컨테이너, Plugin, Action 이벤트 버스, 배치</li>
 *   <li>{@link com.ryuqq.resea.engine.Registries} - Registry 팩토리</li>
 *   <li>{@link com.ryuqq.resea.engine.RegistryConfig} - Registry 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * engine (ReactiveStore, DefaultRegistry, GetterCache, ActionDispatcher)
 *   ↓ implements
 * application (Store, Registry, Plugin)
 *   ↓ depends on
 * core (StoreDefinition, ActionEvent, StatePath, Tracer, Draft)
 * </pre>
 *
 * @author Resea Team
 * @since 1.0.0
 */
package com.ryuqq.resea.engine;
