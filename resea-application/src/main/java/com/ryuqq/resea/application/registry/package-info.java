/**
 * Registry Application Layer - Store 컨테이너와 Plugin 계약.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resea.application.registry.Registry} - Store 생성/조회, Action 이벤트 버스, 배치</li>
 *   <li>{@link com.ryuqq.resea.application.registry.Plugin} - install / properties / storeCreated 훅</li>
 *   <li>{@link com.ryuqq.resea.application.registry.ActionListener} - Action 이벤트 구독자</li>
 * </ul>
 *
 * @author Resea Team
 * @since 1.0.0
 */
package com.ryuqq.resea.application.registry;
