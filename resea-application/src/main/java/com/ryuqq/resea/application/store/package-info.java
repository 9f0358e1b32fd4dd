/**
 * Store Application Layer - 소비자용 Store API.
 *
 * <p>렌더링/관찰 계층이 사용하는 Store 인터페이스와 구독 계약을 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resea.application.store.Store} - State 읽기/쓰기, 구독, Action 디스패치</li>
 *   <li>{@link com.ryuqq.resea.application.store.StateListener} - 전체 State 변경 구독자</li>
 *   <li>{@link com.ryuqq.resea.application.store.PatchListener} - 부분 변경 구독자</li>
 *   <li>{@link com.ryuqq.resea.application.store.PathObserver} - 경로 단위 구독자</li>
 *   <li>{@link com.ryuqq.resea.application.store.Subscription} - 멱등 구독 해제 핸들</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 resea-engine 모듈에 위치</li>
 *   <li><strong>불변성:</strong> 구독자에게 전달되는 State는 불변</li>
 * </ul>
 *
 * @author Resea Team
 * @since 1.0.0
 */
package com.ryuqq.resea.application.store;
