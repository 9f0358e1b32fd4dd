/**
 * Store definition contracts.
 *
 * <p>User code describes a store with {@link com.ryuqq.resea.core.contract.StoreDefinition}:
 * an initial state factory plus named {@link com.ryuqq.resea.core.contract.Getter getters},
 * {@link com.ryuqq.resea.core.contract.Action actions} and
 * {@link com.ryuqq.resea.core.contract.AsyncAction async actions}. Bodies receive explicit
 * receivers ({@link com.ryuqq.resea.core.state.StateReader},
 * {@link com.ryuqq.resea.core.contract.Getters},
 * {@link com.ryuqq.resea.core.contract.ActionContext}) instead of an implicit {@code this}.</p>
 *
 * @since 1.0.0
 * @author Resea Team
 */
package com.ryuqq.resea.core.contract;
