/**
 * Core domain model package.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resea.core.model.StoreId} - Store unique identifier</li>
 *   <li>{@link com.ryuqq.resea.core.model.ActionEvent} - Telemetry record of one action invocation</li>
 *   <li>{@link com.ryuqq.resea.core.model.MemberKind} - Kind of a key readable on a store</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Resea Team
 */
package com.ryuqq.resea.core.model;
