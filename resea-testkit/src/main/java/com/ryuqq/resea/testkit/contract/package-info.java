/**
 * Contract test infrastructure for storage media.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resea.testkit.contract.AbstractStorageMediumContractTest} - Scenarios every medium must pass</li>
 *   <li>{@link com.ryuqq.resea.testkit.contract.RecordingStorageMedium} - Recording, failure-injecting test double</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Resea Team
 */
package com.ryuqq.resea.testkit.contract;
