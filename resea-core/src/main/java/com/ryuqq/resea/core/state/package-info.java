/**
 * Read and write views over a state tree.
 *
 * <p>Getters read through a {@link com.ryuqq.resea.core.state.StateReader}. The
 * {@link com.ryuqq.resea.core.state.Tracer} variant records every absolute path it visits, and
 * those paths become the getter's dependencies. Patch recipes write through a
 * {@link com.ryuqq.resea.core.state.Draft}, which never touches the tree it was built from.</p>
 *
 * @since 1.0.0
 * @author Resea Team
 */
package com.ryuqq.resea.core.state;
