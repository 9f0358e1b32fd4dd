/**
 * State path and immutable tree utilities.
 *
 * <p>{@link com.ryuqq.resea.core.path.StatePath} normalizes dotted and bracket paths;
 * {@link com.ryuqq.resea.core.path.StateTrees} freezes, merges and rewrites trees copy-on-write.</p>
 *
 * @since 1.0.0
 * @author Resea Team
 */
package com.ryuqq.resea.core.path;
