/**
 * Typed operation results.
 *
 * <p>Every fallible protocol operation returns a
 * {@link com.ryuqq.directory.core.outcome.Result}: either
 * {@link com.ryuqq.directory.core.outcome.Ok} with a value or
 * {@link com.ryuqq.directory.core.outcome.Err} with a typed error.</p>
 *
 * @since 1.0.0
 * @author Directory Team
 */
package com.ryuqq.directory.core.outcome;
