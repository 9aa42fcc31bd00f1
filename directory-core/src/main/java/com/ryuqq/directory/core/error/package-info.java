/**
 * Error taxonomy.
 *
 * <p>Three closed layers, all plain values:</p>
 * <ul>
 *   <li>{@link com.ryuqq.directory.core.error.SchemaError} - entry shape violations</li>
 *   <li>{@link com.ryuqq.directory.core.error.ConsistencyError} - structural integrity faults</li>
 *   <li>{@link com.ryuqq.directory.core.error.OperationError} - request processing failures,
 *       wrapping the other two through explicit factories</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Directory Team
 */
package com.ryuqq.directory.core.error;
