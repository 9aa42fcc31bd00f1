/**
 * Filter query model.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.directory.core.filter.Filter} - recursive query AST (sealed)</li>
 *   <li>{@link com.ryuqq.directory.core.filter.FilterOrder} - explicit total order</li>
 *   <li>{@link com.ryuqq.directory.core.filter.FilterCanonicalizer} - depth-bounded canonical form</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Filter filter = Filter.and(Filter.eq("class", "person"), Filter.pres("mail"));
 * Result&lt;Filter, OperationError&gt; canonical = new FilterCanonicalizer().canonicalize(filter);
 * </pre>
 *
 * @since 1.0.0
 * @author Directory Team
 */
package com.ryuqq.directory.core.filter;
