/**
 * Identity assertion issued on successful authentication.
 *
 * @since 1.0.0
 * @author Directory Team
 */
package com.ryuqq.directory.core.identity;
