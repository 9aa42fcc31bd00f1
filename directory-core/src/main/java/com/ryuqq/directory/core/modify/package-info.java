/**
 * Attribute mutation model.
 *
 * @since 1.0.0
 * @author Directory Team
 */
package com.ryuqq.directory.core.modify;
