/**
 * Reference schema validator.
 *
 * @see com.ryuqq.directory.core.spi.SchemaValidator
 * @author Directory Team
 * @since 1.0.0
 */
package com.ryuqq.directory.adapter.inmemory.schema;
