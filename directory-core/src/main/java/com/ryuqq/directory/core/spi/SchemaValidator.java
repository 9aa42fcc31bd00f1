package com.ryuqq.directory.core.spi;

import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.error.SchemaError;
import com.ryuqq.directory.core.outcome.Result;

/**
 * Schema validation SPI.
 *
 * <p>Invoked whenever entries are created or modified. Attribute and class legality,
 * as well as the duplicate-value policy, are decided here.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SchemaValidator {

    /**
     * Validates the shape of an entry.
     *
     * @param entry the entry
     * @return empty result when valid, the first schema error otherwise
     */
    Result<Void, SchemaError> validate(Entry entry);
}
