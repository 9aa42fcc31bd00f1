package com.ryuqq.directory.adapter.inmemory.schema;

import com.ryuqq.directory.core.entry.Entry;
import com.ryuqq.directory.core.error.SchemaError;
import com.ryuqq.directory.core.outcome.Result;
import com.ryuqq.directory.core.spi.SchemaValidator;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

/**
 * Minimal {@link SchemaValidator}: every entry must carry a fixed set of attributes.
 *
 * <p><strong>Checks, in order:</strong></p>
 * <ol>
 *   <li>entry has at least one attribute, else {@code Corrupted}</li>
 *   <li>every required attribute is present, else {@code MissingMustAttribute(name)},
 *       reporting the alphabetically first missing name</li>
 * </ol>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public class RequiredAttributeSchemaValidator implements SchemaValidator {

    private final Set<String> mustAttributes;

    public RequiredAttributeSchemaValidator(String... mustAttributes) {
        this.mustAttributes = new TreeSet<>(Arrays.asList(mustAttributes));
    }

    @Override
    public Result<Void, SchemaError> validate(Entry entry) {
        if (entry == null || entry.getAttrs().isEmpty()) {
            return Result.err(SchemaError.of(SchemaError.Kind.CORRUPTED));
        }
        for (String must : mustAttributes) {
            if (!entry.hasAttribute(must)) {
                return Result.err(SchemaError.missingMustAttribute(must));
            }
        }
        return Result.ok();
    }
}
