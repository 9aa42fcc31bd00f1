package com.ryuqq.directory.core.error;

/**
 * Shape of the data an error variant carries.
 *
 * <p>Each error kind declares exactly one payload shape; the error factories
 * reject payloads that do not match it.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public enum ErrorPayload {

    /** No payload. */
    NONE,

    /** A single text value (attribute name, uuid, reason). */
    TEXT,

    /** Two text values (class name, attribute name). */
    TEXT_PAIR,

    /** A numeric entry identifier. */
    ENTRY_ID,

    /** A wrapped {@link SchemaError}. */
    SCHEMA,

    /** A sequence of per-check consistency results. */
    CONSISTENCY
}
