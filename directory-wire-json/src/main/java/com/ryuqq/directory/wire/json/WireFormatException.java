package com.ryuqq.directory.wire.json;

import com.ryuqq.directory.core.error.OperationError;

/**
 * Thrown when a value cannot be encoded to or decoded from the JSON wire form.
 *
 * <p>Maps to {@link OperationError.Kind#SERDE_JSON_ERROR} at the protocol boundary.</p>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public class WireFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the protocol error a server answers with
     */
    public OperationError getError() {
        return OperationError.of(OperationError.Kind.SERDE_JSON_ERROR);
    }
}
