package com.ryuqq.directory.core.contract;

/**
 * 빈 확인 응답 (create, delete, modify, revive 성공).
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record OperationResponse() {

    private static final OperationResponse INSTANCE = new OperationResponse();

    public static OperationResponse ack() {
        return INSTANCE;
    }
}
