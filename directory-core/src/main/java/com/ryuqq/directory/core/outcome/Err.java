package com.ryuqq.directory.core.outcome;

/**
 * 실패 결과.
 *
 * @param error 오류 값
 * @param <T> 성공 값 타입
 * @param <E> 오류 값 타입
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record Err<T, E>(E error) implements Result<T, E> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Err {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
