package com.ryuqq.directory.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 성공 값 (null 허용, 값 없는 연산은 null)
 * @param <T> 성공 값 타입
 * @param <E> 오류 값 타입
 *
 * @author Directory Team
 * @since 1.0.0
 */
public record Ok<T, E>(T value) implements Result<T, E> {
}
