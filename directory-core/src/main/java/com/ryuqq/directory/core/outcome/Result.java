package com.ryuqq.directory.core.outcome;

import java.util.function.Function;

/**
 * 실패 가능한 연산의 결과.
 *
 * <p>Result는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 값을 가짐 (값 없는 연산은 {@code Void}와 null)</li>
 *   <li>{@link Err}: 실패, 타입이 지정된 오류 값을 가짐</li>
 * </ul>
 *
 * <p>프로토콜 계층의 오류는 예외가 아닌 값입니다. 검색, 생성, 인증 등 모든 연산은
 * 예외를 던지는 대신 {@code Result}를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;Filter, OperationError&gt; result = canonicalizer.canonicalize(filter);
 * if (result.isOk()) {
 *     Filter canonical = result.get();
 * } else {
 *     OperationError error = result.getError();
 * }
 * </pre>
 *
 * @param <T> 성공 값 타입
 * @param <E> 오류 값 타입
 *
 * @author Directory Team
 * @since 1.0.0
 */
public sealed interface Result<T, E> permits Ok, Err {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값 (null 허용)
     * @return Ok 인스턴스
     */
    static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 값 없는 성공 결과 생성.
     *
     * @return 값이 null인 Ok 인스턴스
     */
    static <E> Result<Void, E> ok() {
        return new Ok<>(null);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 오류 값
     * @return Err 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T, E> Result<T, E> err(E error) {
        return new Err<>(error);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isErr() {
        return this instanceof Err;
    }

    /**
     * 성공 값 조회.
     *
     * @return 성공 값
     * @throws IllegalStateException 실패 결과인 경우
     */
    default T get() {
        if (this instanceof Ok<T, E> ok) {
            return ok.value();
        }
        throw new IllegalStateException("Result is an error: " + getError());
    }

    /**
     * 오류 값 조회.
     *
     * @return 오류 값
     * @throws IllegalStateException 성공 결과인 경우
     */
    default E getError() {
        if (this instanceof Err<T, E> err) {
            return err.error();
        }
        throw new IllegalStateException("Result is not an error");
    }

    /**
     * 성공 값을 변환.
     *
     * @param mapper 변환 함수
     * @return 변환된 결과 (실패인 경우 동일 오류)
     */
    default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Ok<T, E> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return new Err<>(getError());
    }

    /**
     * 성공 값으로 다음 연산을 연결.
     *
     * @param mapper 다음 연산
     * @return 다음 연산의 결과 (실패인 경우 동일 오류)
     */
    default <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        if (this instanceof Ok<T, E> ok) {
            return mapper.apply(ok.value());
        }
        return new Err<>(getError());
    }
}
