package com.ryuqq.result.core.type;

import com.ryuqq.result.core.panic.Panics;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 실패 결과.
 *
 * <p>오류 값 하나만 보유하며 값 슬롯은 존재하지 않습니다.
 * 값 쪽 연산(map, andThen, and, inspect)은 콜백을 호출하지 않고 오류를 그대로 전파합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>유효성 검증 실패</li>
 *   <li>리소스 없음</li>
 *   <li>비즈니스 규칙 위반</li>
 * </ul>
 *
 * @param error 오류 값 (null 불가)
 * @param <T> 성공 값 타입
 * @param <E> 오류 값 타입
 *
 * @author Result Team
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

    @Override
    public boolean isOk() {
        return false;
    }

    @Override
    public boolean isErr() {
        return true;
    }

    @Override
    public boolean isOkAnd(Predicate<? super T> predicate) {
        Arguments.notNull(predicate, "predicate");
        return false;
    }

    @Override
    public boolean isErrAnd(Predicate<? super E> predicate) {
        return Arguments.notNull(predicate, "predicate").test(error);
    }

    @Override
    public T unwrap() {
        throw Panics.panic("called Result.unwrap() on an Err value: " + error);
    }

    @Override
    public T expect(String message) {
        throw Panics.panic(Arguments.notNull(message, "message") + ": " + error);
    }

    @Override
    public T unwrapOr(T defaultValue) {
        return defaultValue;
    }

    @Override
    public T unwrapOrElse(Function<? super E, ? extends T> fallback) {
        return Arguments.notNull(fallback, "fallback").apply(error);
    }

    @Override
    public E unwrapErr() {
        return error;
    }

    @Override
    public E expectErr(String message) {
        Arguments.notNull(message, "message");
        return error;
    }

    @Override
    public Optional<T> ok() {
        return Optional.empty();
    }

    @Override
    public Optional<E> err() {
        return Optional.of(error);
    }

    @Override
    public Stream<T> stream() {
        return Stream.empty();
    }

    @Override
    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        Arguments.notNull(mapper, "mapper");
        return new Err<>(error);
    }

    @Override
    public <F> Result<T, F> mapErr(Function<? super E, ? extends F> mapper) {
        return new Err<>(Arguments.notNull(mapper, "mapper").apply(error));
    }

    @Override
    public <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper) {
        Arguments.notNull(mapper, "mapper");
        return defaultValue;
    }

    @Override
    public <U> U mapOrElse(Function<? super E, ? extends U> errMapper, Function<? super T, ? extends U> okMapper) {
        Arguments.notNull(okMapper, "okMapper");
        return Arguments.notNull(errMapper, "errMapper").apply(error);
    }

    @Override
    public <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> mapper) {
        Arguments.notNull(mapper, "mapper");
        return new Err<>(error);
    }

    @Override
    public <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> mapper) {
        return Arguments.returned(Arguments.notNull(mapper, "mapper").apply(error));
    }

    @Override
    public <U> Result<U, E> and(Result<U, E> other) {
        Arguments.notNull(other, "other");
        return new Err<>(error);
    }

    @Override
    public <F> Result<T, F> or(Result<T, F> other) {
        return Arguments.notNull(other, "other");
    }

    @Override
    public Result<T, E> inspect(Consumer<? super T> action) {
        Arguments.notNull(action, "action");
        return this;
    }

    @Override
    public Result<T, E> inspectErr(Consumer<? super E> action) {
        Arguments.notNull(action, "action").accept(error);
        return this;
    }

    @Override
    public String toString() {
        return "Err(" + error + ")";
    }
}
