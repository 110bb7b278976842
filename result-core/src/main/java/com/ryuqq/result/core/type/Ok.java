package com.ryuqq.result.core.type;

import com.ryuqq.result.core.panic.Panics;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 성공 결과.
 *
 * <p>성공 값 하나만 보유하며 오류 슬롯은 존재하지 않습니다.
 * 오류 쪽 연산(mapErr, orElse, inspectErr)은 값을 그대로 전파합니다.</p>
 *
 * @param value 성공 값 (null 불가)
 * @param <T> 성공 값 타입
 * @param <E> 오류 값 타입
 *
 * @author Result Team
 * @since 1.0.0
 */
public record Ok<T, E>(T value) implements Result<T, E> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Ok {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    @Override
    public boolean isOk() {
        return true;
    }

    @Override
    public boolean isErr() {
        return false;
    }

    @Override
    public boolean isOkAnd(Predicate<? super T> predicate) {
        return Arguments.notNull(predicate, "predicate").test(value);
    }

    @Override
    public boolean isErrAnd(Predicate<? super E> predicate) {
        Arguments.notNull(predicate, "predicate");
        return false;
    }

    @Override
    public T unwrap() {
        return value;
    }

    @Override
    public T expect(String message) {
        Arguments.notNull(message, "message");
        return value;
    }

    @Override
    public T unwrapOr(T defaultValue) {
        return value;
    }

    @Override
    public T unwrapOrElse(Function<? super E, ? extends T> fallback) {
        Arguments.notNull(fallback, "fallback");
        return value;
    }

    @Override
    public E unwrapErr() {
        throw Panics.panic("called Result.unwrapErr() on an Ok value: " + value);
    }

    @Override
    public E expectErr(String message) {
        throw Panics.panic(Arguments.notNull(message, "message") + ": " + value);
    }

    @Override
    public Optional<T> ok() {
        return Optional.of(value);
    }

    @Override
    public Optional<E> err() {
        return Optional.empty();
    }

    @Override
    public Stream<T> stream() {
        return Stream.of(value);
    }

    @Override
    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        return new Ok<>(Arguments.notNull(mapper, "mapper").apply(value));
    }

    @Override
    public <F> Result<T, F> mapErr(Function<? super E, ? extends F> mapper) {
        Arguments.notNull(mapper, "mapper");
        return new Ok<>(value);
    }

    @Override
    public <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper) {
        return Arguments.notNull(mapper, "mapper").apply(value);
    }

    @Override
    public <U> U mapOrElse(Function<? super E, ? extends U> errMapper, Function<? super T, ? extends U> okMapper) {
        Arguments.notNull(errMapper, "errMapper");
        return Arguments.notNull(okMapper, "okMapper").apply(value);
    }

    @Override
    public <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> mapper) {
        return Arguments.returned(Arguments.notNull(mapper, "mapper").apply(value));
    }

    @Override
    public <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> mapper) {
        Arguments.notNull(mapper, "mapper");
        return new Ok<>(value);
    }

    @Override
    public <U> Result<U, E> and(Result<U, E> other) {
        return Arguments.notNull(other, "other");
    }

    @Override
    public <F> Result<T, F> or(Result<T, F> other) {
        Arguments.notNull(other, "other");
        return new Ok<>(value);
    }

    @Override
    public Result<T, E> inspect(Consumer<? super T> action) {
        Arguments.notNull(action, "action").accept(value);
        return this;
    }

    @Override
    public Result<T, E> inspectErr(Consumer<? super E> action) {
        Arguments.notNull(action, "action");
        return this;
    }

    @Override
    public String toString() {
        return "Ok(" + value + ")";
    }
}
