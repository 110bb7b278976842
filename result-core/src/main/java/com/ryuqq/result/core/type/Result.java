package com.ryuqq.result.core.type;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 성공 값 또는 오류 값 중 정확히 하나를 담는 결과 타입.
 *
 * <p>Result는 두 가지 경우를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 값 {@code T}를 보유</li>
 *   <li>{@link Err}: 실패, 오류 {@code E}를 보유</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 케이스 외의 구현이 존재할 수 없습니다.
 * 각 인스턴스는 활성 payload 하나만 가지며, 생성 후 변경되지 않습니다.</p>
 *
 * <p><strong>오류의 두 종류:</strong></p>
 * <ul>
 *   <li>도메인 오류: {@link Err}의 payload로 표현되며 조합 연산을 통해 명시적으로 전파됩니다.</li>
 *   <li>계약 위반: 잘못된 variant에 {@link #unwrap()} 등을 호출한 경우.
 *       {@link com.ryuqq.result.core.panic.Panics}를 통해 즉시 실패합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;Integer, String&gt; result = Result.&lt;Integer, String&gt;ok(5)
 *     .map(x -&gt; x * 2)
 *     .andThen(x -&gt; x &gt; 5 ? Result.ok(x) : Result.err("too small"));
 *
 * if (result instanceof Ok&lt;Integer, String&gt; ok) {
 *     System.out.println(ok.value());
 * }
 * </pre>
 *
 * @param <T> 성공 값 타입
 * @param <E> 오류 값 타입
 *
 * @author Result Team
 * @since 1.0.0
 */
public sealed interface Result<T, E> permits Ok, Err {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값 (null 불가)
     * @param <T> 성공 값 타입
     * @param <E> 오류 값 타입
     * @return Ok 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 오류 값 (null 불가)
     * @param <T> 성공 값 타입
     * @param <E> 오류 값 타입
     * @return Err 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T, E> Result<T, E> err(E error) {
        return new Err<>(error);
    }

    // ============================================================
    // Query
    // ============================================================

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    boolean isOk();

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    boolean isErr();

    /**
     * 성공이며 값이 조건을 만족하는지 확인.
     *
     * <p>Err인 경우 predicate는 호출되지 않습니다.</p>
     *
     * @param predicate 값에 대한 조건
     * @return Ok이고 predicate가 true이면 true
     */
    boolean isOkAnd(Predicate<? super T> predicate);

    /**
     * 실패이며 오류가 조건을 만족하는지 확인.
     *
     * <p>Ok인 경우 predicate는 호출되지 않습니다.</p>
     *
     * @param predicate 오류에 대한 조건
     * @return Err이고 predicate가 true이면 true
     */
    boolean isErrAnd(Predicate<? super E> predicate);

    // ============================================================
    // Extraction
    // ============================================================

    /**
     * 성공 값 추출.
     *
     * @return 성공 값
     * @throws com.ryuqq.result.core.panic.ResultPanicException Err인 경우 (계약 위반)
     */
    T unwrap();

    /**
     * 성공 값 추출 (실패 시 호출자 메시지 포함).
     *
     * <p>"이 지점에서는 Err가 될 수 없다"는 호출자의 단언을 표현할 때 사용합니다.</p>
     *
     * @param message 계약 위반 시 메시지
     * @return 성공 값
     * @throws com.ryuqq.result.core.panic.ResultPanicException Err인 경우 (계약 위반)
     * @throws IllegalArgumentException message가 null인 경우
     */
    T expect(String message);

    /**
     * 성공 값 또는 기본값 반환.
     *
     * @param defaultValue 기본값 (호출 전에 평가됨)
     * @return Ok이면 값, Err이면 defaultValue
     */
    T unwrapOr(T defaultValue);

    /**
     * 성공 값 또는 오류로부터 계산한 값 반환.
     *
     * <p>Ok인 경우 fallback은 호출되지 않습니다.</p>
     *
     * @param fallback 오류를 받아 대체 값을 만드는 함수
     * @return Ok이면 값, Err이면 fallback(error)
     */
    T unwrapOrElse(Function<? super E, ? extends T> fallback);

    /**
     * 오류 값 추출.
     *
     * @return 오류 값
     * @throws com.ryuqq.result.core.panic.ResultPanicException Ok인 경우 (계약 위반)
     */
    E unwrapErr();

    /**
     * 오류 값 추출 (실패 시 호출자 메시지 포함).
     *
     * @param message 계약 위반 시 메시지
     * @return 오류 값
     * @throws com.ryuqq.result.core.panic.ResultPanicException Ok인 경우 (계약 위반)
     * @throws IllegalArgumentException message가 null인 경우
     */
    E expectErr(String message);

    /**
     * 성공 값을 Optional로 변환.
     *
     * @return Ok이면 값을 담은 Optional, Err이면 빈 Optional
     */
    Optional<T> ok();

    /**
     * 오류 값을 Optional로 변환.
     *
     * @return Err이면 오류를 담은 Optional, Ok이면 빈 Optional
     */
    Optional<E> err();

    /**
     * 성공 값을 Stream으로 변환.
     *
     * @return Ok이면 값 하나를 담은 Stream, Err이면 빈 Stream
     */
    Stream<T> stream();

    // ============================================================
    // Transformation
    // ============================================================

    /**
     * 성공 값 변환.
     *
     * <p>Err인 경우 mapper는 호출되지 않고 오류가 그대로 전파됩니다.</p>
     *
     * @param mapper 값 변환 함수
     * @param <U> 변환된 값 타입
     * @return Ok(mapper(value)) 또는 Err(error)
     */
    <U> Result<U, E> map(Function<? super T, ? extends U> mapper);

    /**
     * 오류 값 변환.
     *
     * <p>Ok인 경우 mapper는 호출되지 않고 값이 그대로 전파됩니다.</p>
     *
     * @param mapper 오류 변환 함수
     * @param <F> 변환된 오류 타입
     * @return Ok(value) 또는 Err(mapper(error))
     */
    <F> Result<T, F> mapErr(Function<? super E, ? extends F> mapper);

    /**
     * 성공 값 변환 또는 기본값 반환.
     *
     * @param defaultValue Err인 경우 반환할 값
     * @param mapper 값 변환 함수
     * @param <U> 반환 타입
     * @return Ok이면 mapper(value), Err이면 defaultValue
     */
    <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper);

    /**
     * 두 variant를 하나의 값으로 합침.
     *
     * <p>정확히 하나의 함수만 호출됩니다.</p>
     *
     * @param errMapper 오류 변환 함수
     * @param okMapper 값 변환 함수
     * @param <U> 반환 타입
     * @return Ok이면 okMapper(value), Err이면 errMapper(error)
     */
    <U> U mapOrElse(Function<? super E, ? extends U> errMapper, Function<? super T, ? extends U> okMapper);

    /**
     * 성공 값으로 다음 Result를 계산 (flatMap).
     *
     * @param mapper 값을 받아 새 Result를 만드는 함수
     * @param <U> 새 성공 값 타입
     * @return Ok이면 mapper(value), Err이면 Err(error)
     */
    <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> mapper);

    /**
     * 오류로부터 복구 Result를 계산.
     *
     * @param mapper 오류를 받아 새 Result를 만드는 함수
     * @param <F> 새 오류 타입
     * @return Ok이면 Ok(value), Err이면 mapper(error)
     */
    <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> mapper);

    /**
     * 성공이면 other를, 실패이면 자신의 오류를 반환.
     *
     * <p>두 결과가 모두 Err이면 첫 번째 오류(this)가 반환됩니다.</p>
     *
     * @param other 이어지는 결과
     * @param <U> other의 성공 값 타입
     * @return Ok이면 other, Err이면 Err(error)
     */
    <U> Result<U, E> and(Result<U, E> other);

    /**
     * 성공이면 자신의 값을, 실패이면 other를 반환.
     *
     * <p>두 결과가 모두 Err이면 두 번째 오류(other)가 반환됩니다.</p>
     *
     * @param other 대체 결과
     * @param <F> other의 오류 타입
     * @return Ok이면 Ok(value), Err이면 other
     */
    <F> Result<T, F> or(Result<T, F> other);

    /**
     * 성공 값에 대해 부수 효과 실행 (로깅 등).
     *
     * @param action 값에 대한 동작
     * @return this (변경 없음)
     */
    Result<T, E> inspect(Consumer<? super T> action);

    /**
     * 오류 값에 대해 부수 효과 실행 (로깅 등).
     *
     * @param action 오류에 대한 동작
     * @return this (변경 없음)
     */
    Result<T, E> inspectErr(Consumer<? super E> action);
}
