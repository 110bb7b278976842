package com.ryuqq.result.core.type;

import com.ryuqq.result.core.panic.ResultPanicException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result 생성 및 조합 헬퍼.
 *
 * <p>타입 인자를 호출 지점에서 명시하거나 대입 대상에서 추론하는 생성 함수와,
 * 여러 Result를 다루는 정적 연산을 제공합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;Integer, String&gt; a = Results.makeOk(42);
 * Result&lt;Integer, String&gt; b = Results.&lt;Integer, String&gt;makeErr("boom");
 *
 * Result&lt;List&lt;Integer&gt;, String&gt; all = Results.sequence(List.of(a, b)); // Err("boom")
 * </pre>
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class Results {

    // Utility class - prevent instantiation
    private Results() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 성공 결과 생성 (오류 타입은 호출 지점에서 추론).
     *
     * @param value 성공 값
     * @param <T> 성공 값 타입
     * @param <E> 오류 값 타입
     * @return Ok 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static <T, E> Result<T, E> makeOk(T value) {
        return new Ok<>(value);
    }

    /**
     * 실패 결과 생성 (성공 값 타입은 호출 지점에서 추론).
     *
     * @param error 오류 값
     * @param <T> 성공 값 타입
     * @param <E> 오류 값 타입
     * @return Err 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static <T, E> Result<T, E> makeErr(E error) {
        return new Err<>(error);
    }

    /**
     * 중첩된 Result를 한 단계 펼침.
     *
     * @param nested 중첩 Result
     * @param <T> 성공 값 타입
     * @param <E> 오류 값 타입
     * @return 안쪽 Result 또는 바깥 Err
     */
    public static <T, E> Result<T, E> flatten(Result<Result<T, E>, E> nested) {
        return Arguments.notNull(nested, "nested").andThen(inner -> inner);
    }

    /**
     * 여러 Result를 하나의 Result로 모음.
     *
     * <p>모든 요소가 Ok이면 값 목록(순서 유지)을 담은 Ok를 반환합니다.
     * 처음 만나는 Err에서 멈추며, 이후 요소는 확인하지 않습니다.</p>
     *
     * @param results Result 목록
     * @param <T> 성공 값 타입
     * @param <E> 오류 값 타입
     * @return Ok(불변 값 목록) 또는 첫 번째 Err
     * @throws IllegalArgumentException results 또는 요소가 null인 경우
     */
    public static <T, E> Result<List<T>, E> sequence(Iterable<? extends Result<? extends T, ? extends E>> results) {
        Arguments.notNull(results, "results");
        List<T> values = new ArrayList<>();
        for (Result<? extends T, ? extends E> result : results) {
            Arguments.notNull(result, "result element");
            if (result.isErr()) {
                return new Err<>(result.unwrapErr());
            }
            values.add(result.unwrap());
        }
        return new Ok<>(Collections.unmodifiableList(values));
    }

    /**
     * 예외를 던질 수 있는 코드를 실행하고 결과를 Result로 감쌈.
     *
     * <p>던져진 {@link Exception}은 Err로 변환됩니다. {@link Error}와
     * {@link ResultPanicException}(계약 위반)은 변환하지 않고 그대로 전파합니다.
     * {@link InterruptedException}은 Err로 변환하되 현재 스레드의 인터럽트 상태를 복원합니다.</p>
     *
     * @param supplier 실행할 코드
     * @param <T> 성공 값 타입
     * @return Ok(반환값) 또는 Err(예외)
     * @throws IllegalArgumentException supplier가 null이거나 null을 반환한 경우
     */
    public static <T> Result<T, Exception> attempt(CheckedSupplier<? extends T> supplier) {
        Arguments.notNull(supplier, "supplier");
        T value;
        try {
            value = supplier.get();
        } catch (ResultPanicException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return new Err<>(e);
        }
        return new Ok<>(value);
    }

    /**
     * 검사 예외를 던질 수 있는 Supplier.
     *
     * @param <T> 반환 타입
     */
    @FunctionalInterface
    public interface CheckedSupplier<T> {
        T get() throws Exception;
    }
}
