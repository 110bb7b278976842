package com.ryuqq.result.core.type;

import com.ryuqq.result.core.panic.PanicHandler;
import com.ryuqq.result.core.panic.Panics;
import com.ryuqq.result.core.panic.ResultPanicException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Results 헬퍼 테스트.
 *
 * @author Result Team
 * @since 1.0.0
 */
class ResultsTest {

    @AfterEach
    void tearDown() {
        Panics.reset();
    }

    @Test
    void makeOk_InfersErrorTypeFromTarget() {
        // When
        Result<Integer, String> result = Results.makeOk(42);

        // Then
        assertThat(result.isOk()).isTrue();
        assertThat(result.unwrap()).isEqualTo(42);
    }

    @Test
    void makeErr_WithExplicitTypeArguments_CreatesErr() {
        // When
        Result<Integer, String> result = Results.<Integer, String>makeErr("Test Error");

        // Then
        assertThat(result.isErr()).isTrue();
        assertThat(result.unwrapErr()).isEqualTo("Test Error");
    }

    @Test
    void flatten_OkOfOk_ReturnsInner() {
        // Given
        Result<Result<Integer, String>, String> nested = Result.ok(Result.ok(3));

        // When & Then
        assertThat(Results.flatten(nested)).isEqualTo(Result.ok(3));
    }

    @Test
    void flatten_OkOfErr_ReturnsInnerErr() {
        // Given
        Result<Result<Integer, String>, String> nested = Result.ok(Result.err("inner"));

        // When & Then
        assertThat(Results.flatten(nested)).isEqualTo(Result.err("inner"));
    }

    @Test
    void flatten_OuterErr_ReturnsOuterErr() {
        // Given
        Result<Result<Integer, String>, String> nested = Result.err("outer");

        // When & Then
        assertThat(Results.flatten(nested)).isEqualTo(Result.err("outer"));
    }

    @Test
    void sequence_AllOk_CollectsValuesInOrder() {
        // Given
        List<Result<Integer, String>> results = List.of(Result.ok(1), Result.ok(2), Result.ok(3));

        // When
        Result<List<Integer>, String> collected = Results.sequence(results);

        // Then
        assertThat(collected.unwrap()).containsExactly(1, 2, 3);
        assertThatThrownBy(() -> collected.unwrap().add(4))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void sequence_ContainsErr_ReturnsFirstErrAndStops() {
        // Given
        List<Result<Integer, String>> results = new ArrayList<>();
        results.add(Result.ok(1));
        results.add(Result.err("first"));
        results.add(Result.err("second"));
        results.add(null);

        // When
        Result<List<Integer>, String> collected = Results.sequence(results);

        // Then
        assertThat(collected.unwrapErr()).isEqualTo("first");
    }

    @Test
    void sequence_Empty_ReturnsOkOfEmptyList() {
        // When
        Result<List<Integer>, String> collected = Results.sequence(List.<Result<Integer, String>>of());

        // Then
        assertThat(collected.unwrap()).isEmpty();
    }

    @Test
    void sequence_NullElement_ThrowsException() {
        // Given
        List<Result<Integer, String>> results = new ArrayList<>();
        results.add(null);

        // When & Then
        assertThatThrownBy(() -> Results.sequence(results))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }

    @Test
    void attempt_SupplierReturns_CreatesOk() {
        // When
        Result<String, Exception> result = Results.attempt(() -> "loaded");

        // Then
        assertThat(result.unwrap()).isEqualTo("loaded");
    }

    @Test
    void attempt_SupplierThrowsCheckedException_CreatesErr() {
        // Given
        IOException failure = new IOException("disk unavailable");

        // When
        Result<String, Exception> result = Results.attempt(() -> {
            throw failure;
        });

        // Then
        assertThat(result.unwrapErr()).isSameAs(failure);
    }

    @Test
    void attempt_SupplierInterrupted_CreatesErrAndRestoresInterruptFlag() {
        // Given
        InterruptedException interruption = new InterruptedException("stop");

        try {
            // When
            Result<String, Exception> result = Results.attempt(() -> {
                throw interruption;
            });

            // Then
            assertThat(result.unwrapErr()).isSameAs(interruption);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void attempt_SupplierPanics_PropagatesPanic() {
        // Given
        PanicHandler silent = message -> { };
        Panics.install(silent);
        Result<Integer, String> err = Result.err("e");

        // When & Then
        assertThatThrownBy(() -> Results.attempt(err::unwrap))
            .isInstanceOf(ResultPanicException.class)
            .hasMessageContaining("on an Err value");
    }

    @Test
    void attempt_SupplierThrowsError_PropagatesError() {
        // When & Then
        assertThatThrownBy(() -> Results.attempt(() -> {
            throw new StackOverflowError("deep");
        })).isInstanceOf(StackOverflowError.class);
    }

    @Test
    void constructor_ThrowsUnsupportedOperationException() throws Exception {
        // Given
        var constructor = Results.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        // When & Then
        assertThatThrownBy(constructor::newInstance)
            .hasCauseInstanceOf(UnsupportedOperationException.class);
    }
}
