package com.ryuqq.result.testkit.contract;

import com.ryuqq.result.core.type.Result;
import org.junit.jupiter.api.Test;

/**
 * Contract Test for and/or evaluation order.
 *
 * <p>This test pins left-to-right short-circuit evaluation. When both operands are Err,
 * {@code and} keeps the first error while {@code or} yields the second one.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Ok.and(x) → x</li>
 *   <li>Err.and(x) → first error</li>
 *   <li>Ok.or(x) → first value</li>
 *   <li>Err.or(x) → x</li>
 * </ul>
 *
 * @author Result Team
 * @since 1.0.0
 */
class BooleanOperatorContractTest extends AbstractResultContractTest {

    private final Result<Integer, String> ok1 = Result.ok(1);
    private final Result<Integer, String> ok2 = Result.ok(2);
    private final Result<Integer, String> err1 = Result.err("Error1");
    private final Result<Integer, String> err2 = Result.err("Error2");

    @Test
    void testAnd_OkAndOk_ReturnsSecondValue() {
        assertOk(ok1.and(ok2), 2);
    }

    @Test
    void testAnd_OkAndErr_ReturnsSecondError() {
        assertErr(ok1.and(err2), "Error2");
    }

    @Test
    void testAnd_ErrAndOk_ReturnsFirstError() {
        assertErr(err1.and(ok2), "Error1");
    }

    @Test
    void testAnd_ErrAndErr_ReturnsFirstError() {
        assertErr(err1.and(err2), "Error1");
    }

    @Test
    void testAnd_ChangesValueType() {
        // Given
        Result<String, String> other = Result.ok("next");

        // When/Then
        assertOk(ok1.and(other), "next");
        assertErr(err1.and(other), "Error1");
    }

    @Test
    void testOr_OkOrOk_ReturnsFirstValue() {
        assertOk(ok1.or(ok2), 1);
    }

    @Test
    void testOr_OkOrErr_ReturnsFirstValue() {
        assertOk(ok1.or(err2), 1);
    }

    @Test
    void testOr_ErrOrOk_ReturnsSecondValue() {
        assertOk(err1.or(ok2), 2);
    }

    @Test
    void testOr_ErrOrErr_ReturnsSecondError() {
        assertErr(err1.or(err2), "Error2");
    }

    @Test
    void testOr_ChangesErrorType() {
        // Given
        Result<Integer, Integer> other = Result.err(404);

        // When/Then
        assertOk(ok1.or(other), 1);
        assertErr(err1.or(other), 404);
        assertNoPanic();
    }
}
