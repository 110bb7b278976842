package com.ryuqq.result.core.panic;

/**
 * Result 계약 위반으로 인한 복구 불가능한 실패.
 *
 * <p>Err에 대한 {@code unwrap()}, Ok에 대한 {@code unwrapErr()} 등 프로그래머 오류를 나타냅니다.
 * 도메인 오류가 아니므로 Result 코어는 이 예외를 잡거나 Err로 변환하지 않습니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
public class ResultPanicException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 위반 메시지
     */
    public ResultPanicException(String message) {
        super(message);
    }
}
