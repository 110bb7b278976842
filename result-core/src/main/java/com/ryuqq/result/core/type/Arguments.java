package com.ryuqq.result.core.type;

/**
 * 인자 검증 유틸리티.
 *
 * @author Result Team
 * @since 1.0.0
 */
final class Arguments {

    // Utility class - prevent instantiation
    private Arguments() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * null이 아닌지 검증.
     *
     * @param argument 검증할 인자
     * @param name 인자 이름 (오류 메시지용)
     * @param <X> 인자 타입
     * @return argument
     * @throws IllegalArgumentException argument가 null인 경우
     */
    static <X> X notNull(X argument, String name) {
        if (argument == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return argument;
    }

    /**
     * 콜백이 반환한 Result가 null이 아닌지 검증.
     *
     * @param result 콜백 반환값
     * @param <X> Result 타입
     * @return result
     * @throws IllegalArgumentException result가 null인 경우
     */
    static <X> X returned(X result) {
        if (result == null) {
            throw new IllegalArgumentException("mapper returned null instead of a Result");
        }
        return result;
    }
}
