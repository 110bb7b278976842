package com.ryuqq.result.core.panic;

/**
 * 계약 위반(panic) 보고 SPI.
 *
 * <p>잘못된 variant에 대해 추출 연산이 호출되면 Result 코어가 이 핸들러를 호출합니다.
 * 호스트는 로깅, 기록, 프로세스 종료 등 원하는 방식으로 구현할 수 있습니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>핸들러가 정상 반환하더라도 호출한 연산은 {@link ResultPanicException}으로 종료됩니다.</li>
 *   <li>핸들러가 던진 예외는 변환 없이 호출자에게 전파됩니다.</li>
 *   <li>여러 스레드에서 동시에 호출될 수 있습니다.</li>
 * </ul>
 *
 * @author Result Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PanicHandler {

    /**
     * 계약 위반 보고.
     *
     * @param message 사람이 읽을 수 있는 위반 메시지
     */
    void onPanic(String message);
}
