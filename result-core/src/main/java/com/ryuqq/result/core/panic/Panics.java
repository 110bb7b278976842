package com.ryuqq.result.core.panic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 계약 위반(panic) 진입점.
 *
 * <p>현재 설치된 {@link PanicHandler}를 보관하고, 추출 연산이 잘못된 variant에서
 * 호출되었을 때 핸들러를 호출합니다. 기본 핸들러는
 * {@link LoggingPanicHandler}(기본 {@link PanicConfig})입니다.</p>
 *
 * <p><strong>사용 방식:</strong></p>
 * <pre>
 * throw Panics.panic("called Result.unwrap() on an Err value: " + error);
 * </pre>
 *
 * <p>{@link #panic(String)}은 핸들러 호출 후 예외를 반환하므로, 호출자는 항상
 * {@code throw}로 연산을 종료합니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 핸들러 설치/조회는 {@link AtomicReference}로 보호됩니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class Panics {

    private static final Logger log = LoggerFactory.getLogger(Panics.class);
    private static final PanicHandler DEFAULT_HANDLER = new LoggingPanicHandler(new PanicConfig());
    private static final AtomicReference<PanicHandler> handler = new AtomicReference<>(DEFAULT_HANDLER);

    // Utility class - prevent instantiation
    private Panics() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 핸들러 설치.
     *
     * @param newHandler 새 핸들러
     * @return 이전에 설치되어 있던 핸들러
     * @throws IllegalArgumentException newHandler가 null인 경우
     */
    public static PanicHandler install(PanicHandler newHandler) {
        if (newHandler == null) {
            throw new IllegalArgumentException("panic handler cannot be null");
        }
        PanicHandler previous = handler.getAndSet(newHandler);
        log.debug("Panic handler installed: {} (previous: {})", newHandler, previous);
        return previous;
    }

    /**
     * 기본 핸들러로 복원.
     */
    public static void reset() {
        handler.set(DEFAULT_HANDLER);
        log.debug("Panic handler reset to default");
    }

    /**
     * 현재 핸들러 조회.
     *
     * @return 현재 설치된 핸들러
     */
    public static PanicHandler current() {
        return handler.get();
    }

    /**
     * 계약 위반 보고.
     *
     * <p>설치된 핸들러를 호출한 뒤, 호출자가 던질 예외를 반환합니다.
     * 핸들러가 예외를 던지면 그 예외가 그대로 전파됩니다.</p>
     *
     * @param message 위반 메시지
     * @return 호출자가 던질 {@link ResultPanicException}
     */
    public static ResultPanicException panic(String message) {
        handler.get().onPanic(message);
        return new ResultPanicException(message);
    }
}
