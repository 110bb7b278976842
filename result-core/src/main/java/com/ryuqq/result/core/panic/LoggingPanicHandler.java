package com.ryuqq.result.core.panic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.IntConsumer;

/**
 * SLF4J 기반 기본 panic 핸들러.
 *
 * <p>panic 메시지를 ERROR 레벨로 기록하고, 설정에 따라 JVM을 즉시 종료합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>logEnabled=true: 메시지와 호출 스택을 ERROR로 로깅</li>
 *   <li>abortProcess=true: WARN 로그 후 {@link Runtime#halt(int)} 호출</li>
 *   <li>abortProcess=false: 반환 (호출한 연산은 {@link ResultPanicException}으로 종료)</li>
 * </ul>
 *
 * <p>로그에 첨부되는 스택은 panic 지점을 보여주기 위한 {@link Throwable}이며 던져지지 않습니다.
 * 호출자가 받는 예외는 {@link Panics#panic(String)}이 반환하는 {@link ResultPanicException} 하나뿐입니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class LoggingPanicHandler implements PanicHandler {

    private static final Logger DEFAULT_LOG = LoggerFactory.getLogger(LoggingPanicHandler.class);
    private final PanicConfig config;
    private final IntConsumer terminator;
    private final Logger log;

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public LoggingPanicHandler(PanicConfig config) {
        this(config, status -> Runtime.getRuntime().halt(status));
    }

    /**
     * 생성자 (종료 동작 지정).
     *
     * @param config 설정
     * @param terminator 종료 상태 코드를 받아 프로세스를 종료하는 동작
     * @throws IllegalArgumentException config 또는 terminator가 null인 경우
     */
    public LoggingPanicHandler(PanicConfig config, IntConsumer terminator) {
        this(config, terminator, DEFAULT_LOG);
    }

    LoggingPanicHandler(PanicConfig config, IntConsumer terminator, Logger log) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (terminator == null) {
            throw new IllegalArgumentException("terminator cannot be null");
        }
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.config = config;
        this.terminator = terminator;
        this.log = log;
    }

    @Override
    public void onPanic(String message) {
        if (config.logEnabled()) {
            log.error("Result panicked: {}", message, new Throwable("panic call site"));
        }
        if (config.abortProcess()) {
            log.warn("Aborting process with exit status {}", config.exitStatus());
            terminator.accept(config.exitStatus());
        }
    }

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    public PanicConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "LoggingPanicHandler{" + config + '}';
    }
}
