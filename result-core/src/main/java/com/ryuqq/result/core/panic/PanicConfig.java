package com.ryuqq.result.core.panic;

/**
 * 기본 panic 핸들러 설정 (불변 record).
 *
 * <p>이 record는 {@link LoggingPanicHandler}의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>logEnabled: panic 메시지를 ERROR 레벨로 로깅 (기본 true)</li>
 *   <li>abortProcess: panic 시 JVM 즉시 종료 (기본 false)</li>
 *   <li>exitStatus: 종료 시 사용할 상태 코드 (기본 134, 1~255)</li>
 * </ul>
 *
 * <p><strong>운영 가이드:</strong></p>
 * <ul>
 *   <li>라이브러리/서버 기본값: abortProcess=false (예외로 호출 스택 종료)</li>
 *   <li>배치/CLI 등 fail-fast 환경: abortProcess=true</li>
 * </ul>
 *
 * @author Result Team
 * @since 1.0.0
 * @param logEnabled 로깅 여부
 * @param abortProcess 프로세스 종료 여부
 * @param exitStatus 종료 상태 코드 (1~255)
 */
public record PanicConfig(boolean logEnabled, boolean abortProcess, int exitStatus) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: logEnabled=true, abortProcess=false, exitStatus=134</p>
     */
    public PanicConfig() {
        this(true, false, 134);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException exitStatus가 범위를 벗어난 경우
     */
    public PanicConfig {
        if (exitStatus < 1 || exitStatus > 255) {
            throw new IllegalArgumentException(
                "exitStatus must be between 1 and 255 (current: " + exitStatus + ")"
            );
        }
    }

    /**
     * logEnabled만 변경한 새 인스턴스 생성.
     *
     * @param logEnabled 로깅 여부
     * @return 새 PanicConfig 인스턴스
     */
    public PanicConfig withLogEnabled(boolean logEnabled) {
        return new PanicConfig(logEnabled, this.abortProcess, this.exitStatus);
    }

    /**
     * abortProcess만 변경한 새 인스턴스 생성.
     *
     * @param abortProcess 프로세스 종료 여부
     * @return 새 PanicConfig 인스턴스
     */
    public PanicConfig withAbortProcess(boolean abortProcess) {
        return new PanicConfig(this.logEnabled, abortProcess, this.exitStatus);
    }

    /**
     * exitStatus만 변경한 새 인스턴스 생성.
     *
     * @param exitStatus 종료 상태 코드
     * @return 새 PanicConfig 인스턴스
     */
    public PanicConfig withExitStatus(int exitStatus) {
        return new PanicConfig(this.logEnabled, this.abortProcess, exitStatus);
    }
}
