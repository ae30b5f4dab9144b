package com.ryuqq.conductor.core.error;

/**
 * 엔진 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 unchecked이며 {@link ErrorCode}를 가집니다. Coordinator는
 * 이 예외를 경계 밖으로 던지지 않고 {@link WorkError}로 변환해 WorkUnit에 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ConductorException extends RuntimeException {

    private final ErrorCode errorCode;

    public ConductorException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public ConductorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public WorkError toWorkError() {
        return WorkError.from(this);
    }
}
