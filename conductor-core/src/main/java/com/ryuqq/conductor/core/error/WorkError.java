package com.ryuqq.conductor.core.error;

/**
 * 실패한 WorkUnit에 기록되는 오류 정보.
 *
 * @param code 오류 분류 코드
 * @param message 오류 메시지
 * @param cause 원인 설명 (선택, null 가능)
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkError(
    ErrorCode code,
    String message,
    String cause
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code가 null이거나 message가 비어있는 경우
     */
    public WorkError {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static WorkError of(ErrorCode code, String message) {
        return new WorkError(code, message, null);
    }

    /**
     * 예외로부터 WorkError 생성.
     *
     * <p>{@link ConductorException}은 자신의 코드를 유지하고,
     * 그 외 예외는 {@link ErrorCode#HANDLER_FAILED}로 분류됩니다.</p>
     *
     * @param throwable 발생한 예외
     * @return WorkError 인스턴스
     */
    public static WorkError from(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        ErrorCode code = throwable instanceof ConductorException ce ? ce.getErrorCode() : ErrorCode.HANDLER_FAILED;
        String message = throwable.getMessage() == null || throwable.getMessage().isBlank()
            ? throwable.getClass().getSimpleName()
            : throwable.getMessage();
        Throwable cause = throwable.getCause();
        return new WorkError(code, message, cause == null ? null : cause.toString());
    }
}
