package com.ryuqq.conductor.core.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkError 및 오류 분류 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkErrorTest {

    @Test
    void from_ConductorException_KeepsCode() {
        // Given
        DependencyExhaustedException exception =
            new DependencyExhaustedException("llm", 3, new IOException("connection reset"));

        // When
        WorkError error = WorkError.from(exception);

        // Then
        assertEquals(ErrorCode.DEPENDENCY_EXHAUSTED, error.code());
        assertTrue(error.message().contains("llm"));
        assertTrue(error.cause().contains("connection reset"));
        assertEquals(3, exception.getAttempts());
    }

    @Test
    void from_ArbitraryException_IsHandlerFailed() {
        // When
        WorkError error = WorkError.from(new IllegalStateException());

        // Then
        assertEquals(ErrorCode.HANDLER_FAILED, error.code());
        assertEquals("IllegalStateException", error.message());
        assertNull(error.cause());
    }

    @Test
    void from_ExceptionWithEmptyMessage_UsesClassName() {
        // When
        WorkError error = WorkError.from(new IllegalStateException(""));

        // Then
        assertEquals(ErrorCode.HANDLER_FAILED, error.code());
        assertEquals("IllegalStateException", error.message());
    }

    @Test
    void constructor_BlankMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> WorkError.of(ErrorCode.BLOCKED_INPUT, " "));
    }

    @Test
    void errorCode_OnlyAttemptTimeoutIsRetryable() {
        for (ErrorCode code : ErrorCode.values()) {
            assertEquals(code == ErrorCode.DEPENDENCY_TIMEOUT, code.isRetryable(), code.name());
        }
    }

    @Test
    void blockedInput_CarriesRuleName() {
        // When
        BlockedInputException exception = new BlockedInputException("prompt-injection");

        // Then
        assertEquals("prompt-injection", exception.getRuleName());
        assertEquals(ErrorCode.BLOCKED_INPUT, exception.toWorkError().code());
    }
}
