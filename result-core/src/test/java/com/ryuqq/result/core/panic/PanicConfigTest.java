package com.ryuqq.result.core.panic;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PanicConfig Record 테스트.
 *
 * @author Result Team
 * @since 1.0.0
 */
class PanicConfigTest {

    @Test
    void defaultConstructor_UsesDefaults() {
        // When
        PanicConfig config = new PanicConfig();

        // Then
        assertTrue(config.logEnabled());
        assertFalse(config.abortProcess());
        assertEquals(134, config.exitStatus());
    }

    @Test
    void constructor_ExitStatusZero_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new PanicConfig(true, true, 0)
        );
        assertTrue(exception.getMessage().contains("current: 0"));
    }

    @Test
    void constructor_ExitStatusAbove255_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new PanicConfig(true, true, 256));
    }

    @Test
    void withMethods_ReturnNewInstanceAndKeepOriginal() {
        // Given
        PanicConfig original = new PanicConfig();

        // When
        PanicConfig changed = original.withLogEnabled(false).withAbortProcess(true).withExitStatus(1);

        // Then
        assertEquals(new PanicConfig(false, true, 1), changed);
        assertEquals(new PanicConfig(), original);
    }

    @Test
    void withExitStatus_Invalid_ThrowsException() {
        // Given
        PanicConfig config = new PanicConfig();

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> config.withExitStatus(-1));
    }
}
