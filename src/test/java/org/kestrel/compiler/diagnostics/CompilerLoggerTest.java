package org.kestrel.compiler.diagnostics;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CompilerLoggerTest {

    private final Logger backend =
            ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(CompilerLogger.class);

    @AfterEach
    void restoreDefaultLevel() {
        CompilerLogger.setLevel(CompilerLogger.INFO);
        backend.setLevel(null);
    }

    @Test
    void testVerbosityGatesMessages() {
        // Arrange
        backend.setLevel(Level.TRACE);

        // Act
        CompilerLogger.setLevel(CompilerLogger.ERROR);

        // Assert
        assertThat(CompilerLogger.isEnabled(CompilerLogger.ERROR)).isTrue();
        assertThat(CompilerLogger.isEnabled(CompilerLogger.WARN)).isFalse();
    }

    @Test
    void testBackendLevelGatesMessages() {
        // Arrange
        backend.setLevel(Level.WARN);

        // Act
        CompilerLogger.setLevel(CompilerLogger.TRACE);

        // Assert
        assertThat(CompilerLogger.isEnabled(CompilerLogger.WARN)).isTrue();
        assertThat(CompilerLogger.isEnabled(CompilerLogger.DEBUG)).isFalse();
        assertThat(CompilerLogger.isEnabled(CompilerLogger.TRACE)).isFalse();
    }

    @Test
    void testLevelIsClamped() {
        backend.setLevel(Level.TRACE);

        CompilerLogger.setLevel(99);
        assertThat(CompilerLogger.isEnabled(CompilerLogger.TRACE)).isTrue();

        CompilerLogger.setLevel(-5);
        assertThat(CompilerLogger.isEnabled(CompilerLogger.ERROR)).isTrue();
        assertThat(CompilerLogger.isEnabled(CompilerLogger.WARN)).isFalse();
    }
}
