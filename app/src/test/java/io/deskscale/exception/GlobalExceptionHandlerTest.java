package io.deskscale.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

class GlobalExceptionHandlerTest {

    @Test
    void testIsCausedByWalksCauseChain() {
        var interrupted = new InterruptedException("stop");
        var wrapped = new RethemeException(2, "interrupted", new IOException("io", interrupted));

        assertTrue(GlobalExceptionHandler.isCausedBy(wrapped, InterruptedException.class));
        assertTrue(GlobalExceptionHandler.isCausedBy(wrapped, IOException.class));
        assertFalse(GlobalExceptionHandler.isCausedBy(wrapped, CancellationException.class));
    }

    @Test
    void testHandleDoesNotRethrow() {
        assertDoesNotThrow(() -> GlobalExceptionHandler.handle(Thread.currentThread(), new IllegalStateException("x")));
        assertDoesNotThrow(() -> new GlobalExceptionHandler()
                .uncaughtException(Thread.currentThread(), new CancellationException("cancelled")));
    }

    @Test
    void testRethemeExceptionMessageNamesFactor() {
        var ex = new RethemeException(2, "command exited with status 3");

        assertEquals(2, ex.getFactor());
        assertTrue(ex.getMessage().contains("factor 2"), ex.getMessage());
        assertTrue(ex.getMessage().endsWith("command exited with status 3"), ex.getMessage());
    }
}
