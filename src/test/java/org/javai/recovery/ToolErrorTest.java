package org.javai.recovery;

import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ToolErrorTest {

    @Test
    void of_throwable_capturesMessageTagAndStackTrace() {
        ToolError error = ToolError.of(new SocketTimeoutException("Read timed out"));

        assertThat(error.message()).isEqualTo("Read timed out");
        assertThat(error.tag()).contains(ExceptionKind.TIMEOUT);
        assertThat(error.stackTrace()).contains("SocketTimeoutException");
    }

    @Test
    void of_throwableWithoutMessage_usesClassName() {
        ToolError error = ToolError.of(new IllegalStateException());

        assertThat(error.message()).isEqualTo(IllegalStateException.class.getName());
        assertThat(error.tag()).isEmpty();
    }

    @Test
    void exceptionKind_walksCauseChain() {
        Throwable wrapped = new UncheckedIOException(new ConnectException("Connection refused"));

        assertThat(ExceptionKind.of(wrapped)).contains(ExceptionKind.CONNECTIVITY);
        assertThat(ExceptionKind.of(new AccessDeniedException("/etc/shadow"))).contains(ExceptionKind.PERMISSION);
        assertThat(ExceptionKind.of(new NoSuchFileException("/usr/bin/nmap"))).contains(ExceptionKind.NOT_FOUND);
        assertThat(ExceptionKind.of(new IOException("disk"))).isEmpty();
        assertThat(ExceptionKind.of(null)).isEmpty();
    }

    @Test
    void exceptionKind_unreadableFile_isPermissionNotMissing() {
        FileNotFoundException unreadable = new FileNotFoundException("/usr/share/wordlists/common.txt (Permission denied)");
        FileNotFoundException missing = new FileNotFoundException("/usr/share/wordlists/common.txt (No such file or directory)");

        assertThat(ExceptionKind.of(unreadable)).contains(ExceptionKind.PERMISSION);
        assertThat(ExceptionKind.of(new FileNotFoundException("C:\\lists\\a.txt (Access is denied)")))
                .contains(ExceptionKind.PERMISSION);
        assertThat(ExceptionKind.of(missing)).contains(ExceptionKind.NOT_FOUND);
        assertThat(ExceptionKind.of(new FileNotFoundException())).contains(ExceptionKind.NOT_FOUND);
    }

    @Test
    void nullFields_becomeEmpty() {
        ToolError error = new ToolError(null, null, null);

        assertThat(error.message()).isEmpty();
        assertThat(error.stackTrace()).isEmpty();
        assertThat(error.tag()).isEmpty();
    }

    @Test
    void invocation_defaultsTargetAndCopiesParameters() {
        ToolInvocation invocation = ToolInvocation.firstAttempt(" ", Map.of("threads", "50"));

        assertThat(invocation.target()).isEqualTo(ToolInvocation.UNKNOWN_TARGET);
        assertThat(invocation.attemptCount()).isEqualTo(1);
        assertThat(invocation.nextAttempt().attemptCount()).isEqualTo(2);
        assertThatThrownBy(() -> invocation.parameters().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void invocation_rejectsAttemptBelowOne() {
        assertThatThrownBy(() -> new ToolInvocation("host", Map.of(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("attemptCount");
    }
}
