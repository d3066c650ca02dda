package org.javai.recovery;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Optional;

/**
 * The raw failure reported by a tool run.
 *
 * @param message The error text as produced by the tool or its runner (never null, may be empty)
 * @param kindTag Optional exception tag (may be null)
 * @param stackTrace Diagnostic stack trace (never null, may be empty)
 */
public record ToolError(String message, ExceptionKind kindTag, String stackTrace) {

    public ToolError {
        message = message == null ? "" : message;
        stackTrace = stackTrace == null ? "" : stackTrace;
    }

    public static ToolError of(String message) {
        return new ToolError(message, null, null);
    }

    public static ToolError of(String message, ExceptionKind kindTag) {
        return new ToolError(message, kindTag, null);
    }

    /**
     * Captures message, exception tag and stack trace from a throwable.
     */
    public static ToolError of(Throwable throwable) {
        if (throwable == null) {
            return of("");
        }
        String message = throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getName();
        return new ToolError(message, ExceptionKind.of(throwable).orElse(null), stackTraceOf(throwable));
    }

    public Optional<ExceptionKind> tag() {
        return Optional.ofNullable(kindTag);
    }

    private static String stackTraceOf(Throwable throwable) {
        StringWriter out = new StringWriter();
        throwable.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
