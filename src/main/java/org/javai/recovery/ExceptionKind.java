package org.javai.recovery;

import java.io.FileNotFoundException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * A coarse tag describing the exception that accompanied a tool failure.
 *
 * <p>Exception types are a more reliable signal than message text, so a tag,
 * when present, decides the {@link ErrorKind} before any pattern is consulted.
 */
public enum ExceptionKind {
    TIMEOUT,
    PERMISSION,
    CONNECTIVITY,
    NOT_FOUND;

    private record TypeMapping(Class<? extends Throwable> type, Predicate<Throwable> when, ExceptionKind kind) {

        TypeMapping(Class<? extends Throwable> type, ExceptionKind kind) {
            this(type, throwable -> true, kind);
        }

        boolean matches(Throwable throwable) {
            return type.isInstance(throwable) && when.test(throwable);
        }
    }

    // FileInputStream and FileReader report unreadable files as FileNotFoundException
    private static final List<TypeMapping> MAPPINGS = List.of(
            new TypeMapping(SocketTimeoutException.class, TIMEOUT),
            new TypeMapping(HttpTimeoutException.class, TIMEOUT),
            new TypeMapping(TimeoutException.class, TIMEOUT),
            new TypeMapping(AccessDeniedException.class, PERMISSION),
            new TypeMapping(FileNotFoundException.class, ExceptionKind::deniesAccess, PERMISSION),
            new TypeMapping(ConnectException.class, CONNECTIVITY),
            new TypeMapping(NoRouteToHostException.class, CONNECTIVITY),
            new TypeMapping(PortUnreachableException.class, CONNECTIVITY),
            new TypeMapping(FileNotFoundException.class, NOT_FOUND),
            new TypeMapping(NoSuchFileException.class, NOT_FOUND)
    );

    /**
     * Derives a tag from a throwable, walking its cause chain.
     *
     * @param throwable the exception raised by the tool run (may be null)
     * @return the tag of the first recognised exception, or empty
     */
    public static Optional<ExceptionKind> of(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth < 16) {
            Throwable candidate = current;
            Optional<ExceptionKind> match = MAPPINGS.stream()
                    .filter(m -> m.matches(candidate))
                    .map(TypeMapping::kind)
                    .findFirst();
            if (match.isPresent()) {
                return match;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return Optional.empty();
    }

    private static boolean deniesAccess(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) {
            return false;
        }
        String text = message.toLowerCase(Locale.ROOT);
        return text.contains("permission denied") || text.contains("access denied") || text.contains("access is denied");
    }
}
