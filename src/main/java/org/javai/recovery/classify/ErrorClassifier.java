package org.javai.recovery.classify;

import org.javai.recovery.ErrorKind;
import org.javai.recovery.ExceptionKind;

/**
 * Classifies raw tool failures into an {@link ErrorKind}.
 * Implementations must be deterministic and total: every input yields exactly one kind.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies a failure.
     *
     * @param message The error text (may be null)
     * @param kindTag The exception tag, if the failure carried one (may be null)
     * @return the classified kind, {@link ErrorKind#UNKNOWN} when nothing matches
     */
    ErrorKind classify(String message, ExceptionKind kindTag);

    default ErrorKind classify(String message) {
        return classify(message, null);
    }
}
