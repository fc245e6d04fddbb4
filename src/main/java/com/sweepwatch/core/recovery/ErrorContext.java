package com.sweepwatch.core.recovery;

/**
 * What went wrong, handed to {@link RecoveryEngine#decide(ErrorContext)}.
 *
 * @param message        the error line or description
 * @param startupFatal   whether the message matched a fatal startup pattern
 * @param frequencyIndex the frequency being swept when it happened, null if unknown
 */
public record ErrorContext(String message, boolean startupFatal, Integer frequencyIndex) {

    public static ErrorContext fatal(String message, int frequencyIndex) {
        return new ErrorContext(message, true, frequencyIndex);
    }

    public static ErrorContext transientFailure(String message, Integer frequencyIndex) {
        return new ErrorContext(message, false, frequencyIndex);
    }
}
