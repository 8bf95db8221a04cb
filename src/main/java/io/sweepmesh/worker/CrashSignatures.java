package io.sweepmesh.worker;

import io.sweepmesh.model.FailureType;

import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.util.List;
import java.util.Locale;

/**
 * Classifies exceptions thrown out of a worker handle. Anything that looks like the session itself died
 * is a browser failure; everything else is unknown.
 */
public final class CrashSignatures {
    private static final List<String> MESSAGE_SIGNATURES = List.of(
            "target closed",
            "browser has been closed",
            "browser closed",
            "session closed",
            "page crashed",
            "crashed",
            "connection closed",
            "connection reset",
            "broken pipe",
            "disconnected",
            "process exited",
            "no such session"
    );

    private CrashSignatures() {
    }

    public static FailureType classify(Throwable error) {
        return isCrash(error) ? FailureType.BROWSER : FailureType.UNKNOWN;
    }

    public static boolean isCrash(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            if (current instanceof InterruptedException
                    || current instanceof InterruptedIOException
                    || current instanceof ClosedByInterruptException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String signature : MESSAGE_SIGNATURES) {
                    if (lower.contains(signature)) {
                        return true;
                    }
                }
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank()
                ? error.getClass().getSimpleName()
                : error.getClass().getSimpleName() + ": " + message;
    }
}
