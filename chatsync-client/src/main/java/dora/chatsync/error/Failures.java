package dora.chatsync.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Failures {

    private Failures() {
    }

    /**
     * Strips the wrappers {@link java.util.concurrent.CompletableFuture} adds around a failure.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static String describe(Throwable throwable) {
        Throwable cause = unwrap(throwable);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
