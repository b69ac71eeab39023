package dev.mirror.transport;

import java.util.Objects;

/**
 * Failure that crosses a context boundary. The {@link ErrorKind} survives the trip over the
 * channel, the message is whatever the failing side reported.
 */
public class MirrorException extends RuntimeException {

    private final ErrorKind kind;

    public MirrorException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public MirrorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Unwraps the {@code CompletionException}/{@code ExecutionException} layers futures add.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof java.util.concurrent.CompletionException
            || current instanceof java.util.concurrent.ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static ErrorKind kindOf(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof MirrorException mirror) {
            return mirror.kind();
        }
        if (cause instanceof java.nio.file.NoSuchFileException) {
            return ErrorKind.NOT_FOUND;
        }
        return ErrorKind.FAILED;
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
