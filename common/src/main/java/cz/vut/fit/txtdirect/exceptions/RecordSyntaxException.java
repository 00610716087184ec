package cz.vut.fit.txtdirect.exceptions;

import cz.vut.fit.txtdirect.models.FallbackMode;
import org.jetbrains.annotations.NotNull;

/**
 * A TXT answer is not a well-formed directive string.
 */
public class RecordSyntaxException extends TxtDirectException {
    public RecordSyntaxException(@NotNull String message) {
        super(message, FallbackMode.GLOBAL, FOUND);
    }

    public RecordSyntaxException(@NotNull String message, Throwable cause) {
        super(message, cause, FallbackMode.GLOBAL, FOUND);
    }

    /**
     * A malformed value that is answered with a permanent global redirect (invalid URIs, bad {@code ref=}).
     */
    public static RecordSyntaxException permanent(@NotNull String message, Throwable cause) {
        return new RecordSyntaxException(message, cause, MOVED_PERMANENTLY);
    }

    private RecordSyntaxException(@NotNull String message, Throwable cause, int code) {
        super(message, cause, FallbackMode.GLOBAL, code);
    }
}
