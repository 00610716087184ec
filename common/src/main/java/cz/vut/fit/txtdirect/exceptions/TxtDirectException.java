package cz.vut.fit.txtdirect.exceptions;

import cz.vut.fit.txtdirect.models.FallbackMode;
import org.jetbrains.annotations.NotNull;

/**
 * The base of all failures that end in a fallback response. Each failure knows which fallback mode and status
 * the dispatcher should answer with.
 */
public abstract class TxtDirectException extends Exception {
    /**
     * Status used by fallbacks triggered by resolution failures.
     */
    public static final int FOUND = 302;
    public static final int MOVED_PERMANENTLY = 301;

    private final FallbackMode _fallbackMode;
    private final int _fallbackCode;

    protected TxtDirectException(@NotNull String message, @NotNull FallbackMode fallbackMode, int fallbackCode) {
        super(message);
        _fallbackMode = fallbackMode;
        _fallbackCode = fallbackCode;
    }

    protected TxtDirectException(@NotNull String message, Throwable cause,
                                 @NotNull FallbackMode fallbackMode, int fallbackCode) {
        super(message, cause);
        _fallbackMode = fallbackMode;
        _fallbackCode = fallbackCode;
    }

    @NotNull
    public FallbackMode fallbackMode() {
        return _fallbackMode;
    }

    public int fallbackCode() {
        return _fallbackCode;
    }
}
