package cz.vut.fit.txtdirect.exceptions;

import cz.vut.fit.txtdirect.models.FallbackMode;
import org.jetbrains.annotations.NotNull;

/**
 * A type-specific handler could not produce a response.
 */
public class TypeHandlerException extends TxtDirectException {
    public TypeHandlerException(@NotNull String message, @NotNull FallbackMode fallbackMode, int fallbackCode) {
        super(message, fallbackMode, fallbackCode);
    }

    public TypeHandlerException(@NotNull String message, Throwable cause,
                                @NotNull FallbackMode fallbackMode, int fallbackCode) {
        super(message, cause, fallbackMode, fallbackCode);
    }
}
