package cz.vut.fit.txtdirect.exceptions;

import cz.vut.fit.txtdirect.models.FallbackMode;
import org.jetbrains.annotations.NotNull;

/**
 * None of the zones listed in the {@code use=} directives resolved to a record.
 */
public class UpstreamExhaustedException extends TxtDirectException {
    public UpstreamExhaustedException(@NotNull String message, Throwable lastCause) {
        super(message, lastCause, FallbackMode.GLOBAL, FOUND);
    }
}
