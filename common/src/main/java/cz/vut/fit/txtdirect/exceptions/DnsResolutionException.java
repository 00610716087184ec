package cz.vut.fit.txtdirect.exceptions;

import cz.vut.fit.txtdirect.models.FallbackMode;
import org.jetbrains.annotations.NotNull;

/**
 * No usable TXT answer could be obtained for a zone: every lookup stage failed, the answer was ambiguous,
 * or the request ran out of time.
 */
public class DnsResolutionException extends TxtDirectException {
    public DnsResolutionException(@NotNull String message) {
        super(message, FallbackMode.GLOBAL, FOUND);
    }

    public DnsResolutionException(@NotNull String message, Throwable cause) {
        super(message, cause, FallbackMode.GLOBAL, FOUND);
    }
}
