package cz.vut.fit.txtdirect.exceptions;

import cz.vut.fit.txtdirect.models.FallbackMode;
import org.jetbrains.annotations.NotNull;

/**
 * A well-formed record that may not be served: its type is disabled, a required directive is missing
 * or two directives exclude each other.
 */
public class RecordPolicyException extends TxtDirectException {
    public RecordPolicyException(@NotNull String message) {
        super(message, FallbackMode.GLOBAL, FOUND);
    }

    public RecordPolicyException(@NotNull String message, @NotNull FallbackMode fallbackMode, int fallbackCode) {
        super(message, fallbackMode, fallbackCode);
    }
}
