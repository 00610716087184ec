package cz.vut.fit.txtdirect.exceptions;

import cz.vut.fit.txtdirect.models.FallbackMode;
import org.jetbrains.annotations.NotNull;

/**
 * A host record without a {@code to=} target. Answered by the global fallback with a permanent redirect.
 */
public class MissingTargetException extends RecordPolicyException {
    public MissingTargetException(@NotNull String message) {
        super(message, FallbackMode.GLOBAL, MOVED_PERMANENTLY);
    }
}
