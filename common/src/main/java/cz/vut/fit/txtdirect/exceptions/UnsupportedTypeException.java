package cz.vut.fit.txtdirect.exceptions;

import cz.vut.fit.txtdirect.models.FallbackMode;
import org.jetbrains.annotations.NotNull;

public class UnsupportedTypeException extends TxtDirectException {
    public UnsupportedTypeException(@NotNull String typeName) {
        super("record type " + typeName + " unsupported", FallbackMode.GLOBAL, FOUND);
    }
}
