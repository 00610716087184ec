package cz.vut.fit.txtdirect.redirector.handlers;

import com.google.common.base.CharMatcher;
import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.exceptions.TxtDirectException;
import cz.vut.fit.txtdirect.exceptions.TypeHandlerException;
import cz.vut.fit.txtdirect.http.ResponseSink;
import cz.vut.fit.txtdirect.models.FallbackMode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

/**
 * Sends Go module proxy requests ({@code <module>/@v/...} and {@code <module>/@latest}) to the upstream proxy.
 */
public class GoModsHandler {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(GoModsHandler.class);

    private final TxtDirectConfig _config;

    public GoModsHandler(@NotNull TxtDirectConfig config) {
        _config = config;
    }

    public void handle(@NotNull ResponseSink sink, @NotNull String host, @NotNull String path)
            throws TypeHandlerException {
        final var gomods = _config.gomods();
        if (!gomods.enabled())
            throw new TypeHandlerException("gomods is disabled", FallbackMode.TO, TxtDirectException.FOUND);

        if (!path.contains("/@v/") && !path.endsWith("/@latest"))
            throw new TypeHandlerException("not a module proxy path: " + path, FallbackMode.TO,
                    TxtDirectException.FOUND);

        final var location = CharMatcher.is('/').trimTrailingFrom(gomods.upstream()) + path;
        Logger.info("{}{} > {}", host, path, location);

        sink.setHeader(ResponseSink.STATUS_CODE_HEADER, Integer.toString(TxtDirectException.FOUND));
        sink.redirect(location, TxtDirectException.FOUND);
    }
}
