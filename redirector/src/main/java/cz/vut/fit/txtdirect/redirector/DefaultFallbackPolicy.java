package cz.vut.fit.txtdirect.redirector;

import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.http.ResponseSink;
import cz.vut.fit.txtdirect.models.FallbackMode;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import cz.vut.fit.txtdirect.models.ResolutionContext;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * The fallback chain: "to" and "website" redirect to the respective target of the last resolved record and fall
 * through to "global" when it is empty. "global" redirects to the configured redirect target or answers 404.
 */
public class DefaultFallbackPolicy implements FallbackPolicy {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(DefaultFallbackPolicy.class);

    static final byte[] NOT_FOUND_BODY = "404 page not found\n".getBytes(StandardCharsets.UTF_8);

    private final TxtDirectConfig _config;

    public DefaultFallbackPolicy(@NotNull TxtDirectConfig config) {
        _config = config;
    }

    @Override
    public void fallback(@NotNull ResponseSink sink, @NotNull RedirectRequest request,
                         @NotNull ResolutionContext context, @NotNull FallbackMode mode, int code) {
        if (sink.isCommitted()) {
            Logger.debug("Response already committed, skipping {} fallback", mode);
            return;
        }

        final var record = context.lastRecord();
        if (record != null) {
            final var target = switch (mode) {
                case TO -> record.to();
                case WEBSITE -> record.website();
                case GLOBAL -> "";
            };

            if (!target.isEmpty()) {
                redirect(sink, request, record, target, code);
                return;
            }
        }

        global(sink, request, code);
    }

    private void redirect(ResponseSink sink, RedirectRequest request, RedirectRecord record, String target,
                          int code) {
        Logger.info("{}{} > {}", request.host(), request.path(), target);
        if (record.ref())
            sink.setHeader(ResponseSink.REFERER_HEADER, request.host());

        sink.setHeader(ResponseSink.STATUS_CODE_HEADER, Integer.toString(code));
        sink.redirect(target, code);
    }

    private void global(ResponseSink sink, RedirectRequest request, int code) {
        final var target = _config.redirect();
        if (target.isEmpty()) {
            Logger.info("{}{} > not found", request.host(), request.path());
            sink.setHeader(ResponseSink.CONTENT_TYPE_HEADER, "text/plain; charset=utf-8");
            sink.send(404, NOT_FOUND_BODY);
            return;
        }

        Logger.info("{}{} > {}", request.host(), request.path(), target);
        sink.setHeader(ResponseSink.STATUS_CODE_HEADER, Integer.toString(code));
        sink.redirect(target, code);
    }
}
