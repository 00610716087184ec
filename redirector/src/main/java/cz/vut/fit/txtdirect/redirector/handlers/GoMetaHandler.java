package cz.vut.fit.txtdirect.redirector.handlers;

import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import cz.vut.fit.txtdirect.exceptions.TxtDirectException;
import cz.vut.fit.txtdirect.exceptions.TypeHandlerException;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.http.ResponseSink;
import cz.vut.fit.txtdirect.models.FallbackMode;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;

/**
 * Answers {@code go get} with the {@code go-import} meta tag pointing at the repository in {@code to=}.
 */
public class GoMetaHandler {
    public static final String GO_GET_PARAMETER = "go-get";
    public static final String DEFAULT_VCS = "git";

    private static final String TEMPLATE = """
            <!DOCTYPE html>
            <html>
            <head>
            <meta name="go-import" content="%s%s %s %s">
            </head>
            </html>
            """;

    public static boolean isGoGet(@NotNull RedirectRequest request) {
        return "1".equals(request.queryParameter(GO_GET_PARAMETER));
    }

    public void render(@NotNull ResponseSink sink, @NotNull RedirectRecord record, @NotNull String host,
                       @NotNull String path) throws TypeHandlerException {
        if (record.to().isEmpty())
            throw new TypeHandlerException("gometa record has no repository", FallbackMode.WEBSITE,
                    TxtDirectException.FOUND);

        final Escaper escaper = HtmlEscapers.htmlEscaper();
        final var vcs = record.vcs().isEmpty() ? DEFAULT_VCS : record.vcs();
        final var importPath = "/".equals(path) ? "" : path;
        final var html = String.format(TEMPLATE, escaper.escape(host), escaper.escape(importPath),
                escaper.escape(vcs), escaper.escape(record.to()));

        sink.setHeader(ResponseSink.CONTENT_TYPE_HEADER, "text/html; charset=utf-8");
        sink.send(200, html.getBytes(StandardCharsets.UTF_8));
    }
}
