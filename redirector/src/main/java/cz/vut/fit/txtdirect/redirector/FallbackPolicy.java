package cz.vut.fit.txtdirect.redirector;

import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.http.ResponseSink;
import cz.vut.fit.txtdirect.models.FallbackMode;
import cz.vut.fit.txtdirect.models.ResolutionContext;
import org.jetbrains.annotations.NotNull;

/**
 * Produces the final response of a request whose record could not be served.
 */
public interface FallbackPolicy {
    /**
     * Writes a fallback response. Does nothing if the response has already been committed.
     *
     * @param sink    the response
     * @param request the request being answered
     * @param context the records resolved so far; the "to" and "website" modes read the last one
     * @param mode    where to send the client
     * @param code    the redirect status
     */
    void fallback(@NotNull ResponseSink sink, @NotNull RedirectRequest request, @NotNull ResolutionContext context,
                  @NotNull FallbackMode mode, int code);
}
