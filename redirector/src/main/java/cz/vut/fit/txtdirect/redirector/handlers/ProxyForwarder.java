package cz.vut.fit.txtdirect.redirector.handlers;

import cz.vut.fit.txtdirect.exceptions.TypeHandlerException;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.http.ResponseSink;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import org.jetbrains.annotations.NotNull;

/**
 * Forwards a request to the target of a proxy record and copies the upstream response into the sink.
 */
public interface ProxyForwarder {
    /**
     * @throws TypeHandlerException if the upstream could not be reached, timed out or the request was cancelled;
     *                              nothing has been written to the sink in that case
     */
    void forward(@NotNull ResponseSink sink, @NotNull RedirectRequest request, @NotNull RedirectRecord record)
            throws TypeHandlerException;
}
