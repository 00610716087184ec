package cz.vut.fit.txtdirect.resolver;

import cz.vut.fit.txtdirect.exceptions.DnsResolutionException;
import cz.vut.fit.txtdirect.http.RequestScope;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Queries the TXT records published under a zone.
 */
public interface TxtLookup {
    /**
     * Looks up the TXT records of an absolute zone name. Blocks until an answer arrives, the request deadline
     * passes or the request is cancelled.
     *
     * @param zone  an absolute zone name, such as {@code _redirect.example.com.}
     * @param scope the lifetime of the request on whose behalf the lookup is made
     * @return one string per TXT resource record, never empty
     * @throws DnsResolutionException if the zone has no TXT records or the lookup fails
     */
    @NotNull
    List<String> lookup(@NotNull String zone, @NotNull RequestScope scope) throws DnsResolutionException;
}
