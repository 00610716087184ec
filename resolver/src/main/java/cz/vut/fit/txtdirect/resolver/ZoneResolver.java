package cz.vut.fit.txtdirect.resolver;

import cz.vut.fit.txtdirect.exceptions.DnsResolutionException;
import cz.vut.fit.txtdirect.exceptions.TxtDirectException;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import cz.vut.fit.txtdirect.models.ResolutionContext;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Finds and parses the redirect record of a host. Three zones are tried in order:
 * <ol>
 *     <li>the apex zone {@code _redirect.<host>},</li>
 *     <li>the {@code _} sub-zone {@code _redirect._.<host>}, only if no record has been resolved for the
 *     request yet,</li>
 *     <li>the wildcard zone, with the leftmost label of the host replaced by {@code _}.</li>
 * </ol>
 * The first zone that answers is used; it has to publish exactly one TXT record.
 */
public class ZoneResolver {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(ZoneResolver.class);

    private final TxtLookup _lookup;
    private final DirectiveParser _parser;

    public ZoneResolver(@NotNull TxtLookup lookup, @NotNull DirectiveParser parser) {
        _lookup = lookup;
        _parser = parser;
    }

    /**
     * Resolves the record of a host and appends it to the resolution context.
     *
     * @param host    the host (a port is ignored) or an upstream zone name
     * @param request the request being answered
     * @param context the resolution context of the request
     * @return the parsed record
     * @throws DnsResolutionException if no zone answered with exactly one record
     * @throws TxtDirectException     if the record could not be parsed or may not be served
     */
    @NotNull
    public RedirectRecord resolve(@NotNull String host, @NotNull RedirectRequest request,
                                  @NotNull ResolutionContext context) throws TxtDirectException {
        final var name = Hosts.stripPort(host);
        final var answers = query(name, request, context);

        if (answers.size() != 1)
            throw new DnsResolutionException("could not parse TXT record with " + answers.size() + " records");

        final var record = _parser.parse(answers.get(0), request, context);
        context.addRecord(record);
        return record;
    }

    private List<String> query(String name, RedirectRequest request, ResolutionContext context)
            throws DnsResolutionException {
        try {
            return lookup(name, request);
        } catch (DnsResolutionException e) {
            Logger.debug("Initial DNS query failed: {}", e.getMessage());
        }

        if (!context.hasRecords()) {
            try {
                return lookup("_." + name, request);
            } catch (DnsResolutionException e) {
                Logger.debug("Apex zone's wildcard DNS query failed: {}", e.getMessage());
            }
        }

        try {
            return lookup(Hosts.wildcard(name), request);
        } catch (DnsResolutionException e) {
            Logger.info("Wildcard DNS query failed: {}", e.getMessage());
            throw e;
        }
    }

    private List<String> lookup(String name, RedirectRequest request) throws DnsResolutionException {
        final var scope = request.scope();
        if (scope.isCancelled())
            throw new DnsResolutionException("request cancelled");
        if (scope.isExpired())
            throw new DnsResolutionException("request deadline exceeded");

        final var answers = _lookup.lookup(Hosts.absoluteZone(name), scope);
        if (answers.isEmpty() || answers.get(0).isEmpty())
            throw new DnsResolutionException("TXT record doesn't exist or is empty");

        return answers;
    }
}
