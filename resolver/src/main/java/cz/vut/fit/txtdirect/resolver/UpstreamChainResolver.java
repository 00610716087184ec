package cz.vut.fit.txtdirect.resolver;

import cz.vut.fit.txtdirect.exceptions.TxtDirectException;
import cz.vut.fit.txtdirect.exceptions.UpstreamExhaustedException;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import cz.vut.fit.txtdirect.models.ResolutionContext;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

/**
 * Follows the {@code use=} directives of a record. The zones are tried in declaration order and the first one
 * that resolves wins; a failure of the chosen record later on does not cause the next zone to be tried.
 */
public class UpstreamChainResolver {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(UpstreamChainResolver.class);

    /**
     * The result of following a record's upstream zones.
     *
     * @param record The record published in the upstream zone.
     * @param zone   The zone the record was found in.
     */
    public record UpstreamResolution(@NotNull RedirectRecord record, @NotNull String zone) {
    }

    private final ZoneResolver _zoneResolver;

    public UpstreamChainResolver(@NotNull ZoneResolver zoneResolver) {
        _zoneResolver = zoneResolver;
    }

    /**
     * Resolves the upstream record of a record. Only a single hop is followed: the returned record is not
     * itself checked for {@code use=} directives. On success the upstream zone suffix (the zone name without
     * its first label) is stored in the context.
     *
     * @param record  a record with at least one {@code use=} directive
     * @param request the request being answered
     * @param context the resolution context of the request
     * @return the upstream record and its zone
     * @throws UpstreamExhaustedException if none of the zones resolved
     */
    @NotNull
    public UpstreamResolution resolveUpstream(@NotNull RedirectRecord record, @NotNull RedirectRequest request,
                                              @NotNull ResolutionContext context)
            throws UpstreamExhaustedException {
        TxtDirectException lastError = null;

        for (var zone : record.use()) {
            try {
                final var upstream = _zoneResolver.resolve(zone, request, context);
                context.setUpstreamZone(Hosts.stripFirstLabel(zone));
                Logger.debug("Resolved upstream zone {}", zone);
                return new UpstreamResolution(upstream, zone);
            } catch (TxtDirectException e) {
                Logger.debug("Upstream zone {} failed: {}", zone, e.getMessage());
                lastError = e;
            }
        }

        throw new UpstreamExhaustedException("Couldn't find any records from upstream", lastError);
    }
}
