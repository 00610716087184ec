package cz.vut.fit.txtdirect.redirector;

import cz.vut.fit.txtdirect.Common;
import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.exceptions.RecordPolicyException;
import cz.vut.fit.txtdirect.exceptions.TxtDirectException;
import cz.vut.fit.txtdirect.exceptions.TypeHandlerException;
import cz.vut.fit.txtdirect.exceptions.UnsupportedTypeException;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.http.ResponseSink;
import cz.vut.fit.txtdirect.models.FallbackMode;
import cz.vut.fit.txtdirect.models.RecordType;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import cz.vut.fit.txtdirect.models.ResolutionContext;
import cz.vut.fit.txtdirect.redirector.handlers.DockerV2Handler;
import cz.vut.fit.txtdirect.redirector.handlers.GoMetaHandler;
import cz.vut.fit.txtdirect.redirector.handlers.GoModsHandler;
import cz.vut.fit.txtdirect.redirector.handlers.PathZoneMapper;
import cz.vut.fit.txtdirect.redirector.handlers.ProxyForwarder;
import cz.vut.fit.txtdirect.redirector.metrics.MetricsRecorder;
import cz.vut.fit.txtdirect.resolver.DirectiveParser;
import cz.vut.fit.txtdirect.resolver.Hosts;
import cz.vut.fit.txtdirect.resolver.TxtLookup;
import cz.vut.fit.txtdirect.resolver.UpstreamChainResolver;
import cz.vut.fit.txtdirect.resolver.ZoneResolver;
import cz.vut.fit.txtdirect.resolver.placeholders.PlaceholderExpander;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Answers a single request: resolves the record of the requested host, follows its upstream and path hops and
 * hands the final record to the handler of its type. Every failure ends in exactly one fallback response;
 * nothing is thrown to the transport layer.
 */
public class RedirectDispatcher {
    public static final String COMPONENT_NAME = "dispatcher";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(RedirectDispatcher.class);

    /**
     * Paths answered with 404 without any lookup.
     */
    public static final Set<String> BLACKLISTED_PATHS = Set.of("/favicon.ico");

    /**
     * The max-age of permanent redirects, one week.
     */
    public static final int PERMANENT_CACHE_MAX_AGE = 604800;

    private final TxtDirectConfig _config;
    private final ZoneResolver _zoneResolver;
    private final UpstreamChainResolver _upstreamResolver;
    private final PlaceholderExpander _expander;
    private final FallbackPolicy _fallback;
    private final PathZoneMapper _pathMapper;
    private final ProxyForwarder _proxy;
    private final DockerV2Handler _docker;
    private final GoMetaHandler _goMeta;
    private final GoModsHandler _goMods;
    private final MetricsRecorder _metrics;

    public RedirectDispatcher(@NotNull TxtDirectConfig config,
                              @NotNull ZoneResolver zoneResolver,
                              @NotNull UpstreamChainResolver upstreamResolver,
                              @NotNull PlaceholderExpander expander,
                              @NotNull FallbackPolicy fallback,
                              @NotNull PathZoneMapper pathMapper,
                              @NotNull ProxyForwarder proxy,
                              @NotNull DockerV2Handler docker,
                              @NotNull GoMetaHandler goMeta,
                              @NotNull GoModsHandler goMods,
                              @NotNull MetricsRecorder metrics) {
        _config = config;
        _zoneResolver = zoneResolver;
        _upstreamResolver = upstreamResolver;
        _expander = expander;
        _fallback = fallback;
        _pathMapper = pathMapper;
        _proxy = proxy;
        _docker = docker;
        _goMeta = goMeta;
        _goMods = goMods;
        _metrics = metrics;
    }

    /**
     * Wires a dispatcher with the default parser, resolvers, fallback policy and type handlers.
     *
     * @param config  the configuration
     * @param lookup  the TXT lookup used by all resolvers
     * @param proxy   the forwarder used by proxy records
     * @param metrics the recorder of request counters
     */
    @NotNull
    public static RedirectDispatcher create(@NotNull TxtDirectConfig config, @NotNull TxtLookup lookup,
                                            @NotNull ProxyForwarder proxy, @NotNull MetricsRecorder metrics) {
        final var expander = new PlaceholderExpander();
        final var zoneResolver = new ZoneResolver(lookup, new DirectiveParser(config, expander));

        return new RedirectDispatcher(config, zoneResolver, new UpstreamChainResolver(zoneResolver), expander,
                new DefaultFallbackPolicy(config), new PathZoneMapper(), proxy,
                new DockerV2Handler(Common.makeMapper().build()), new GoMetaHandler(), new GoModsHandler(config),
                metrics);
    }

    /**
     * Answers a request. When this method returns, the sink has been committed.
     */
    public void dispatch(@NotNull RedirectRequest request, @NotNull ResponseSink sink) {
        sink.setHeader(ResponseSink.SERVER_HEADER, ResponseSink.SERVER_NAME);
        final var host = request.host();
        final var context = new ResolutionContext();

        try {
            if (BLACKLISTED_PATHS.contains(request.path())) {
                Logger.info("{}{} > blacklisted", host, request.path());
                sink.setHeader(ResponseSink.STATUS_CODE_HEADER, "404");
                sink.send(404, new byte[0]);
                return;
            }

            if (Hosts.isIP(host)) {
                Logger.info("{} is an IP address, fallback triggered", host);
                _fallback.fallback(sink, request, context, FallbackMode.GLOBAL, TxtDirectException.MOVED_PERMANENTLY);
                return;
            }

            final var record = resolve(host, request, context, sink);
            dispatchRecord(record, request, context, sink, false);
        } catch (TxtDirectException e) {
            Logger.info("{}{}: {}, using {} fallback", host, request.path(), e.getMessage(), e.fallbackMode());
            fallback(sink, request, context, e.fallbackMode(), e.fallbackCode());
        } catch (RuntimeException e) {
            Logger.error("Unexpected error while dispatching {}{}", host, request.path(), e);
            fallback(sink, request, context, FallbackMode.GLOBAL, TxtDirectException.FOUND);
        } finally {
            if (sink.isCommitted())
                _metrics.responseByStatus(host, sink.status());
        }
    }

    /**
     * Resolves the record of a host and, if it points to upstream zones, the upstream record.
     */
    private RedirectRecord resolve(String host, RedirectRequest request, ResolutionContext context,
                                   ResponseSink sink) throws TxtDirectException {
        var record = _zoneResolver.resolve(host, request, context);
        context.headers().forEach(sink::setHeader);

        if (record.hasUpstream()) {
            record = _upstreamResolver.resolveUpstream(record, request, context).record();
            context.headers().forEach(sink::setHeader);
        }
        return record;
    }

    private void dispatchRecord(RedirectRecord record, RedirectRequest request, ResolutionContext context,
                                ResponseSink sink, boolean pathHop) throws TxtDirectException {
        final var host = request.host();
        final var path = request.path();

        if (!record.from().isEmpty() && !record.re().isEmpty())
            throw new RecordPolicyException("It's not allowed to use both re= and from= in a record",
                    FallbackMode.TO, record.code());

        final var type = record.type();
        if (type == RecordType.UNSUPPORTED)
            throw new UnsupportedTypeException(record.typeName());
        if (!_config.isEnabled(type))
            throw new RecordPolicyException("option disabled: " + record.typeName());

        _metrics.requestByType(host, type.tag());

        switch (type) {
            case HOST -> redirect(sink, request, record, _expander.expand(record.to(), request, context));
            case PATH -> {
                if (pathHop)
                    throw new TypeHandlerException("a path record cannot point to another path record",
                            FallbackMode.TO, record.code());
                _metrics.pathRedirect(host, path);

                if ("/".equals(path)) {
                    if (record.root().isEmpty())
                        throw new TypeHandlerException("path record has no root= target", FallbackMode.TO,
                                record.code());
                    redirect(sink, request, record, record.root());
                    return;
                }

                final var mapping = _pathMapper.map(path, record);
                context.setPathMapping(mapping.captures(), mapping.remainder());

                final RedirectRecord finalRecord;
                try {
                    finalRecord = resolve(mapping.zone(host), request, context, sink);
                } catch (TxtDirectException e) {
                    throw new TypeHandlerException("could not resolve the path record: " + e.getMessage(), e,
                            FallbackMode.TO, record.code());
                }
                dispatchRecord(finalRecord, request, context, sink, true);
            }
            case PROXY -> _proxy.forward(sink, request, record);
            case DOCKERV2 -> {
                if (!DockerV2Handler.isDockerClient(request))
                    throw new TypeHandlerException("the request is not from a docker client", FallbackMode.TO,
                            record.code());
                _docker.handle(sink, request, record, context);
            }
            case GOMETA -> {
                if (!GoMetaHandler.isGoGet(request))
                    throw new TypeHandlerException("the request is not from go get", FallbackMode.WEBSITE,
                            TxtDirectException.FOUND);
                _goMeta.render(sink, record, request.hostOnly(), path);
            }
            case GOMODS -> _goMods.handle(sink, host, path);
            default -> throw new UnsupportedTypeException(record.typeName());
        }
    }

    private void redirect(ResponseSink sink, RedirectRequest request, RedirectRecord record, String target) {
        final var code = record.code();
        Logger.info("{}{} > {}", request.host(), request.path(), target);

        if (code == TxtDirectException.MOVED_PERMANENTLY)
            sink.setHeader(ResponseSink.CACHE_CONTROL_HEADER, "max-age=" + PERMANENT_CACHE_MAX_AGE);
        if (record.ref())
            sink.setHeader(ResponseSink.REFERER_HEADER, request.host());

        sink.setHeader(ResponseSink.STATUS_CODE_HEADER, Integer.toString(code));
        sink.redirect(target, code);
    }

    private void fallback(ResponseSink sink, RedirectRequest request, ResolutionContext context,
                          FallbackMode mode, int code) {
        if (sink.isCommitted()) {
            Logger.debug("Response for {}{} already committed", request.host(), request.path());
            return;
        }

        try {
            _fallback.fallback(sink, request, context, mode, code);
        } catch (RuntimeException e) {
            Logger.error("Fallback failed for {}{}", request.host(), request.path(), e);
            if (!sink.isCommitted())
                sink.send(500, "500 internal server error\n".getBytes(StandardCharsets.UTF_8));
        }
    }
}
