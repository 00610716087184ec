package cz.vut.fit.txtdirect.redirector.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import cz.vut.fit.txtdirect.exceptions.TypeHandlerException;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.http.ResponseSink;
import cz.vut.fit.txtdirect.models.FallbackMode;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import cz.vut.fit.txtdirect.models.ResolutionContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * Redirects Docker Registry HTTP API v2 requests to the registry named by the record.
 * <p>
 * The version check endpoint {@code /v2/} is answered directly. For {@code /v2/<name>/<endpoint>}, the image
 * is taken from the path of {@code to=} (an optional {@code :tag} replaces the reference of manifest requests);
 * when {@code to=} has no path, the requested name is used, prefixed with the host labels in front of the
 * upstream zone.
 */
public class DockerV2Handler {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(DockerV2Handler.class);

    public static final String API_VERSION_HEADER = "Docker-Distribution-API-Version";
    public static final String API_VERSION = "registry/2.0";
    public static final String CLIENT_USER_AGENT = "Docker-Client";

    private static final String API_PREFIX = "/v2/";
    private static final List<String> ENDPOINTS = List.of("/manifests/", "/blobs/", "/tags/");

    private final ObjectMapper _mapper;

    public DockerV2Handler(@NotNull ObjectMapper mapper) {
        _mapper = mapper;
    }

    /**
     * Checks whether a request comes from the Docker client.
     */
    public static boolean isDockerClient(@NotNull RedirectRequest request) {
        final var userAgent = request.header("User-Agent");
        return userAgent != null && userAgent.contains(CLIENT_USER_AGENT);
    }

    public void handle(@NotNull ResponseSink sink, @NotNull RedirectRequest request, @NotNull RedirectRecord record,
                       @NotNull ResolutionContext context) throws TypeHandlerException {
        final var path = request.path();
        if (path.equals(API_PREFIX) || path.equals("/v2")) {
            sink.setHeader(API_VERSION_HEADER, API_VERSION);
            sink.setHeader(ResponseSink.CONTENT_TYPE_HEADER, "application/json");
            try {
                sink.send(200, _mapper.writeValueAsBytes(_mapper.createObjectNode()));
            } catch (JsonProcessingException e) {
                throw error("cannot serialize the version check response", e, record);
            }
            return;
        }

        if (!path.startsWith(API_PREFIX))
            throw error("not a registry API path: " + path, null, record);

        final var endpoint = findEndpoint(path);
        if (endpoint < 0)
            throw error("unknown registry endpoint: " + path, null, record);

        final var name = path.substring(API_PREFIX.length(), endpoint);
        var rest = path.substring(endpoint);

        final URI target;
        try {
            target = new URI(record.to());
        } catch (URISyntaxException e) {
            throw error("invalid registry target: " + record.to(), e, record);
        }
        if (target.getScheme() == null || target.getRawAuthority() == null)
            throw error("registry target is not absolute: " + record.to(), null, record);

        var image = target.getRawPath() == null ? "" : CharMatcher.is('/').trimFrom(target.getRawPath());
        String tag = null;
        if (image.isEmpty()) {
            image = imageFromHost(request.hostOnly(), context.upstreamZone(), name);
        } else {
            final var colon = image.lastIndexOf(':');
            if (colon > image.lastIndexOf('/')) {
                tag = image.substring(colon + 1);
                image = image.substring(0, colon);
            }
        }

        if (tag != null && rest.startsWith("/manifests/"))
            rest = "/manifests/" + tag;

        final var location = target.getScheme() + "://" + target.getRawAuthority() + API_PREFIX + image + rest;
        Logger.info("{}{} > {}", request.host(), path, location);

        sink.setHeader(ResponseSink.STATUS_CODE_HEADER, Integer.toString(record.code()));
        sink.redirect(location, record.code());
    }

    private static int findEndpoint(String path) {
        var found = -1;
        for (var endpoint : ENDPOINTS) {
            found = Math.max(found, path.lastIndexOf(endpoint));
        }
        return found >= API_PREFIX.length() ? found : -1;
    }

    /**
     * Prefixes the requested image name with the labels of the host that precede the upstream zone, e.g.
     * {@code tools.registry.example.com} with the upstream zone {@code registry.example.com} maps {@code app}
     * to {@code tools/app}.
     */
    static String imageFromHost(String host, @Nullable String upstreamZone, String name) {
        if (upstreamZone == null || upstreamZone.isEmpty())
            return name;

        final var suffix = "." + CharMatcher.is('.').trimTrailingFrom(upstreamZone);
        if (!host.endsWith(suffix))
            return name;

        final var prefix = host.substring(0, host.length() - suffix.length());
        if (prefix.isEmpty())
            return name;

        return String.join("/", Splitter.on('.').splitToList(prefix)) + "/" + name;
    }

    private static TypeHandlerException error(String message, @Nullable Throwable cause, RedirectRecord record) {
        return new TypeHandlerException(message, cause, FallbackMode.TO, record.code());
    }
}
