package cz.vut.fit.txtdirect.http;

import com.google.common.base.Splitter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A transport-independent view of an inbound HTTP request.
 *
 * @param method        The request method.
 * @param scheme        {@code http} or {@code https}.
 * @param host          The value of the Host header, including a port if present.
 * @param path          The raw (still percent-encoded) path.
 * @param query         The raw query string without the leading '?', or an empty string.
 * @param headers       Request headers; names are matched case-insensitively.
 * @param remoteAddress The address of the client.
 * @param body          The request body (empty for most redirect requests).
 * @param scope         The deadline and cancellation signal of the request.
 */
public record RedirectRequest(
        @NotNull String method,
        @NotNull String scheme,
        @NotNull String host,
        @NotNull String path,
        @NotNull String query,
        @NotNull Map<String, List<String>> headers,
        @NotNull String remoteAddress,
        byte @NotNull [] body,
        @NotNull RequestScope scope
) {
    public RedirectRequest {
        final var copy = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        headers = Collections.unmodifiableMap(copy);
    }

    /**
     * The first value of a header, or null if the header is missing.
     */
    @Nullable
    public String header(@NotNull String name) {
        final var values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    /**
     * The host without the port. IPv6 literals are returned without brackets.
     */
    @NotNull
    public String hostOnly() {
        if (host.startsWith("[")) {
            final var end = host.indexOf(']');
            return end > 0 ? host.substring(1, end) : host;
        }

        final var firstColon = host.indexOf(':');
        if (firstColon >= 0 && firstColon == host.lastIndexOf(':'))
            return host.substring(0, firstColon);

        return host;
    }

    /**
     * The port given in the Host header, or the scheme's default port.
     */
    @NotNull
    public String port() {
        int colon = -1;
        if (host.startsWith("[")) {
            final var end = host.indexOf(']');
            if (end > 0 && end + 1 < host.length() && host.charAt(end + 1) == ':')
                colon = end + 1;
        } else if (host.indexOf(':') == host.lastIndexOf(':')) {
            colon = host.indexOf(':');
        }

        if (colon >= 0 && colon < host.length() - 1)
            return host.substring(colon + 1);

        return "https".equals(scheme) ? "443" : "80";
    }

    /**
     * The first decoded value of a query parameter, or null if it is not present.
     */
    @Nullable
    public String queryParameter(@NotNull String key) {
        if (query.isEmpty())
            return null;

        for (var pair : Splitter.on('&').omitEmptyStrings().split(query)) {
            final var eq = pair.indexOf('=');
            final var name = decode(eq < 0 ? pair : pair.substring(0, eq));
            if (name.equals(key))
                return eq < 0 ? "" : decode(pair.substring(eq + 1));
        }
        return null;
    }

    /**
     * The value of a cookie sent with the request, or null if it is not present.
     */
    @Nullable
    public String cookie(@NotNull String name) {
        final var values = headers.get("Cookie");
        if (values == null)
            return null;

        for (var header : values) {
            for (var pair : Splitter.on(';').trimResults().omitEmptyStrings().split(header)) {
                final var eq = pair.indexOf('=');
                if (eq > 0 && pair.substring(0, eq).equals(name))
                    return pair.substring(eq + 1);
            }
        }
        return null;
    }

    /**
     * The path followed by the query string, if any.
     */
    @NotNull
    public String uri() {
        return query.isEmpty() ? path : path + "?" + query;
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String _method = "GET";
        private String _scheme = "http";
        private String _host = "";
        private String _path = "/";
        private String _query = "";
        private final Map<String, List<String>> _headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private String _remoteAddress = "";
        private byte[] _body = new byte[0];
        private RequestScope _scope;

        private Builder() {
        }

        public Builder method(@NotNull String method) {
            _method = method;
            return this;
        }

        public Builder scheme(@NotNull String scheme) {
            _scheme = scheme;
            return this;
        }

        public Builder host(@NotNull String host) {
            _host = host;
            return this;
        }

        public Builder path(@NotNull String path) {
            _path = path.isEmpty() ? "/" : path;
            return this;
        }

        public Builder query(@Nullable String query) {
            _query = query == null ? "" : query;
            return this;
        }

        public Builder header(@NotNull String name, @NotNull String value) {
            _headers.computeIfAbsent(name, unused -> new ArrayList<>()).add(value);
            return this;
        }

        public Builder remoteAddress(@NotNull String remoteAddress) {
            _remoteAddress = remoteAddress;
            return this;
        }

        public Builder body(byte @NotNull [] body) {
            _body = body;
            return this;
        }

        public Builder scope(@NotNull RequestScope scope) {
            _scope = scope;
            return this;
        }

        public RedirectRequest build() {
            return new RedirectRequest(_method, _scheme, _host, _path, _query, _headers, _remoteAddress, _body,
                    _scope == null ? RequestScope.unbounded() : _scope);
        }
    }
}
