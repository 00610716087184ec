package cz.vut.fit.txtdirect.redirector.handlers;

import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.exceptions.TypeHandlerException;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.http.ResponseSink;
import cz.vut.fit.txtdirect.models.FallbackMode;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link ProxyForwarder} using the Vert.x HTTP client. Redirects returned by the upstream are passed to the
 * client, never followed.
 */
public class VertxProxyForwarder implements ProxyForwarder, AutoCloseable {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(VertxProxyForwarder.class);

    /**
     * Headers that apply to a single connection and are not forwarded in either direction.
     */
    static final Set<String> HOP_BY_HOP_HEADERS;

    static {
        final var headers = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        headers.addAll(Set.of("Connection", "Keep-Alive", "Proxy-Authenticate", "Proxy-Authorization", "TE",
                "Trailer", "Transfer-Encoding", "Upgrade", "Proxy-Connection"));
        HOP_BY_HOP_HEADERS = headers;
    }

    private final HttpClient _client;
    private final Duration _timeout;

    public VertxProxyForwarder(@NotNull Vertx vertx, @NotNull TxtDirectConfig config) {
        _timeout = config.proxyTimeout();
        final var timeoutMs = (int) _timeout.toMillis();
        final var options = new HttpClientOptions()
                .setMaxPoolSize(config.workers())
                .setIdleTimeoutUnit(TimeUnit.MILLISECONDS)
                .setIdleTimeout(timeoutMs)
                .setConnectTimeout(timeoutMs)
                .setReadIdleTimeout(timeoutMs)
                .setKeepAlive(true);
        _client = vertx.createHttpClient(options);
    }

    @Override
    public void forward(@NotNull ResponseSink sink, @NotNull RedirectRequest request, @NotNull RedirectRecord record)
            throws TypeHandlerException {
        final var target = targetUrl(request, record);
        Logger.info("{}{} > {}", request.host(), request.path(), target);

        final var options = new RequestOptions()
                .setFollowRedirects(false)
                .setTimeout(_timeout.toMillis());
        try {
            options.setMethod(HttpMethod.valueOf(request.method()))
                    .setAbsoluteURI(target);
        } catch (RuntimeException e) {
            throw error("cannot forward " + request.method() + " to " + target, e, record);
        }

        request.headers().forEach((name, values) -> {
            if (!HOP_BY_HOP_HEADERS.contains(name) && !name.equalsIgnoreCase("Host")
                    && !name.equalsIgnoreCase("Content-Length"))
                values.forEach(value -> options.addHeader(name, value));
        });
        options.putHeader("X-Forwarded-For", request.remoteAddress());
        options.putHeader("X-Forwarded-Host", request.host());
        options.putHeader("X-Forwarded-Proto", request.scheme());

        final var exchange = new Exchange();
        final CompletableFuture<UpstreamResponse> pending = _client.request(options)
                .compose(upstreamRequest -> {
                    if (!exchange.start(upstreamRequest))
                        return Future.failedFuture("request cancelled before it was sent");
                    return upstreamRequest.send(Buffer.buffer(request.body()));
                })
                .compose(response -> response.body()
                        .map(body -> new UpstreamResponse(response.statusCode(), response.headers(), body)))
                .toCompletionStage()
                .toCompletableFuture();

        final var scope = request.scope();
        final var wait = scope.remaining().compareTo(_timeout) < 0 ? scope.remaining() : _timeout;
        try {
            CompletableFuture.anyOf(pending, scope.cancellation()).get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            exchange.abort();
            throw error("upstream " + target + " timed out", e, record);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exchange.abort();
            throw error("interrupted while forwarding to " + target, e, record);
        } catch (ExecutionException e) {
            throw error("forwarding to " + target + " failed: " + e.getCause().getMessage(), e.getCause(), record);
        }

        if (!pending.isDone()) {
            exchange.abort();
            throw error("request cancelled while forwarding to " + target, null, record);
        }

        final var response = pending.join();
        response.headers().forEach(entry -> {
            final var name = entry.getKey();
            if (!HOP_BY_HOP_HEADERS.contains(name) && !name.equalsIgnoreCase("Content-Length"))
                sink.addHeader(name, entry.getValue());
        });

        final var body = response.body();
        sink.send(response.status(), body == null ? new byte[0] : body.getBytes());
    }

    private record UpstreamResponse(int status, MultiMap headers, Buffer body) {
    }

    /**
     * The outgoing request of one forward. Aborting resets the request, which closes its connection, so the
     * upstream stops working on an answer nobody reads.
     */
    private static class Exchange {
        private final AtomicReference<HttpClientRequest> _request = new AtomicReference<>();
        private final AtomicBoolean _aborted = new AtomicBoolean();

        /**
         * @return false if the exchange was aborted before the request was created; the request is reset then
         */
        boolean start(HttpClientRequest request) {
            _request.set(request);
            if (_aborted.get()) {
                request.reset();
                return false;
            }
            return true;
        }

        void abort() {
            _aborted.set(true);
            final var request = _request.get();
            if (request != null && request.reset())
                Logger.debug("Reset upstream request to {}", request.absoluteURI());
        }
    }

    /**
     * The URL the request is sent to: the request path is appended when {@code to=} has no path of its own and
     * the request query is appended to the query of {@code to=}.
     */
    static String targetUrl(RedirectRequest request, RedirectRecord record) throws TypeHandlerException {
        final URI to;
        try {
            to = new URI(record.to());
        } catch (URISyntaxException e) {
            throw error("invalid proxy target " + record.to(), e, record);
        }
        if (!to.isAbsolute() || to.getRawAuthority() == null)
            throw error("proxy target is not absolute: " + record.to(), null, record);

        final var builder = new StringBuilder()
                .append(to.getScheme()).append("://").append(to.getRawAuthority());

        final var path = to.getRawPath();
        builder.append(path == null || path.isEmpty() || path.equals("/") ? request.path() : path);

        final var query = to.getRawQuery();
        if (query != null && !query.isEmpty()) {
            builder.append('?').append(query);
            if (!request.query().isEmpty())
                builder.append('&').append(request.query());
        } else if (!request.query().isEmpty()) {
            builder.append('?').append(request.query());
        }

        return builder.toString();
    }

    private static TypeHandlerException error(String message, Throwable cause, RedirectRecord record) {
        return new TypeHandlerException(message, cause, FallbackMode.TO, record.code());
    }

    @Override
    public void close() {
        _client.close();
    }
}
