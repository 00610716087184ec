package cz.vut.fit.txtdirect.redirector;

import cz.vut.fit.txtdirect.Common;
import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.http.BufferedResponseSink;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.http.RequestScope;
import cz.vut.fit.txtdirect.http.ResponseSink;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.TimeUnit;

/**
 * The HTTP front end. Requests are read on the event loop and dispatched on a pool of worker threads, since
 * DNS lookups and proxied calls block. A request is cancelled when its connection closes before the response
 * is written.
 */
public class RedirectServer implements AutoCloseable {
    public static final String COMPONENT_NAME = "server";
    private static final org.slf4j.Logger Logger = Common.getComponentLogger(RedirectServer.class);

    private final Vertx _vertx;
    private final TxtDirectConfig _config;
    private final RedirectDispatcher _dispatcher;
    private final WorkerExecutor _workers;
    private HttpServer _server;

    public RedirectServer(@NotNull Vertx vertx, @NotNull TxtDirectConfig config,
                          @NotNull RedirectDispatcher dispatcher) {
        _vertx = vertx;
        _config = config;
        _dispatcher = dispatcher;
        _workers = vertx.createSharedWorkerExecutor("txtdirect-dispatch", config.workers(),
                config.requestTimeout().toMillis() * 2, TimeUnit.MILLISECONDS);
    }

    /**
     * Starts listening.
     *
     * @return a future completed with the actual port once the server is listening
     */
    public Future<Integer> start() {
        final var options = new HttpServerOptions()
                .setHost(_config.httpHost())
                .setPort(_config.httpPort());

        return _vertx.createHttpServer(options)
                .requestHandler(this::handle)
                .listen()
                .map(server -> {
                    _server = server;
                    Logger.info("Listening on {}:{}", _config.httpHost(), server.actualPort());
                    return server.actualPort();
                });
    }

    private void handle(HttpServerRequest request) {
        final var scope = RequestScope.withTimeout(_config.requestTimeout());
        final var response = request.response();
        response.closeHandler(unused -> {
            Logger.debug("Connection closed before {} was answered", request.uri());
            scope.cancel();
        });

        request.body()
                .compose(body -> _workers.executeBlocking(() -> {
                    final var sink = new BufferedResponseSink();
                    _dispatcher.dispatch(toRedirectRequest(request, body, scope), sink);
                    return sink;
                }, false))
                .onSuccess(sink -> write(response, sink))
                .onFailure(e -> {
                    Logger.error("Failed to answer {}", request.uri(), e);
                    if (!response.ended() && !response.closed())
                        response.setStatusCode(500).end();
                });
    }

    static RedirectRequest toRedirectRequest(HttpServerRequest request, Buffer body, RequestScope scope) {
        final var builder = RedirectRequest.builder()
                .method(request.method().name())
                .scheme(request.scheme() == null ? "http" : request.scheme())
                .host(request.host() == null ? "" : request.host())
                .path(request.path() == null ? "/" : request.path())
                .query(request.query())
                .remoteAddress(request.remoteAddress() == null ? "" : request.remoteAddress().hostAddress())
                .body(body == null ? new byte[0] : body.getBytes())
                .scope(scope);

        request.headers().forEach(entry -> builder.header(entry.getKey(), entry.getValue()));
        return builder.build();
    }

    /**
     * Copies the buffered response to the connection. A status or header that the connection refuses turns
     * the answer into an empty 500, so the client is never left waiting.
     */
    static void write(HttpServerResponse response, ResponseSink sink) {
        if (response.ended() || response.closed())
            return;

        try {
            // An uncommitted sink has status 0
            response.setStatusCode(sink.isCommitted() ? sink.status() : 500);
            sink.headers().forEach((name, values) -> response.headers().add(name, values));
            response.end(Buffer.buffer(sink.body()));
        } catch (RuntimeException e) {
            Logger.error("Cannot write response with status {}", sink.status(), e);
            if (response.ended() || response.closed())
                return;

            response.headers().clear();
            response.setStatusCode(500).end();
        }
    }

    @Override
    public void close() {
        if (_server != null) {
            _server.close().toCompletionStage().toCompletableFuture().join();
            _server = null;
        }
        _workers.close();
    }
}
