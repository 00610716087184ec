package cz.vut.fit.txtdirect;

/**
 * Property keys, descriptions and default values understood by the redirector.
 */
public class RedirectorConfig {
    /* --- Record types and fallback --- */
    public static final String ENABLE_CONFIG = "txtdirect.enable";
    public static final String ENABLE_DOC = "The record types that may be served (comma-separated).";
    public static final String ENABLE_DEFAULT = "host,path,gometa,dockerv2";

    public static final String REDIRECT_CONFIG = "txtdirect.redirect";
    public static final String REDIRECT_DOC = "The URL used by the global fallback. If empty, the global fallback responds with 404.";
    public static final String REDIRECT_DEFAULT = "";

    /* --- DNS --- */
    public static final String RESOLVER_CONFIG = "txtdirect.resolver";
    public static final String RESOLVER_DOC = "Addresses (ip[:port]) of the DNS resolvers to query (comma-separated). If empty, the system resolvers are used.";
    public static final String RESOLVER_DEFAULT = "";

    public static final String RESOLVER_TIMEOUT_MS_CONFIG = "txtdirect.resolver.timeout";
    public static final String RESOLVER_TIMEOUT_MS_DOC = "The timeout for a DNS query made against one of the configured resolvers (milliseconds).";
    public static final String RESOLVER_TIMEOUT_MS_DEFAULT = "3000";

    public static final String RESOLVER_RETRIES_CONFIG = "txtdirect.resolver.retries";
    public static final String RESOLVER_RETRIES_DOC = "The number of attempts to query a single DNS server until the next one is used.";
    public static final String RESOLVER_RETRIES_DEFAULT = "1";

    /* --- HTTP server --- */
    public static final String HTTP_HOST_CONFIG = "txtdirect.http.host";
    public static final String HTTP_HOST_DOC = "The address the HTTP server binds to.";
    public static final String HTTP_HOST_DEFAULT = "0.0.0.0";

    public static final String HTTP_PORT_CONFIG = "txtdirect.http.port";
    public static final String HTTP_PORT_DOC = "The port the HTTP server listens on.";
    public static final String HTTP_PORT_DEFAULT = "8080";

    public static final String REQUEST_TIMEOUT_MS_CONFIG = "txtdirect.request.timeout";
    public static final String REQUEST_TIMEOUT_MS_DOC = "The maximum time spent on resolving and answering a single request (milliseconds).";
    public static final String REQUEST_TIMEOUT_MS_DEFAULT = "10000";

    public static final String WORKERS_CONFIG = "txtdirect.workers";
    public static final String WORKERS_DOC = "The number of worker threads that resolve and dispatch requests.";
    public static final String WORKERS_DEFAULT = "32";

    /* --- Proxy --- */
    public static final String PROXY_TIMEOUT_MS_CONFIG = "txtdirect.proxy.timeout";
    public static final String PROXY_TIMEOUT_MS_DOC = "The timeout for a request forwarded by a proxy record (milliseconds).";
    public static final String PROXY_TIMEOUT_MS_DEFAULT = "30000";

    /* --- Go modules --- */
    public static final String GOMODS_ENABLE_CONFIG = "txtdirect.gomods.enable";
    public static final String GOMODS_ENABLE_DOC = "If true, gomods records are answered by redirecting to the upstream module proxy.";
    public static final String GOMODS_ENABLE_DEFAULT = "false";

    public static final String GOMODS_UPSTREAM_CONFIG = "txtdirect.gomods.upstream";
    public static final String GOMODS_UPSTREAM_DOC = "The base URL of the upstream Go module proxy.";
    public static final String GOMODS_UPSTREAM_DEFAULT = "https://proxy.golang.org";

    /* --- Metrics --- */
    public static final String METRICS_ENABLE_CONFIG = "txtdirect.metrics.enable";
    public static final String METRICS_ENABLE_DOC = "If true, request counters are recorded.";
    public static final String METRICS_ENABLE_DEFAULT = "false";
}
