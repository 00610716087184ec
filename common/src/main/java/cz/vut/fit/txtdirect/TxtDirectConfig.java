package cz.vut.fit.txtdirect;

import com.google.common.base.Splitter;
import cz.vut.fit.txtdirect.models.RecordType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * The process-wide configuration. Built once at startup and only read afterwards, so a single instance is shared
 * by all requests.
 *
 * @param enabled           The record types that may be served.
 * @param redirect          The target of the global fallback; empty to respond with 404.
 * @param resolvers         Custom DNS resolvers (ip[:port]); empty to use the system resolvers.
 * @param resolverTimeout   The timeout of a single DNS query attempt.
 * @param resolverRetries   The number of attempts per resolver.
 * @param httpHost          The address the HTTP server binds to.
 * @param httpPort          The port the HTTP server listens on.
 * @param requestTimeout    The deadline of a single request.
 * @param workers           The number of threads that resolve and dispatch requests.
 * @param proxyTimeout      The timeout of a forwarded request.
 * @param gomods            The Go modules sub-configuration.
 * @param metrics           The metrics sub-configuration.
 */
public record TxtDirectConfig(
        @NotNull Set<RecordType> enabled,
        @NotNull String redirect,
        @NotNull List<String> resolvers,
        @NotNull Duration resolverTimeout,
        int resolverRetries,
        @NotNull String httpHost,
        int httpPort,
        @NotNull Duration requestTimeout,
        int workers,
        @NotNull Duration proxyTimeout,
        @NotNull Gomods gomods,
        @NotNull Metrics metrics
) {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(TxtDirectConfig.class);

    /**
     * @param enabled  If true, gomods records redirect to the upstream module proxy.
     * @param upstream The base URL of the upstream module proxy.
     */
    public record Gomods(boolean enabled, @NotNull String upstream) {
    }

    /**
     * @param enabled If true, request counters are recorded.
     */
    public record Metrics(boolean enabled) {
    }

    public TxtDirectConfig {
        final var enabledCopy = EnumSet.noneOf(RecordType.class);
        enabledCopy.addAll(enabled);
        enabledCopy.remove(RecordType.UNSUPPORTED);
        enabled = Collections.unmodifiableSet(enabledCopy);
        resolvers = List.copyOf(resolvers);
    }

    public boolean isEnabled(@Nullable RecordType type) {
        return type != null && enabled.contains(type);
    }

    /**
     * Reads the configuration from properties, using the defaults from {@link RedirectorConfig} for missing keys.
     *
     * @throws NumberFormatException if a numeric property has an invalid value
     */
    @NotNull
    public static TxtDirectConfig fromProperties(@NotNull Properties properties) {
        return new TxtDirectConfig(
                parseEnabled(properties.getProperty(RedirectorConfig.ENABLE_CONFIG, RedirectorConfig.ENABLE_DEFAULT)),
                properties.getProperty(RedirectorConfig.REDIRECT_CONFIG, RedirectorConfig.REDIRECT_DEFAULT).trim(),
                splitList(properties.getProperty(RedirectorConfig.RESOLVER_CONFIG, RedirectorConfig.RESOLVER_DEFAULT)),
                Duration.ofMillis(Long.parseLong(properties.getProperty(
                        RedirectorConfig.RESOLVER_TIMEOUT_MS_CONFIG, RedirectorConfig.RESOLVER_TIMEOUT_MS_DEFAULT))),
                Integer.parseInt(properties.getProperty(
                        RedirectorConfig.RESOLVER_RETRIES_CONFIG, RedirectorConfig.RESOLVER_RETRIES_DEFAULT)),
                properties.getProperty(RedirectorConfig.HTTP_HOST_CONFIG, RedirectorConfig.HTTP_HOST_DEFAULT),
                Integer.parseInt(properties.getProperty(
                        RedirectorConfig.HTTP_PORT_CONFIG, RedirectorConfig.HTTP_PORT_DEFAULT)),
                Duration.ofMillis(Long.parseLong(properties.getProperty(
                        RedirectorConfig.REQUEST_TIMEOUT_MS_CONFIG, RedirectorConfig.REQUEST_TIMEOUT_MS_DEFAULT))),
                Integer.parseInt(properties.getProperty(
                        RedirectorConfig.WORKERS_CONFIG, RedirectorConfig.WORKERS_DEFAULT)),
                Duration.ofMillis(Long.parseLong(properties.getProperty(
                        RedirectorConfig.PROXY_TIMEOUT_MS_CONFIG, RedirectorConfig.PROXY_TIMEOUT_MS_DEFAULT))),
                new Gomods(
                        Boolean.parseBoolean(properties.getProperty(
                                RedirectorConfig.GOMODS_ENABLE_CONFIG, RedirectorConfig.GOMODS_ENABLE_DEFAULT)),
                        properties.getProperty(
                                RedirectorConfig.GOMODS_UPSTREAM_CONFIG, RedirectorConfig.GOMODS_UPSTREAM_DEFAULT)),
                new Metrics(Boolean.parseBoolean(properties.getProperty(
                        RedirectorConfig.METRICS_ENABLE_CONFIG, RedirectorConfig.METRICS_ENABLE_DEFAULT)))
        );
    }

    /**
     * A configuration with default values and the given enabled types. Mostly useful in tests.
     */
    @NotNull
    public static TxtDirectConfig withEnabled(@NotNull Set<RecordType> enabled, @NotNull String redirect) {
        final var defaults = fromProperties(new Properties());
        return new TxtDirectConfig(enabled, redirect, defaults.resolvers, defaults.resolverTimeout,
                defaults.resolverRetries, defaults.httpHost, defaults.httpPort, defaults.requestTimeout,
                defaults.workers, defaults.proxyTimeout, defaults.gomods, defaults.metrics);
    }

    private static Set<RecordType> parseEnabled(String value) {
        final var result = EnumSet.noneOf(RecordType.class);
        for (var tag : splitList(value)) {
            final var type = RecordType.fromTag(tag);
            if (type == null || type == RecordType.UNSUPPORTED) {
                Logger.warn("Ignoring unknown record type in {}: {}", RedirectorConfig.ENABLE_CONFIG, tag);
                continue;
            }
            result.add(type);
        }
        return result;
    }

    private static List<String> splitList(String value) {
        return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(value);
    }
}
