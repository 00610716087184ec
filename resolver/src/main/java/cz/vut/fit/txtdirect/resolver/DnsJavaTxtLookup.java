package cz.vut.fit.txtdirect.resolver;

import com.google.common.net.HostAndPort;
import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.exceptions.DnsResolutionException;
import cz.vut.fit.txtdirect.http.RequestScope;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.SimpleResolver;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;
import org.xbill.DNS.lookup.LookupResult;
import org.xbill.DNS.lookup.LookupSession;
import org.xbill.DNS.lookup.NoSuchDomainException;
import org.xbill.DNS.lookup.NoSuchRRSetException;

import java.io.ByteArrayOutputStream;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * A {@link TxtLookup} backed by dnsjava. Queries either the configured resolvers or, if none are configured,
 * the resolvers of the system. No answer cache is used, every lookup goes to the network.
 */
public class DnsJavaTxtLookup implements TxtLookup {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(DnsJavaTxtLookup.class);

    private static final int DEFAULT_DNS_PORT = 53;

    private final Resolver _resolver;
    private final Executor _executor;
    // Present when the resolver was built here, so a shorter-lived copy can be made for a nearly expired request
    private final @Nullable TxtDirectConfig _config;

    public DnsJavaTxtLookup(@NotNull Resolver resolver, @NotNull Executor executor) {
        _resolver = resolver;
        _executor = executor;
        _config = null;
    }

    public DnsJavaTxtLookup(@NotNull TxtDirectConfig config, @NotNull Executor executor) throws UnknownHostException {
        _resolver = makeResolver(config);
        _executor = executor;
        _config = config;
    }

    /**
     * Creates the resolver used for all TXT queries.
     *
     * @param config the configuration with the resolver addresses, timeout and retry count
     * @return an {@link ExtendedResolver} over the configured servers, or over the system servers if there are none
     * @throws UnknownHostException if a configured resolver address cannot be resolved
     */
    public static ExtendedResolver makeResolver(@NotNull TxtDirectConfig config) throws UnknownHostException {
        return makeResolver(config, null);
    }

    /**
     * Creates a resolver whose queries give up no later than the given budget.
     *
     * @param config the configuration with the resolver addresses, timeout and retry count
     * @param budget the upper bound of both the per-server and the overall timeout, or null for no bound
     * @return an {@link ExtendedResolver} over the configured servers, or over the system servers if there are none
     * @throws UnknownHostException if a configured resolver address cannot be resolved
     */
    public static ExtendedResolver makeResolver(@NotNull TxtDirectConfig config, @Nullable Duration budget)
            throws UnknownHostException {
        final var servers = config.resolvers();
        final ExtendedResolver resolver;

        if (servers.isEmpty()) {
            resolver = new ExtendedResolver();
        } else {
            final var simpleResolvers = new ArrayList<Resolver>(servers.size());
            for (var server : servers) {
                final HostAndPort hostAndPort;
                try {
                    hostAndPort = HostAndPort.fromString(server).withDefaultPort(DEFAULT_DNS_PORT);
                } catch (IllegalArgumentException e) {
                    throw new UnknownHostException("Invalid resolver address: " + server);
                }

                final var simpleResolver = new SimpleResolver(hostAndPort.getHost());
                simpleResolver.setPort(hostAndPort.getPort());
                simpleResolvers.add(simpleResolver);
            }
            resolver = new ExtendedResolver(simpleResolvers);
        }

        final var retries = Math.max(1, config.resolverRetries());
        var timeoutForEach = config.resolverTimeout();
        var timeout = timeoutForEach.multipliedBy((long) resolver.getResolvers().length * retries);
        if (budget != null) {
            timeoutForEach = min(timeoutForEach, budget);
            timeout = min(timeout, budget);
        }

        for (var inResolver : resolver.getResolvers()) {
            inResolver.setTimeout(timeoutForEach);
        }

        resolver.setRetries(retries);
        resolver.setTimeout(timeout);
        resolver.setLoadBalance(false);

        return resolver;
    }

    @Override
    public @NotNull List<String> lookup(@NotNull String zone, @NotNull RequestScope scope)
            throws DnsResolutionException {
        final Name name;
        try {
            name = Name.fromString(zone);
        } catch (TextParseException e) {
            throw new DnsResolutionException("Invalid zone name: " + zone, e);
        }

        if (scope.isCancelled() || scope.isExpired())
            throw new DnsResolutionException("Request ended before resolving " + zone);

        final var lookup = getLookupSession(scope.remaining()).lookupAsync(name, Type.TXT).toCompletableFuture();
        try {
            CompletableFuture.anyOf(lookup, scope.cancellation())
                    .get(scope.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            throw new DnsResolutionException("TXT lookup timed out for " + zone, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lookup.cancel(true);
            throw new DnsResolutionException("Interrupted while resolving " + zone, e);
        } catch (ExecutionException e) {
            // The failed lookup is inspected below
            Logger.trace("TXT lookup for {} completed exceptionally", zone);
        }

        if (!lookup.isDone()) {
            lookup.cancel(true);
            throw new DnsResolutionException("Request cancelled while resolving " + zone);
        }

        final LookupResult result;
        try {
            result = lookup.join();
        } catch (CompletionException e) {
            throw translate(zone, e.getCause());
        }

        final var answers = txtAnswers(result.getRecords());
        if (answers.isEmpty())
            throw new DnsResolutionException("No TXT records found for " + zone);

        return answers;
    }

    /**
     * Converts TXT resource records to answer strings. The character-strings of a single resource record are
     * concatenated, so every resource record yields one answer.
     */
    @NotNull
    static List<String> txtAnswers(@NotNull List<Record> records) {
        return records.stream()
                // Sanity check: you never know what the DNS returns
                .filter(record -> record.getType() == Type.TXT)
                .map(record -> joinRaw(((TXTRecord) record).getStringsAsByteArrays()))
                .collect(Collectors.toList());
    }

    /**
     * Joins the raw character-strings. {@link TXTRecord#getStrings()} returns the escaped presentation form,
     * which would turn a backslash into a double backslash and any non-ASCII byte into a decimal escape.
     */
    private static String joinRaw(List<byte[]> strings) {
        final var out = new ByteArrayOutputStream();
        for (final var string : strings)
            out.writeBytes(string);
        return out.toString(StandardCharsets.UTF_8);
    }

    private static DnsResolutionException translate(String zone, Throwable cause) {
        if (cause instanceof NoSuchDomainException) {
            return new DnsResolutionException("No such domain: " + zone, cause);
        } else if (cause instanceof NoSuchRRSetException) {
            return new DnsResolutionException("No TXT records found for " + zone, cause);
        }

        Logger.debug("TXT lookup failed for {}", zone, cause);
        return new DnsResolutionException("Could not get TXT record for " + zone + ": " + cause.getMessage(), cause);
    }

    /**
     * Builds the session for one lookup. A query already on the wire cannot be recalled, so when the request
     * has less time left than the resolver would wait, the session gets a resolver that gives up with the
     * request. Abandoned queries then never outlive the request that started them.
     */
    private LookupSession getLookupSession(Duration remaining) throws DnsResolutionException {
        var resolver = _resolver;
        if (_config != null && remaining.compareTo(_resolver.getTimeout()) < 0) {
            try {
                resolver = makeResolver(_config, remaining);
            } catch (UnknownHostException e) {
                throw new DnsResolutionException("Cannot create resolver: " + e.getMessage(), e);
            }
        }

        return LookupSession.builder()
                .resolver(resolver)
                .executor(_executor)
                .build();
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
