package cz.vut.fit.txtdirect.http;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * The lifetime of one inbound request: its deadline and a cancellation signal completed when the client goes away.
 * Blocking lookups and forwarded calls made on behalf of the request wait at most until either fires.
 */
public final class RequestScope {
    private final Instant _deadline;
    private final CompletableFuture<Void> _cancellation = new CompletableFuture<>();

    private RequestScope(Instant deadline) {
        _deadline = deadline;
    }

    public static RequestScope withTimeout(@NotNull Duration timeout) {
        return new RequestScope(Instant.now().plus(timeout));
    }

    public static RequestScope unbounded() {
        return new RequestScope(Instant.MAX);
    }

    @NotNull
    public Instant deadline() {
        return _deadline;
    }

    /**
     * The time left until the deadline, never negative.
     */
    @NotNull
    public Duration remaining() {
        if (_deadline.equals(Instant.MAX))
            return Duration.ofMillis(Long.MAX_VALUE);

        final var left = Duration.between(Instant.now(), _deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return remaining().isZero();
    }

    public void cancel() {
        _cancellation.complete(null);
    }

    public boolean isCancelled() {
        return _cancellation.isDone();
    }

    /**
     * A future completed when the request is cancelled. Callers may combine it with their own pending work.
     */
    @NotNull
    public CompletableFuture<Void> cancellation() {
        return _cancellation.copy();
    }
}
