package cz.vut.fit.txtdirect.http;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A {@link ResponseSink} that keeps the whole response in memory until the transport writes it out.
 */
public class BufferedResponseSink implements ResponseSink {
    private final Map<String, List<String>> _headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private int _status;
    private byte[] _body = new byte[0];

    @Override
    public void setHeader(@NotNull String name, @NotNull String value) {
        final var values = new ArrayList<String>(1);
        values.add(value);
        _headers.put(name, values);
    }

    @Override
    public void addHeader(@NotNull String name, @NotNull String value) {
        _headers.computeIfAbsent(name, unused -> new ArrayList<>()).add(value);
    }

    @Override
    public void removeHeader(@NotNull String name) {
        _headers.remove(name);
    }

    @Override
    public @Nullable String header(@NotNull String name) {
        final var values = _headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    @Override
    public @NotNull Map<String, List<String>> headers() {
        final var copy = new LinkedHashMap<String, List<String>>();
        _headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public void redirect(@NotNull String location, int status) {
        ensureNotCommitted();
        setHeader(LOCATION_HEADER, location);
        _status = status;
    }

    @Override
    public void send(int status, byte @NotNull [] body) {
        ensureNotCommitted();
        _status = status;
        _body = body;
    }

    @Override
    public boolean isCommitted() {
        return _status != 0;
    }

    @Override
    public int status() {
        return _status;
    }

    @Override
    public byte @NotNull [] body() {
        return _body;
    }

    private void ensureNotCommitted() {
        if (isCommitted())
            throw new IllegalStateException("Response already committed with status " + _status);
    }
}
