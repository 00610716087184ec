package cz.vut.fit.txtdirect.models;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything resolved while answering one request: the chain of records (the apex record followed by every
 * upstream or path hop), the response headers they requested and the upstream zone suffix.
 * <p>
 * An instance is created for a single request and is never shared between threads.
 */
public final class ResolutionContext {
    private final List<RedirectRecord> _records = new ArrayList<>();
    private final Map<String, String> _headers = new LinkedHashMap<>();
    private List<String> _pathCaptures = List.of();
    private String _pathRemainder = "";
    private String _upstreamZone;

    /**
     * Appends a resolved record and merges its headers; a later record overrides same-named headers.
     */
    public void addRecord(@NotNull RedirectRecord record) {
        _records.add(record);
        _headers.putAll(record.headers());
    }

    @NotNull
    public List<RedirectRecord> records() {
        return Collections.unmodifiableList(_records);
    }

    public boolean hasRecords() {
        return !_records.isEmpty();
    }

    @Nullable
    public RedirectRecord lastRecord() {
        return _records.isEmpty() ? null : _records.get(_records.size() - 1);
    }

    /**
     * Headers collected from all resolved records. The dispatcher copies them to the response after every
     * resolution stage, so headers of an apex record survive a failed upstream hop.
     */
    @NotNull
    public Map<String, String> headers() {
        return Collections.unmodifiableMap(_headers);
    }

    /**
     * The upstream zone with its first label stripped. Set only when a {@code use=} indirection succeeded.
     */
    @Nullable
    public String upstreamZone() {
        return _upstreamZone;
    }

    public void setUpstreamZone(@Nullable String upstreamZone) {
        _upstreamZone = upstreamZone;
    }

    /**
     * Path segments captured while mapping a path record to its sub-zone, exposed as {@code {1}}..{@code {N}}.
     */
    @NotNull
    public List<String> pathCaptures() {
        return _pathCaptures;
    }

    /**
     * The part of the request path not consumed by the sub-zone mapping, exposed as {@code {remainder}}.
     */
    @NotNull
    public String pathRemainder() {
        return _pathRemainder;
    }

    public void setPathMapping(@NotNull List<String> captures, @NotNull String remainder) {
        _pathCaptures = List.copyOf(captures);
        _pathRemainder = remainder;
    }
}
