package cz.vut.fit.txtdirect.http;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * The response being built for one request. Headers may be changed until a status is committed by
 * {@link #redirect(String, int)} or {@link #send(int, byte[])}; a response can be committed only once.
 */
public interface ResponseSink {
    String SERVER_HEADER = "Server";
    String SERVER_NAME = "TXTDirect";
    String STATUS_CODE_HEADER = "Status-Code";
    String LOCATION_HEADER = "Location";
    String CACHE_CONTROL_HEADER = "Cache-Control";
    String REFERER_HEADER = "Referer";
    String CONTENT_TYPE_HEADER = "Content-Type";

    void setHeader(@NotNull String name, @NotNull String value);

    void addHeader(@NotNull String name, @NotNull String value);

    void removeHeader(@NotNull String name);

    @Nullable
    String header(@NotNull String name);

    @NotNull
    Map<String, List<String>> headers();

    /**
     * Commits a redirect: sets the Location header and the status.
     *
     * @throws IllegalStateException if the response has already been committed
     */
    void redirect(@NotNull String location, int status);

    /**
     * Commits a response with the given status and body.
     *
     * @throws IllegalStateException if the response has already been committed
     */
    void send(int status, byte @NotNull [] body);

    boolean isCommitted();

    /**
     * The committed status, or 0 if nothing has been committed yet.
     */
    int status();

    byte @NotNull [] body();
}
