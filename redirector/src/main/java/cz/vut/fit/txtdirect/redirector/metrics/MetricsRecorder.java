package cz.vut.fit.txtdirect.redirector.metrics;

import org.jetbrains.annotations.NotNull;

/**
 * Counts handled requests. Implementations are shared by all requests and must be thread-safe.
 */
public interface MetricsRecorder {
    /**
     * A recorder that discards everything, used when metrics are disabled.
     */
    MetricsRecorder NOOP = new MetricsRecorder() {
        @Override
        public void requestByType(@NotNull String host, @NotNull String type) {
        }

        @Override
        public void responseByStatus(@NotNull String host, int status) {
        }

        @Override
        public void pathRedirect(@NotNull String host, @NotNull String path) {
        }
    };

    void requestByType(@NotNull String host, @NotNull String type);

    void responseByStatus(@NotNull String host, int status);

    void pathRedirect(@NotNull String host, @NotNull String path);
}
