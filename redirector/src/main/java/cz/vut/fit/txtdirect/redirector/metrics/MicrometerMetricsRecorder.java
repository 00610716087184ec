package cz.vut.fit.txtdirect.redirector.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.jetbrains.annotations.NotNull;

/**
 * Records request counters in a Micrometer registry.
 */
public class MicrometerMetricsRecorder implements MetricsRecorder {
    public static final String REQUESTS_BY_TYPE = "txtdirect.requests.type";
    public static final String REQUESTS_BY_STATUS = "txtdirect.requests.status";
    public static final String PATH_REDIRECTS = "txtdirect.requests.path";

    private final MeterRegistry _registry;

    public MicrometerMetricsRecorder(@NotNull MeterRegistry registry) {
        _registry = registry;
    }

    @Override
    public void requestByType(@NotNull String host, @NotNull String type) {
        counter(REQUESTS_BY_TYPE, "type", host, type).increment();
    }

    @Override
    public void responseByStatus(@NotNull String host, int status) {
        counter(REQUESTS_BY_STATUS, "status", host, Integer.toString(status)).increment();
    }

    @Override
    public void pathRedirect(@NotNull String host, @NotNull String path) {
        counter(PATH_REDIRECTS, "path", host, path).increment();
    }

    @NotNull
    public MeterRegistry registry() {
        return _registry;
    }

    /**
     * The sum of all counters with the given name.
     */
    public double total(@NotNull String name) {
        return _registry.find(name).counters().stream().mapToDouble(Counter::count).sum();
    }

    // The registry returns the existing counter for a known name and tags
    private Counter counter(String name, String tag, String host, String value) {
        return Counter.builder(name)
                .tag("host", host)
                .tag(tag, value)
                .register(_registry);
    }
}
