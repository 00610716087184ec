package cz.vut.fit.txtdirect.redirector;

import cz.vut.fit.txtdirect.RedirectorConfig;
import cz.vut.fit.txtdirect.TxtDirectConfig;
import cz.vut.fit.txtdirect.exceptions.DnsResolutionException;
import cz.vut.fit.txtdirect.exceptions.TypeHandlerException;
import cz.vut.fit.txtdirect.http.BufferedResponseSink;
import cz.vut.fit.txtdirect.http.RedirectRequest;
import cz.vut.fit.txtdirect.http.RequestScope;
import cz.vut.fit.txtdirect.http.ResponseSink;
import cz.vut.fit.txtdirect.models.FallbackMode;
import cz.vut.fit.txtdirect.models.RecordType;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import cz.vut.fit.txtdirect.redirector.handlers.ProxyForwarder;
import cz.vut.fit.txtdirect.redirector.metrics.MicrometerMetricsRecorder;
import cz.vut.fit.txtdirect.resolver.TxtLookup;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RedirectDispatcherTest {

    private static final String FALLBACK = "https://fallback.test";
    private static final Set<RecordType> DEFAULT_TYPES =
            EnumSet.of(RecordType.HOST, RecordType.PATH, RecordType.GOMETA, RecordType.DOCKERV2);

    private ProxyForwarder _proxy;
    private MicrometerMetricsRecorder _metrics;

    @BeforeEach
    void setUp() {
        _proxy = mock(ProxyForwarder.class);
        _metrics = new MicrometerMetricsRecorder(new SimpleMeterRegistry());
    }

    /**
     * A lookup answering from a map of absolute zone names to single TXT answers.
     */
    private static TxtLookup lookup(Map<String, String> zones) {
        return (zone, scope) -> {
            final var txt = zones.get(zone);
            if (txt == null)
                throw new DnsResolutionException("No such domain: " + zone);
            return List.of(txt);
        };
    }

    private RedirectDispatcher dispatcher(TxtDirectConfig config, Map<String, String> zones) {
        return RedirectDispatcher.create(config, lookup(zones), _proxy, _metrics);
    }

    private RedirectDispatcher dispatcher(Map<String, String> zones) {
        return dispatcher(TxtDirectConfig.withEnabled(DEFAULT_TYPES, FALLBACK), zones);
    }

    private static BufferedResponseSink dispatch(RedirectDispatcher dispatcher, RedirectRequest request) {
        final var sink = new BufferedResponseSink();
        dispatcher.dispatch(request, sink);
        assertTrue(sink.isCommitted());
        assertEquals(ResponseSink.SERVER_NAME, sink.header(ResponseSink.SERVER_HEADER));
        return sink;
    }

    private static BufferedResponseSink dispatch(RedirectDispatcher dispatcher, String host, String path) {
        return dispatch(dispatcher, RedirectRequest.builder().scheme("https").host(host).path(path).build());
    }

    private static void assertRedirect(BufferedResponseSink sink, int status, String location) {
        assertEquals(status, sink.status());
        assertEquals(location, sink.header(ResponseSink.LOCATION_HEADER));
    }

    @Test
    void hostRecordRedirects() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.h.example.test.", "type=host;to=https://example.com/;code=302")), "h.example.test", "/");

        assertRedirect(sink, 302, "https://example.com/");
        assertEquals("302", sink.header(ResponseSink.STATUS_CODE_HEADER));
        assertNull(sink.header(ResponseSink.CACHE_CONTROL_HEADER));
    }

    @Test
    void permanentHostRedirectIsCached() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.h.example.test.", "v=txtv0;to=https://example.com/{label1}{path};code=301")),
                "h.example.test", "/docs");

        assertRedirect(sink, 301, "https://example.com/h/docs");
        assertEquals("max-age=604800", sink.header(ResponseSink.CACHE_CONTROL_HEADER));
    }

    @Test
    void hostWithoutTargetUsesGlobalFallbackWithoutCaching() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.h.example.test.", "type=host;code=301")), "h.example.test", "/");

        assertRedirect(sink, 301, FALLBACK);
        assertNull(sink.header(ResponseSink.CACHE_CONTROL_HEADER));
    }

    @Test
    void globalFallbackWithoutRedirectIsNotFound() {
        final var config = TxtDirectConfig.withEnabled(DEFAULT_TYPES, "");
        final var sink = dispatch(dispatcher(config, Map.of()), "missing.example.test", "/");

        assertEquals(404, sink.status());
        assertTrue(new String(sink.body(), StandardCharsets.UTF_8).contains("404"));
    }

    @Test
    void resolutionFailureRedirectsToGlobalTarget() {
        final var sink = dispatch(dispatcher(Map.of()), "missing.example.test", "/");
        assertRedirect(sink, 302, FALLBACK);
    }

    @Test
    void wildcardRecordIsUsed() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect._.example.test.", "to=https://wildcard.test")), "any.example.test", "/");
        assertRedirect(sink, 302, "https://wildcard.test");
    }

    @Test
    void blacklistedPathIsNotFoundWithoutLookup() throws DnsResolutionException {
        final var lookup = mock(TxtLookup.class);
        final var dispatcher = RedirectDispatcher.create(
                TxtDirectConfig.withEnabled(DEFAULT_TYPES, FALLBACK), lookup, _proxy, _metrics);

        final var sink = dispatch(dispatcher, "h.example.test", "/favicon.ico");

        assertEquals(404, sink.status());
        assertEquals("404", sink.header(ResponseSink.STATUS_CODE_HEADER));
        verify(lookup, never()).lookup(anyString(), any(RequestScope.class));
    }

    @ParameterizedTest
    @ValueSource(strings = {"127.0.0.1", "192.168.1.2:8080", "[2001:db8:1234::1]"})
    void ipHostUsesGlobalFallbackWithoutLookup(String host) throws DnsResolutionException {
        final var lookup = mock(TxtLookup.class);
        final var dispatcher = RedirectDispatcher.create(
                TxtDirectConfig.withEnabled(DEFAULT_TYPES, ""), lookup, _proxy, _metrics);

        final var sink = dispatch(dispatcher, host, "/test");

        assertEquals(404, sink.status());
        verify(lookup, never()).lookup(anyString(), any(RequestScope.class));
    }

    @Test
    void ipHostRedirectsPermanentlyToGlobalTarget() {
        final var sink = dispatch(dispatcher(Map.of()), "127.0.0.1", "/test");
        assertRedirect(sink, 301, FALLBACK);
    }

    @ParameterizedTest
    @ValueSource(strings = {"host", "path", "gometa"})
    void fromAndReTogetherUseToFallback(String type) {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.h.example.test.",
                "type=" + type + ";to=https://to.test;from=/$1;re=^/([a-z]+);code=307")),
                "h.example.test", "/docs");

        assertRedirect(sink, 307, "https://to.test");
    }

    @Test
    void refererIsAddedWhenRequested() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.h.example.test.", "to=https://plain.host.test;type=host;ref=true")),
                "h.example.test", "/");

        assertRedirect(sink, 302, "https://plain.host.test");
        assertEquals("h.example.test", sink.header(ResponseSink.REFERER_HEADER));
    }

    @Test
    void recordHeadersAreApplied() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.h.example.test.", "to=https://x.test;>TestHeader=TestValue;>Link=%3Chttps%3A%2F%2Fx%3E")),
                "h.example.test", "/");

        assertEquals("TestValue", sink.header("TestHeader"));
        assertEquals("<https://x>", sink.header("Link"));
    }

    @Test
    void disabledTypeUsesGlobalFallback() {
        final var config = TxtDirectConfig.withEnabled(EnumSet.of(RecordType.HOST), FALLBACK);
        final var sink = dispatch(dispatcher(config, Map.of(
                "_redirect.h.example.test.", "type=gometa;to=https://x.test")), "h.example.test", "/");

        assertRedirect(sink, 302, FALLBACK);
    }

    @Test
    void upstreamRecordIsFollowed() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.h.example.test.", "use=_redirect.missing.test;use=_redirect.up.test;>X-Apex=a",
                "_redirect.up.test.", "to=https://up.test;>X-Up=u")), "h.example.test", "/");

        assertRedirect(sink, 302, "https://up.test");
        assertEquals("a", sink.header("X-Apex"));
        assertEquals("u", sink.header("X-Up"));
    }

    @Test
    void upstreamHeaderOverridesApexHeader() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.h.example.test.", "use=_redirect.up.test;>X-Shared=apex;>X-Apex=a",
                "_redirect.up.test.", "to=https://up.test;>X-Shared=up")), "h.example.test", "/");

        assertRedirect(sink, 302, "https://up.test");
        assertEquals(List.of("up"), sink.headers().get("X-Shared"));
        assertEquals("a", sink.header("X-Apex"));
    }

    @Test
    void exhaustedUpstreamUsesGlobalFallback() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.h.example.test.", "use=_redirect.missing.test;>X-Apex=a")), "h.example.test", "/");

        assertRedirect(sink, 302, FALLBACK);
        assertEquals("a", sink.header("X-Apex"));
    }

    @Test
    void unsupportedUpstreamTypeUsesGlobalFallback() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.h.example.test.", "use=_redirect.up.test",
                "_redirect.up.test.", "type=ftp;use=_redirect.other.test")), "h.example.test", "/");

        assertRedirect(sink, 302, FALLBACK);
    }

    @Test
    void pathRootRedirectsToRoot() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.p.example.test.", "type=path;root=https://root.test;code=301")), "p.example.test", "/");

        assertRedirect(sink, 301, "https://root.test");
        assertEquals("max-age=604800", sink.header(ResponseSink.CACHE_CONTROL_HEADER));
    }

    @Test
    void pathRootWithoutRootUsesToFallback() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.p.example.test.", "type=path;to=https://to.test")), "p.example.test", "/");

        assertRedirect(sink, 302, "https://to.test");
    }

    @Test
    void pathResolvesSubZone() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.p.example.test.", "type=path;to=https://to.test;>X-Path=p",
                "_redirect.docs.p.example.test.", "to=https://docs.test{remainder};>X-Docs=d")),
                "p.example.test", "/docs/intro/start");

        assertRedirect(sink, 302, "https://docs.test/intro/start");
        assertEquals("p", sink.header("X-Path"));
        assertEquals("d", sink.header("X-Docs"));
        assertEquals(1.0, _metrics.total(MicrometerMetricsRecorder.PATH_REDIRECTS));
    }

    @Test
    void pathFromTemplateOrdersLabels() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.p.example.test.", "type=path;from=/$2/$1",
                "_redirect.v1.api.p.example.test.", "to=https://api.test/{1}/{2}{remainder}")),
                "p.example.test", "/v1/api/users");

        assertRedirect(sink, 302, "https://api.test/api/v1/users");
    }

    @Test
    void pathRegexCapturesLabels() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.p.example.test.", "type=path;re=^/release-([0-9]+)",
                "_redirect.42.p.example.test.", "to=https://releases.test/{1}{remainder}")),
                "p.example.test", "/release-42/notes");

        assertRedirect(sink, 302, "https://releases.test/42/notes");
    }

    @Test
    void unresolvedPathUsesToFallback() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.p.example.test.", "type=path;to=https://to.test;code=308")),
                "p.example.test", "/docs");

        assertRedirect(sink, 308, "https://to.test");
    }

    @Test
    void pathRecordCannotChain() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.p.example.test.", "type=path;to=https://to.test",
                "_redirect.docs.p.example.test.", "type=path;to=https://docs.test")),
                "p.example.test", "/docs");

        assertRedirect(sink, 302, "https://docs.test");
    }

    @Test
    void dockerRequiresDockerClient() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.r.example.test.", "type=dockerv2;to=https://registry.test/library/alpine")),
                "r.example.test", "/v2/alpine/manifests/latest");

        assertRedirect(sink, 302, "https://registry.test/library/alpine");
    }

    @Test
    void dockerClientIsRedirected() {
        final var request = RedirectRequest.builder()
                .host("r.example.test")
                .path("/v2/alpine/manifests/latest")
                .header("User-Agent", "docker/24.0.7 go/go1.20.10 Docker-Client/24.0.7 (linux)")
                .build();
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.r.example.test.", "type=dockerv2;to=https://registry.test/library/alpine:3.19")),
                request);

        assertRedirect(sink, 302, "https://registry.test/v2/library/alpine/manifests/3.19");
    }

    @Test
    void goMetaIsRenderedForGoGet() {
        final var request = RedirectRequest.builder()
                .host("pkg.example.test")
                .path("/txtdirect")
                .query("go-get=1")
                .build();
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.pkg.example.test.", "type=gometa;to=https://github.com/okkur/txtdirect")), request);

        assertEquals(200, sink.status());
        assertTrue(new String(sink.body(), StandardCharsets.UTF_8).contains(
                "<meta name=\"go-import\" content=\"pkg.example.test/txtdirect git https://github.com/okkur/txtdirect\">"));
    }

    @Test
    void goMetaWithoutGoGetUsesWebsiteFallback() {
        final var sink = dispatch(dispatcher(Map.of(
                "_redirect.pkg.example.test.",
                "type=gometa;to=https://github.com/okkur/txtdirect;website=https://about.test;code=301")),
                "pkg.example.test", "/txtdirect");

        assertRedirect(sink, 302, "https://about.test");
    }

    @Test
    void goModsRedirectsWhenEnabled() {
        final var properties = new Properties();
        properties.setProperty(RedirectorConfig.ENABLE_CONFIG, "gomods");
        properties.setProperty(RedirectorConfig.GOMODS_ENABLE_CONFIG, "true");
        final var config = TxtDirectConfig.fromProperties(properties);

        final var sink = dispatch(dispatcher(config, Map.of(
                "_redirect.mods.example.test.", "type=gomods")),
                "mods.example.test", "/github.com/okkur/reposeed-server/@v/list");

        assertRedirect(sink, 302, "https://proxy.golang.org/github.com/okkur/reposeed-server/@v/list");
    }

    @Test
    void proxyRecordIsForwarded() throws TypeHandlerException {
        final var config = TxtDirectConfig.withEnabled(EnumSet.of(RecordType.PROXY), FALLBACK);
        doAnswer(invocation -> {
            invocation.<ResponseSink>getArgument(0).send(200, "proxied".getBytes(StandardCharsets.UTF_8));
            return null;
        }).when(_proxy).forward(any(), any(), any());

        final var sink = dispatch(dispatcher(config, Map.of(
                "_redirect.h.example.test.", "type=proxy;to=https://upstream.test")), "h.example.test", "/a");

        assertEquals(200, sink.status());
        assertEquals("proxied", new String(sink.body(), StandardCharsets.UTF_8));
        verify(_proxy).forward(any(), any(), any(RedirectRecord.class));
    }

    @Test
    void proxyFailureUsesToFallback() throws TypeHandlerException {
        final var config = TxtDirectConfig.withEnabled(EnumSet.of(RecordType.PROXY), FALLBACK);
        doThrow(new TypeHandlerException("connection refused", FallbackMode.TO, 302))
                .when(_proxy).forward(any(), any(), any());

        final var sink = dispatch(dispatcher(config, Map.of(
                "_redirect.h.example.test.", "type=proxy;to=https://upstream.test")), "h.example.test", "/a");

        assertRedirect(sink, 302, "https://upstream.test");
    }

    @Test
    void unexpectedErrorUsesGlobalFallback() throws TypeHandlerException {
        final var config = TxtDirectConfig.withEnabled(EnumSet.of(RecordType.PROXY), FALLBACK);
        doThrow(new IllegalStateException("boom")).when(_proxy).forward(any(), any(), any());

        final var sink = dispatch(dispatcher(config, Map.of(
                "_redirect.h.example.test.", "type=proxy;to=https://upstream.test")), "h.example.test", "/a");

        assertRedirect(sink, 302, FALLBACK);
    }

    @Test
    void countsResponsesByStatus() {
        final var dispatcher = dispatcher(Map.of("_redirect.h.example.test.", "to=https://x.test"));
        dispatch(dispatcher, "h.example.test", "/");
        dispatch(dispatcher, "h.example.test", "/favicon.ico");

        assertEquals(2.0, _metrics.total(MicrometerMetricsRecorder.REQUESTS_BY_STATUS));
        assertEquals(1.0, _metrics.total(MicrometerMetricsRecorder.REQUESTS_BY_TYPE));
        assertEquals(1.0, _metrics.registry().get(MicrometerMetricsRecorder.REQUESTS_BY_STATUS)
                .tag("host", "h.example.test").tag("status", "404").counter().count());
    }
}
